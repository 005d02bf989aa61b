package org.carball.rightsizer.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.carball.rightsizer.model.analysis.AnalysisReport;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.recommendation.Confidence;
import org.carball.rightsizer.model.sku.PriceMath;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuFeature;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class PromptBuilder {

    static final int MAX_PROMPT_SKUS = 20;
    static final int MAX_SUMMARY_OPPORTUNITIES = 5;

    static final String SYSTEM_PROMPT = """
        You are a cloud FinOps expert specializing in virtual machine rightsizing.
        Your expertise includes:

        - Reading CPU and memory utilization to judge over- and under-provisioning
        - VM families, hardware generations and their price/performance trade-offs
        - Migration risk for production, development and test workloads

        You must respond with valid JSON that matches the requested structure exactly.
        Do not include any text outside of the JSON response.
        """;

    static final String SUMMARY_SYSTEM_PROMPT = """
        You are a cloud FinOps expert writing for engineering management.
        Be concise, concrete and use plain prose.
        """;

    // Insertion order is match priority
    private static final Map<String, List<String>> ENVIRONMENT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> ROLE_KEYWORDS = new LinkedHashMap<>();

    static {
        ENVIRONMENT_KEYWORDS.put("production", List.of("prod", "prd", "production", "live"));
        ENVIRONMENT_KEYWORDS.put("staging", List.of("stg", "stage", "staging", "uat", "preprod"));
        ENVIRONMENT_KEYWORDS.put("test", List.of("test", "tst", "qa"));
        ENVIRONMENT_KEYWORDS.put("development", List.of("dev", "development", "sandbox"));

        ROLE_KEYWORDS.put("database server", List.of("sql", "db", "database", "mysql", "postgres", "mongo", "oracle"));
        ROLE_KEYWORDS.put("web server", List.of("web", "www", "iis", "nginx", "apache", "frontend"));
        ROLE_KEYWORDS.put("application server", List.of("app", "api", "backend", "svc", "service"));
        ROLE_KEYWORDS.put("cache", List.of("cache", "redis", "memcached"));
        ROLE_KEYWORDS.put("build agent", List.of("build", "agent", "jenkins", "ci", "runner"));
        ROLE_KEYWORDS.put("batch worker", List.of("batch", "worker", "job", "etl"));
        ROLE_KEYWORDS.put("machine learning", List.of("ml", "gpu", "train", "inference"));
        ROLE_KEYWORDS.put("domain controller", List.of("dc", "adds"));
    }

    private static final List<String> ENVIRONMENT_TAG_KEYS = List.of("environment", "env", "stage");

    private final ObjectMapper objectMapper;

    public PromptBuilder() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String getSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String getSummarySystemPrompt() {
        return SUMMARY_SYSTEM_PROMPT;
    }

    public String buildRecommendationPrompt(InstanceDescriptor instance,
                                            List<SkuDescriptor> candidates,
                                            Map<String, Double> hourlyPrices,
                                            AdvisorHint advisorHint) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("Analyze the following virtual machine and recommend the most cost-effective SKU ")
                .append("that still fits its workload.\n\n");

        prompt.append("## Current VM Information:\n");
        prompt.append(toJson(instanceNode(instance))).append("\n\n");

        prompt.append("## Available SKU Options:\n");
        prompt.append(toJson(skuOptions(candidates, hourlyPrices))).append("\n\n");

        prompt.append("## Advisor Recommendations:\n");
        if (advisorHint != null) {
            ObjectNode hint = objectMapper.createObjectNode();
            hint.put("problem", advisorHint.problem());
            hint.put("solution", advisorHint.solution());
            hint.put("recommended_sku", advisorHint.recommendedSku());
            hint.put("estimated_savings", advisorHint.estimatedSavings());
            prompt.append(toJson(hint)).append("\n\n");
        } else {
            prompt.append("No Advisor recommendations available\n\n");
        }

        prompt.append("## Pricing Data:\n");
        ObjectNode pricing = objectMapper.createObjectNode();
        pricing.put("current_region", instance.getRegion());
        Double currentHourly = hourlyPrices.get(instance.getVmSize());
        if (currentHourly != null) {
            pricing.put("current_sku_hourly_price", currentHourly);
        } else {
            pricing.put("current_sku_hourly_price", "Unknown");
        }
        prompt.append(toJson(pricing)).append("\n\n");

        prompt.append("""
            ## Response Format:
            Respond with a JSON object with exactly these fields:
            {
              "recommended_sku": "SKU name",
              "confidence": "High/Medium/Low",
              "reasoning": "Detailed explanation",
              "estimated_monthly_savings_usd": number,
              "risk_assessment": "Assessment of risks",
              "migration_complexity": "Low/Medium/High",
              "recommended_actions": ["action1", "action2"]
            }

            ## Consider:
            1. Performance requirements based on historical metrics
            2. Cost savings potential
            3. Generation upgrades (newer generations are often cheaper and faster)
            4. Workload patterns (burstable vs consistent)
            5. The risk of changing a production workload
            """);

        return prompt.toString();
    }

    public String buildSummaryPrompt(AnalysisReport report, List<RightsizingResult> topOpportunities) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Generate a concise executive summary for a virtual machine rightsizing analysis:\n\n");
        prompt.append("Total VMs Analyzed: ").append(report.getAnalyzedInstances()).append("\n");
        prompt.append("VMs with Recommendations: ").append(report.getInstancesWithRecommendations()).append("\n");
        prompt.append(String.format("Total Estimated Monthly Savings: $%,.2f%n", report.getTotalPotentialSavings()));
        prompt.append("\nRecommendations by confidence:\n");
        for (Confidence confidence : Confidence.values()) {
            prompt.append("- ").append(confidence.getDisplayName()).append(" confidence: ")
                    .append(countWithConfidence(report, confidence)).append("\n");
        }

        prompt.append("\nTop savings opportunities:\n");
        if (topOpportunities.isEmpty()) {
            prompt.append("No recommendations\n");
        }
        for (RightsizingResult result : topOpportunities) {
            prompt.append(String.format("- %s: %s -> %s ($%,.2f/month)%n",
                    result.getInstance().getName(), result.getInstance().getVmSize(),
                    result.recommendedSku(), result.getTotalPotentialSavings()));
        }

        prompt.append("""

            Provide a 2-3 paragraph executive summary suitable for presenting to management,
            highlighting key findings, quick wins, and recommended next steps.
            """);
        return prompt.toString();
    }

    /**
     * Environment from tags first, then from the instance name.
     */
    public static String inferEnvironment(InstanceDescriptor instance) {
        for (Map.Entry<String, String> tag : instance.getTags().entrySet()) {
            if (ENVIRONMENT_TAG_KEYS.contains(tag.getKey().toLowerCase(Locale.ROOT)) && tag.getValue() != null) {
                String fromTag = matchKeywords(tag.getValue(), ENVIRONMENT_KEYWORDS);
                if (fromTag != null) {
                    return fromTag;
                }
            }
        }

        String fromName = matchKeywords(instance.getName(), ENVIRONMENT_KEYWORDS);
        return fromName != null ? fromName : "unknown";
    }

    public static String inferWorkloadRole(InstanceDescriptor instance) {
        String role = matchKeywords(instance.getName(), ROLE_KEYWORDS);
        return role != null ? role : "general purpose";
    }

    static long countWithConfidence(AnalysisReport report, Confidence confidence) {
        return report.getResults().stream()
                .filter(result -> result.getAiRecommendation() != null)
                .filter(result -> result.getAiRecommendation().confidence() == confidence)
                .count();
    }

    private ObjectNode instanceNode(InstanceDescriptor instance) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", instance.getName());
        node.put("current_sku", instance.getVmSize());
        node.put("location", instance.getRegion());
        node.put("os_type", instance.getOsType());
        node.put("power_state", instance.getPowerState());
        node.put("environment", inferEnvironment(instance));
        node.put("workload_role", inferWorkloadRole(instance));
        node.put("data_disks", instance.getDataDiskCount());

        ObjectNode metrics = node.putObject("metrics");
        putMetric(metrics, "avg_cpu_percent", instance.getAvgCpu());
        putMetric(metrics, "max_cpu_percent", instance.getMaxCpu());
        putMetric(metrics, "avg_memory_percent", instance.getAvgMemory());
        putMetric(metrics, "max_memory_percent", instance.getMaxMemory());
        putMetric(metrics, "avg_disk_iops", instance.getAvgDiskIops());

        if (instance.getCurrentPriceMonthly() != null) {
            node.put("current_monthly_cost", PriceMath.round(instance.getCurrentPriceMonthly(), 2));
        } else {
            node.put("current_monthly_cost", "Unknown");
        }
        return node;
    }

    private ArrayNode skuOptions(List<SkuDescriptor> candidates, Map<String, Double> hourlyPrices) {
        ArrayNode options = objectMapper.createArrayNode();
        candidates.stream().limit(MAX_PROMPT_SKUS).forEach(sku -> {
            ObjectNode option = options.addObject();
            option.put("name", sku.name());
            option.put("vcpus", sku.vcpus());
            option.put("memory_gb", sku.memoryGb());
            option.put("generation", sku.generation());
            option.put("features", featureNames(sku.features()));

            Double hourly = hourlyPrices.get(sku.name());
            if (hourly != null && hourly > 0) {
                option.put("hourly_price", PriceMath.round(hourly, 4));
                option.put("monthly_price", PriceMath.round(PriceMath.toMonthly(hourly), 2));
            } else {
                option.put("hourly_price", "Unknown");
                option.put("monthly_price", "Unknown");
            }
        });
        return options;
    }

    private static String featureNames(Set<SkuFeature> features) {
        return features.stream().map(SkuFeature::getDisplayName).collect(Collectors.joining(", "));
    }

    private static void putMetric(ObjectNode metrics, String field, Double value) {
        if (value != null) {
            metrics.put(field, PriceMath.round(value, 2));
        } else {
            metrics.put(field, "N/A");
        }
    }

    private static String matchKeywords(String text, Map<String, List<String>> keywords) {
        if (text == null || text.isBlank()) {
            return null;
        }
        List<String> tokens = Arrays.asList(text.toLowerCase(Locale.ROOT).split("[^a-z]+"));
        for (Map.Entry<String, List<String>> entry : keywords.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (tokens.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    private String toJson(Object node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
