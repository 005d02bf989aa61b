package org.carball.rightsizer.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.analyzer.SkuClassifier;
import org.carball.rightsizer.model.analysis.AnalysisReport;
import org.carball.rightsizer.model.analysis.CandidateResult;
import org.carball.rightsizer.model.analysis.RecommendationType;
import org.carball.rightsizer.model.analysis.RegionAlternative;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.recommendation.AIRecommendation;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders an {@link AnalysisReport} as JSON, Markdown or CSV.
 */
@Slf4j
public class RightsizingReport {

    static final List<String> CSV_COLUMNS = List.of(
            "VM Name",
            "Resource Group",
            "Location",
            "Current SKU",
            "Current Cost (Monthly)",
            "Recommended SKU",
            "Recommended Cost (Monthly)",
            "Monthly Savings",
            "Annual Savings",
            "Savings %",
            "Recommendation Type",
            "Priority",
            "Confidence",
            "Avg CPU %",
            "Max CPU %",
            "Avg Memory %",
            "Current Generation",
            "Recommended Generation",
            "Deployment Feasible",
            "Constraint Issues",
            "Power State",
            "OS Type"
    );

    private static final String NOT_AVAILABLE = "N/A";
    private static final int TOP_OPPORTUNITIES = 10;

    private final AnalysisReport report;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public RightsizingReport(AnalysisReport report) {
        this.report = report;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toCsv() {
        CsvSchema.Builder schema = CsvSchema.builder();
        CSV_COLUMNS.forEach(schema::addColumn);

        List<Map<String, String>> rows = report.getResults().stream()
                .map(this::csvRow)
                .collect(Collectors.toList());
        try {
            return csvMapper.writer(schema.build().withHeader()).writeValueAsString(rows);
        } catch (Exception e) {
            log.error("Error generating CSV report", e);
            throw new RuntimeException("Failed to generate CSV report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# VM Rightsizing Report\n\n");
        md.append("**Generated:** ").append(formatTimestamp(report.getTimestamp())).append("  \n");
        md.append("**Scope:** ").append(report.getScope()).append("  \n\n");

        md.append("## Executive Summary\n\n");
        md.append(report.getExecutiveSummary()).append("\n\n");

        md.append("## Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Total Instances | ").append(report.getTotalInstances()).append(" |\n");
        md.append("| Instances Analyzed | ").append(report.getAnalyzedInstances()).append(" |\n");
        md.append("| Instances With Recommendations | ").append(report.getInstancesWithRecommendations()).append(" |\n");
        md.append("| Current Monthly Cost | ").append(money(report.getTotalCurrentCost())).append(" |\n");
        md.append("| Potential Monthly Savings | ").append(money(report.getTotalPotentialSavings())).append(" |\n");
        md.append("| Potential Annual Savings | ").append(money(report.getTotalAnnualSavings())).append(" |\n\n");

        md.append("### Recommendations by Type\n\n");
        md.append("| Type | Count |\n");
        md.append("|------|-------|\n");
        for (RecommendationType type : RecommendationType.values()) {
            if (type != RecommendationType.NONE) {
                md.append("| ").append(type.getDisplayName()).append(" | ").append(report.countFor(type)).append(" |\n");
            }
        }
        md.append("\n");

        List<RightsizingResult> opportunities = report.getResults().stream()
                .filter(RightsizingResult::hasSavings)
                .limit(TOP_OPPORTUNITIES)
                .toList();

        md.append("## Top Opportunities\n\n");
        if (opportunities.isEmpty()) {
            md.append("**No savings opportunities were found.**\n\n");
        } else {
            md.append("| Instance | Current SKU | Recommended SKU | Type | Priority | Monthly Savings |\n");
            md.append("|----------|-------------|-----------------|------|----------|-----------------|\n");
            for (RightsizingResult result : opportunities) {
                md.append("| ").append(result.getInstance().getName())
                        .append(" | ").append(result.getInstance().getVmSize())
                        .append(" | ").append(result.recommendedSku())
                        .append(" | ").append(result.getRecommendationType().getDisplayName())
                        .append(" | ").append(result.getPriority().getDisplayName())
                        .append(" | ").append(money(result.getTotalPotentialSavings()))
                        .append(" |\n");
            }
            md.append("\n");
        }

        md.append("## Instance Details\n\n");
        for (RightsizingResult result : opportunities) {
            appendInstanceDetails(md, result);
        }

        List<RightsizingResult> blocked = report.getResults().stream()
                .filter(result -> !result.isDeploymentFeasible())
                .toList();
        if (!blocked.isEmpty()) {
            md.append("## Deployment Constraints\n\n");
            for (RightsizingResult result : blocked) {
                md.append("- **").append(result.getInstance().getName()).append(":** ")
                        .append(String.join("; ", result.getConstraintIssues())).append("\n");
            }
            md.append("\n");
        }

        md.append("## Next Steps\n\n");
        md.append("1. **Review Recommendations:** Confirm high-priority changes with workload owners\n");
        md.append("2. **Quick Wins:** Shut down idle instances and apply generation upgrades first\n");
        md.append("3. **Validate Capacity:** Re-check quota and zone availability before resizing\n");
        md.append("4. **Monitor:** Watch utilization for two weeks after each change\n\n");

        md.append("---\n\n");
        md.append("*Generated by VM Rightsizer*\n");

        return md.toString();
    }

    private void appendInstanceDetails(StringBuilder md, RightsizingResult result) {
        InstanceDescriptor instance = result.getInstance();
        md.append("### ").append(instance.getName()).append("\n\n");
        md.append("- **Resource Group:** ").append(instance.getResourceGroup()).append("\n");
        md.append("- **Region:** ").append(instance.getRegion()).append("\n");
        md.append("- **Current SKU:** ").append(instance.getVmSize())
                .append(" (").append(money(instance.monthlyCostOrZero())).append("/month)\n");
        md.append("- **Recommended SKU:** ").append(result.recommendedSku()).append("\n");
        md.append("- **Utilization:** CPU avg ").append(percent(instance.getAvgCpu()))
                .append(", max ").append(percent(instance.getMaxCpu()))
                .append("; memory avg ").append(percent(instance.getAvgMemory())).append("\n");

        if (result.getRecommendedGenerationUpgrade() != null) {
            md.append("- **Generation Upgrade:** ").append(result.getRecommendedGenerationUpgrade())
                    .append(" saves ").append(money(result.getGenerationSavings())).append("/month\n");
        }
        result.bestRegion().ifPresent(region ->
                md.append("- **Cheaper Region:** ").append(region.region())
                        .append(" saves ").append(money(region.savings())).append("/month\n"));

        AIRecommendation ai = result.getAiRecommendation();
        if (ai != null) {
            md.append("- **AI Confidence:** ").append(ai.confidence().getDisplayName()).append("\n");
            md.append("- **AI Reasoning:** ").append(ai.reasoning()).append("\n");
            if (!ai.recommendedActions().isEmpty()) {
                md.append("- **Actions:**\n");
                ai.recommendedActions().forEach(action -> md.append("  - ").append(action).append("\n"));
            }
        }
        for (String warning : result.getQuotaWarnings()) {
            md.append("- ⚠️ ").append(warning).append("\n");
        }
        md.append("\n");
    }

    private Map<String, String> csvRow(RightsizingResult result) {
        InstanceDescriptor instance = result.getInstance();
        Double currentMonthly = instance.getCurrentPriceMonthly();
        boolean priced = currentMonthly != null && currentMonthly > 0;
        double savings = result.getTotalPotentialSavings();

        Map<String, String> row = new LinkedHashMap<>();
        row.put("VM Name", instance.getName());
        row.put("Resource Group", instance.getResourceGroup());
        row.put("Location", instance.getRegion());
        row.put("Current SKU", instance.getVmSize());
        row.put("Current Cost (Monthly)", priced ? decimal(currentMonthly) : NOT_AVAILABLE);
        row.put("Recommended SKU", result.recommendedSku());
        row.put("Recommended Cost (Monthly)", priced ? decimal(currentMonthly - savings) : NOT_AVAILABLE);
        row.put("Monthly Savings", decimal(savings));
        row.put("Annual Savings", decimal(savings * 12));
        row.put("Savings %", String.format(Locale.ROOT, "%.1f%%", priced ? savings / currentMonthly * 100 : 0.0));
        row.put("Recommendation Type", result.getRecommendationType().getCode());
        row.put("Priority", result.getPriority().getDisplayName());
        row.put("Confidence", result.getAiRecommendation() != null
                ? result.getAiRecommendation().confidence().getDisplayName()
                : NOT_AVAILABLE);
        row.put("Avg CPU %", oneDecimal(instance.getAvgCpu()));
        row.put("Max CPU %", oneDecimal(instance.getMaxCpu()));
        row.put("Avg Memory %", oneDecimal(instance.getAvgMemory()));
        row.put("Current Generation", result.getCurrentGeneration().isEmpty() ? NOT_AVAILABLE : result.getCurrentGeneration());
        row.put("Recommended Generation", result.getRecommendedGenerationUpgrade() != null
                ? SkuClassifier.extractGeneration(result.getRecommendedGenerationUpgrade())
                : NOT_AVAILABLE);
        row.put("Deployment Feasible", result.isDeploymentFeasible() ? "Yes" : "No");
        row.put("Constraint Issues", result.getConstraintIssues().isEmpty()
                ? "None"
                : String.join("; ", result.getConstraintIssues()));
        row.put("Power State", instance.getPowerState());
        row.put("OS Type", instance.getOsType());
        return row;
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        data.setTimestamp(report.getTimestamp());
        data.setScope(report.getScope());

        Summary summary = new Summary();
        summary.setTotalInstances(report.getTotalInstances());
        summary.setAnalyzedInstances(report.getAnalyzedInstances());
        summary.setInstancesWithRecommendations(report.getInstancesWithRecommendations());
        summary.setTotalCurrentCost(report.getTotalCurrentCost());
        summary.setTotalPotentialSavings(report.getTotalPotentialSavings());
        summary.setTotalAnnualSavings(report.getTotalAnnualSavings());
        summary.setShutdownCandidates(report.countFor(RecommendationType.SHUTDOWN));
        summary.setRightsizeCandidates(report.countFor(RecommendationType.RIGHTSIZE));
        summary.setGenerationUpgradeCandidates(report.countFor(RecommendationType.GENERATION_UPGRADE));
        summary.setRegionMoveCandidates(report.countFor(RecommendationType.REGION_MOVE));
        data.setSummary(summary);

        data.setExecutiveSummary(report.getExecutiveSummary());
        data.setResults(report.getResults().stream().map(this::toEntry).collect(Collectors.toList()));
        return data;
    }

    private ResultEntry toEntry(RightsizingResult result) {
        InstanceDescriptor instance = result.getInstance();

        ResultEntry entry = new ResultEntry();
        entry.setInstanceName(instance.getName());
        entry.setResourceGroup(instance.getResourceGroup());
        entry.setRegion(instance.getRegion());
        entry.setCurrentSku(instance.getVmSize());
        entry.setOsType(instance.getOsType());
        entry.setPowerState(instance.getPowerState());
        entry.setCurrentMonthlyCost(instance.getCurrentPriceMonthly());
        entry.setRecommendedSku(result.recommendedSku());
        entry.setRecommendationType(result.getRecommendationType());
        entry.setPriority(result.getPriority().getDisplayName());
        entry.setPotentialMonthlySavings(result.getTotalPotentialSavings());
        entry.setPotentialAnnualSavings(result.getTotalPotentialSavings() * 12);
        entry.setCurrentGeneration(result.getCurrentGeneration());
        entry.setRecommendedGeneration(result.getRecommendedGenerationUpgrade());
        entry.setDeploymentFeasible(result.isDeploymentFeasible());
        entry.setConstraintIssues(result.getConstraintIssues());
        entry.setQuotaWarnings(result.getQuotaWarnings());

        Metrics metrics = new Metrics();
        metrics.setAvgCpu(instance.getAvgCpu());
        metrics.setMaxCpu(instance.getMaxCpu());
        metrics.setAvgMemory(instance.getAvgMemory());
        metrics.setMaxMemory(instance.getMaxMemory());
        entry.setMetrics(metrics);

        AdvisorHint hint = result.getAdvisorHint();
        if (hint != null) {
            AdvisorEntry advisor = new AdvisorEntry();
            advisor.setRecommendedSku(hint.recommendedSku());
            advisor.setProblem(hint.problem());
            advisor.setSolution(hint.solution());
            entry.setAdvisorRecommendation(advisor);
        }

        entry.setAiRecommendation(result.getAiRecommendation());
        entry.setCheaperRegions(result.getCheaperRegions());
        entry.setTopAlternatives(result.getRankedCandidates().stream()
                .limit(5)
                .map(RightsizingReport::toAlternative)
                .collect(Collectors.toList()));
        return entry;
    }

    private static Alternative toAlternative(CandidateResult candidate) {
        Alternative alternative = new Alternative();
        alternative.setSku(candidate.getSkuName());
        alternative.setVcpus(candidate.getVcpus());
        alternative.setMemoryGb(candidate.getMemoryGb());
        alternative.setMonthlyPrice(candidate.getMonthlyPrice());
        alternative.setSavings(candidate.getSavings());
        alternative.setScore(candidate.getScore());
        alternative.setValid(candidate.isValid());
        alternative.setValidationIssues(candidate.getValidationIssues());
        return alternative;
    }

    private static String formatTimestamp(Instant timestamp) {
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp.atOffset(ZoneOffset.UTC)) + "Z";
    }

    private static String money(double value) {
        return String.format(Locale.ROOT, "$%,.2f", value);
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String oneDecimal(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.1f", value) : NOT_AVAILABLE;
    }

    private static String percent(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.1f%%", value) : NOT_AVAILABLE;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private Instant timestamp;
        private String scope;
        private Summary summary;
        private String executiveSummary;
        private List<ResultEntry> results;
    }

    @lombok.Data
    private static class Summary {
        private int totalInstances;
        private int analyzedInstances;
        private int instancesWithRecommendations;
        private double totalCurrentCost;
        private double totalPotentialSavings;
        private double totalAnnualSavings;
        private int shutdownCandidates;
        private int rightsizeCandidates;
        private int generationUpgradeCandidates;
        private int regionMoveCandidates;
    }

    @lombok.Data
    private static class ResultEntry {
        private String instanceName;
        private String resourceGroup;
        private String region;
        private String currentSku;
        private String osType;
        private String powerState;
        private Double currentMonthlyCost;
        private String recommendedSku;
        private RecommendationType recommendationType;
        private String priority;
        private double potentialMonthlySavings;
        private double potentialAnnualSavings;
        private String currentGeneration;
        private String recommendedGeneration;
        private boolean deploymentFeasible;
        private List<String> constraintIssues;
        private List<String> quotaWarnings;
        private Metrics metrics;
        private AdvisorEntry advisorRecommendation;
        private AIRecommendation aiRecommendation;
        private List<RegionAlternative> cheaperRegions;
        private List<Alternative> topAlternatives;
    }

    @lombok.Data
    private static class Metrics {
        private Double avgCpu;
        private Double maxCpu;
        private Double avgMemory;
        private Double maxMemory;
    }

    @lombok.Data
    private static class AdvisorEntry {
        private String recommendedSku;
        private String problem;
        private String solution;
    }

    @lombok.Data
    private static class Alternative {
        private String sku;
        private int vcpus;
        private double memoryGb;
        private double monthlyPrice;
        private double savings;
        private double score;
        private boolean valid;
        private List<String> validationIssues;
    }
}
