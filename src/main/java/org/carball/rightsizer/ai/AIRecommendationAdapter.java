package org.carball.rightsizer.ai;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.model.analysis.AnalysisReport;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.recommendation.AIRecommendation;
import org.carball.rightsizer.model.recommendation.Confidence;
import org.carball.rightsizer.model.sku.SkuDescriptor;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Asks a language model for per-instance recommendations and the run's executive summary.
 *
 * <p>Outbound calls share one semaphore, so the number of concurrent model requests stays
 * bounded no matter how many analysis workers run. Each attempt takes a permit; backoff
 * between retries does not hold one.</p>
 */
@Slf4j
public class AIRecommendationAdapter {

    public static final int DEFAULT_CONCURRENCY = 5;

    private static final int RECOMMENDATION_MAX_TOKENS = 2000;
    private static final int SUMMARY_MAX_TOKENS = 1000;

    private final CompletionProvider provider;
    private final Semaphore semaphore;
    private final RetryableOperation retry;
    private final PromptBuilder promptBuilder = new PromptBuilder();
    private final JsonResponseExtractor extractor = new JsonResponseExtractor();
    private final RecommendationNormalizer normalizer = new RecommendationNormalizer();

    public AIRecommendationAdapter(CompletionProvider provider, int concurrency) {
        this(provider, concurrency, RetryableOperation.forTransientFailures());
    }

    public AIRecommendationAdapter(CompletionProvider provider, int concurrency, RetryableOperation retry) {
        this.provider = provider;
        this.semaphore = new Semaphore(Math.max(1, concurrency), true);
        this.retry = retry;
    }

    public static AIRecommendationAdapter disabled() {
        return new AIRecommendationAdapter(null, DEFAULT_CONCURRENCY);
    }

    public boolean isAvailable() {
        return provider != null;
    }

    /**
     * Recommendation for one instance, empty when the adapter is disabled, the call fails or the
     * response holds no usable JSON.
     */
    public Optional<AIRecommendation> recommend(InstanceDescriptor instance,
                                                List<SkuDescriptor> candidates,
                                                Map<String, Double> hourlyPrices,
                                                AdvisorHint advisorHint) {
        if (!isAvailable()) {
            return Optional.empty();
        }

        String prompt = promptBuilder.buildRecommendationPrompt(instance, candidates, hourlyPrices, advisorHint);
        log.trace("Full prompt for {}:\n{}", instance.getName(), prompt);

        String response;
        try {
            response = call("recommendation for " + instance.getName(),
                    () -> provider.completeJson(promptBuilder.getSystemPrompt(), prompt, RECOMMENDATION_MAX_TOKENS));
        } catch (RuntimeException e) {
            log.warn("AI analysis failed for {}: {}", instance.getName(), e.getMessage());
            return Optional.empty();
        }
        log.trace("Raw response for {}:\n{}", instance.getName(), response);

        Optional<JsonNode> json = extractor.extract(response);
        if (json.isEmpty()) {
            log.warn("AI response for {} contained no usable JSON", instance.getName());
            return Optional.empty();
        }
        return Optional.of(normalizer.normalize(json.get(), instance.getName(), instance.getVmSize()));
    }

    /**
     * Model-written summary, or the basic text summary when the adapter is disabled or the call
     * fails.
     */
    public String executiveSummary(AnalysisReport report) {
        if (!isAvailable()) {
            return basicSummary(report);
        }

        List<RightsizingResult> top = report.getResults().stream()
                .filter(RightsizingResult::hasSavings)
                .sorted(Comparator.comparingDouble(RightsizingResult::getTotalPotentialSavings).reversed())
                .limit(PromptBuilder.MAX_SUMMARY_OPPORTUNITIES)
                .toList();
        String prompt = promptBuilder.buildSummaryPrompt(report, top);

        try {
            String summary = call("executive summary",
                    () -> provider.complete(promptBuilder.getSummarySystemPrompt(), prompt, SUMMARY_MAX_TOKENS));
            if (summary == null || summary.isBlank()) {
                log.warn("AI returned an empty executive summary, using basic summary");
                return basicSummary(report);
            }
            return summary.trim();
        } catch (RuntimeException e) {
            log.warn("Executive summary generation failed: {}", e.getMessage());
            return basicSummary(report);
        }
    }

    public static String basicSummary(AnalysisReport report) {
        long highConfidence = PromptBuilder.countWithConfidence(report, Confidence.HIGH);
        long needsReview = PromptBuilder.countWithConfidence(report, Confidence.MEDIUM)
                + PromptBuilder.countWithConfidence(report, Confidence.LOW);

        return String.format("""
            VM Rightsizing Analysis Summary
            ===============================

            Total VMs Analyzed: %d
            VMs with Optimization Opportunities: %d
            Estimated Monthly Savings: $%,.2f
            Estimated Annual Savings: $%,.2f

            Quick Wins (High Confidence): %d
            Further Analysis Needed: %d

            Recommended Next Steps:
            1. Review high-confidence recommendations for immediate implementation
            2. Validate medium-confidence recommendations with application owners
            3. Consider reserved instances for consistently utilized VMs
            4. Implement monitoring for newly rightsized VMs
            """,
                report.getAnalyzedInstances(),
                report.getInstancesWithRecommendations(),
                report.getTotalPotentialSavings(),
                report.getTotalAnnualSavings(),
                highConfidence,
                needsReview);
    }

    private String call(String description, Supplier<String> request) {
        return retry.call(description, () -> withPermit(request));
    }

    private String withPermit(Supplier<String> request) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for an AI permit", e);
        }
        try {
            return request.get();
        } finally {
            semaphore.release();
        }
    }
}
