package org.carball.rightsizer.analyzer;

import org.carball.rightsizer.model.analysis.Priority;
import org.carball.rightsizer.model.analysis.RecommendationType;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.instance.InstanceDescriptor;

/**
 * Picks the recommendation type, savings and priority for a finished analysis.
 *
 * <p>An idle instance is a shutdown candidate and nothing else is considered. Otherwise each
 * savings source is visited in a fixed order and replaces the current choice only when it is
 * strictly larger, so on a tie the earlier source keeps the type.</p>
 */
public class RecommendationSelector {

    static final double SHUTDOWN_AVG_CPU = 5.0;
    static final double SHUTDOWN_MAX_CPU = 10.0;

    public void select(RightsizingResult result) {
        InstanceDescriptor instance = result.getInstance();

        if (isIdle(instance)) {
            result.setRecommendationType(RecommendationType.SHUTDOWN);
            result.setPriority(Priority.HIGH);
            result.setTotalPotentialSavings(instance.monthlyCostOrZero());
            return;
        }

        RecommendationType type = RecommendationType.NONE;
        double savings = 0.0;

        if (result.getGenerationSavings() > 0) {
            type = RecommendationType.GENERATION_UPGRADE;
            savings = result.getGenerationSavings();
        }

        if (result.getAdvisorHint() != null && result.getAdvisorHint().savingsOrZero() > savings) {
            type = RecommendationType.RIGHTSIZE;
            savings = result.getAdvisorHint().savingsOrZero();
        }

        if (result.getAiRecommendation() != null && result.getAiRecommendation().estimatedMonthlySavings() > savings) {
            type = RecommendationType.RIGHTSIZE;
            savings = result.getAiRecommendation().estimatedMonthlySavings();
        }

        double regionSavings = result.bestRegion().map(region -> region.savings()).orElse(0.0);
        if (regionSavings > savings) {
            type = RecommendationType.REGION_MOVE;
            savings = regionSavings;
        }

        double candidateSavings = result.topCandidate().map(candidate -> candidate.getSavings()).orElse(0.0);
        if (candidateSavings > savings) {
            type = RecommendationType.RIGHTSIZE;
            savings = candidateSavings;
        }

        result.setRecommendationType(type);
        result.setTotalPotentialSavings(savings);
        result.setPriority(Priority.fromMonthlySavings(savings));
    }

    static boolean isIdle(InstanceDescriptor instance) {
        return instance.hasCpuMetrics()
                && instance.getAvgCpu() < SHUTDOWN_AVG_CPU
                && instance.getMaxCpu() < SHUTDOWN_MAX_CPU;
    }
}
