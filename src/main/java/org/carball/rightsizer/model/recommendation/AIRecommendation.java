package org.carball.rightsizer.model.recommendation;

import lombok.Builder;

import java.util.List;

/**
 * Language-model recommendation for one instance, always normalized before use.
 */
@Builder
public record AIRecommendation(
    String instanceName,
    String currentSku,
    String recommendedSku,
    Confidence confidence,
    String reasoning,
    double estimatedMonthlySavings,
    String riskAssessment,
    MigrationComplexity migrationComplexity,
    List<String> recommendedActions
) {

    public AIRecommendation {
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }
}
