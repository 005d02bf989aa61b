package org.carball.rightsizer.analyzer;

import lombok.Builder;
import org.carball.rightsizer.config.RightsizingSettings;

/**
 * Knobs for candidate filtering and scoring. The four weights sum to 1.0.
 */
@Builder(toBuilder = true)
public record ScoringPolicy(
    double cpuThresholdLow,
    double cpuThresholdHigh,
    double memoryThresholdLow,
    double memoryThresholdHigh,
    double lowUtilizationStretch,
    double highUtilizationStretch,
    boolean checkDiskRequirements,
    boolean checkNetworkRequirements,
    boolean sameFamilyOnly,
    boolean allowBurstable,
    boolean leapEnabled,
    int leap,
    boolean leapFallback,
    double priceWeight,
    double performanceWeight,
    double generationWeight,
    double featureWeight,
    int maxCandidates
) {

    public static final double DEFAULT_PRICE_WEIGHT = 0.35;
    public static final double DEFAULT_PERFORMANCE_WEIGHT = 0.25;
    public static final double DEFAULT_GENERATION_WEIGHT = 0.20;
    public static final double DEFAULT_FEATURE_WEIGHT = 0.20;
    public static final int DEFAULT_MAX_CANDIDATES = 10;

    public static ScoringPolicy fromSettings(RightsizingSettings settings) {
        return ScoringPolicy.builder()
                .cpuThresholdLow(settings.getCpuThresholdLow())
                .cpuThresholdHigh(settings.getCpuThresholdHigh())
                .memoryThresholdLow(settings.getMemoryThresholdLow())
                .memoryThresholdHigh(settings.getMemoryThresholdHigh())
                .lowUtilizationStretch(settings.getLowUtilizationStretch())
                .highUtilizationStretch(settings.getHighUtilizationStretch())
                .checkDiskRequirements(settings.isCheckDiskRequirements())
                .checkNetworkRequirements(settings.isCheckNetworkRequirements())
                .sameFamilyOnly(settings.isPreferSameFamily())
                .allowBurstable(settings.isAllowBurstable())
                .leapEnabled(settings.isGenerationLeapEnabled())
                .leap(settings.getGenerationLeap())
                .leapFallback(settings.isGenerationLeapFallback())
                .priceWeight(DEFAULT_PRICE_WEIGHT)
                .performanceWeight(DEFAULT_PERFORMANCE_WEIGHT)
                .generationWeight(DEFAULT_GENERATION_WEIGHT)
                .featureWeight(DEFAULT_FEATURE_WEIGHT)
                .maxCandidates(DEFAULT_MAX_CANDIDATES)
                .build();
    }

    public static ScoringPolicy defaults() {
        return fromSettings(RightsizingSettings.defaults());
    }
}
