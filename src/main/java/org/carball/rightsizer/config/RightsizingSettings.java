package org.carball.rightsizer.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class RightsizingSettings {

    // Metrics window
    @Builder.Default
    private int lookbackDays = 30;

    // Utilization thresholds (percent)
    @Builder.Default
    private double cpuThresholdLow = 20.0;

    @Builder.Default
    private double cpuThresholdHigh = 80.0;

    @Builder.Default
    private double memoryThresholdLow = 20.0;

    @Builder.Default
    private double memoryThresholdHigh = 80.0;

    // Stretch factors applied to the acceptable resource range
    @Builder.Default
    private double lowUtilizationStretch = 0.5;

    @Builder.Default
    private double highUtilizationStretch = 1.5;

    // Hard candidate filters
    @Builder.Default
    private boolean checkDiskRequirements = true;

    @Builder.Default
    private boolean checkNetworkRequirements = true;

    @Builder.Default
    private boolean preferSameFamily = false;

    @Builder.Default
    private boolean allowBurstable = true;

    // Generation leap
    @Builder.Default
    private boolean generationLeapEnabled = true;

    @Builder.Default
    private int generationLeap = 2;

    @Builder.Default
    private boolean generationLeapFallback = true;

    // Concurrency and timeouts
    @Builder.Default
    private int maxWorkers = 10;

    @Builder.Default
    private int aiConcurrency = 5;

    @Builder.Default
    private long instanceTimeoutSeconds = 60;

    @Builder.Default
    private long batchTimeoutSeconds = 300;

    // Validation
    @Builder.Default
    private int validationDepth = 3;

    @Builder.Default
    private double quotaWarningPercent = 80.0;

    // AI
    @Builder.Default
    private String aiModel = "gpt-4o-mini";

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced rightsizing settings";

    public static RightsizingSettings defaults() {
        return RightsizingSettings.builder()
                .profileName("default")
                .profileDescription("Default balanced rightsizing settings")
                .build();
    }

    /**
     * Validates the settings and logs warnings for values that will produce odd results.
     */
    public void validate() {
        if (cpuThresholdLow >= cpuThresholdHigh) {
            log.warn("CPU low threshold ({}) should be below CPU high threshold ({})",
                    cpuThresholdLow, cpuThresholdHigh);
        }

        if (memoryThresholdLow >= memoryThresholdHigh) {
            log.warn("Memory low threshold ({}) should be below memory high threshold ({})",
                    memoryThresholdLow, memoryThresholdHigh);
        }

        if (lowUtilizationStretch <= 0 || lowUtilizationStretch > 1.0) {
            log.warn("Low utilization stretch ({}) should be in (0, 1]", lowUtilizationStretch);
        }

        if (highUtilizationStretch < 1.0) {
            log.warn("High utilization stretch ({}) should be at least 1.0", highUtilizationStretch);
        }

        if (generationLeapEnabled && (generationLeap < 1 || generationLeap > 3)) {
            log.warn("Generation leap ({}) is outside the usual range 1-3", generationLeap);
        }

        if (maxWorkers <= 0) {
            log.warn("Worker pool width ({}) should be positive", maxWorkers);
        }

        if (aiConcurrency <= 0) {
            log.warn("AI concurrency ({}) should be positive", aiConcurrency);
        }

        if (instanceTimeoutSeconds > batchTimeoutSeconds) {
            log.warn("Per-instance timeout ({}s) exceeds the batch timeout ({}s)",
                    instanceTimeoutSeconds, batchTimeoutSeconds);
        }

        log.debug("Using settings - CPU: {}/{}, Memory: {}/{}, Leap: {}, Workers: {}, Profile: {}",
                cpuThresholdLow, cpuThresholdHigh, memoryThresholdLow, memoryThresholdHigh,
                generationLeap, maxWorkers, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | CPU: %.0f-%.0f%% | Memory: %.0f-%.0f%% | Leap: %s | Workers: %d",
                profileName, cpuThresholdLow, cpuThresholdHigh, memoryThresholdLow, memoryThresholdHigh,
                generationLeapEnabled ? "+" + generationLeap : "off", maxWorkers);
    }
}
