package org.carball.rightsizer.config;

import lombok.Getter;

@Getter
public enum SizingProfile {

    BALANCED("balanced", "Balanced approach - default settings for most estates",
            20.0, 80.0, 2, true, true),

    CONSERVATIVE("conservative", "Conservative approach - only shrink clearly idle machines",
            10.0, 70.0, 1, true, false),

    AGGRESSIVE("aggressive", "Aggressive approach - surface every cost reduction",
            30.0, 90.0, 2, true, true),

    MODERNIZE("modernize", "Prefer newer hardware generations, never fall back",
            20.0, 80.0, 3, false, true) {
        @Override
        public RightsizingSettings buildSettings() {
            return super.buildSettings().toBuilder()
                    .preferSameFamily(true)
                    .build();
        }
    },

    COST_FIRST("cost-first", "Lowest price wins, burstable and cross-family moves allowed",
            25.0, 85.0, 1, true, true) {
        @Override
        public RightsizingSettings buildSettings() {
            return super.buildSettings().toBuilder()
                    .generationLeapEnabled(false)
                    .checkNetworkRequirements(false)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double cpuThresholdLow;
    private final double cpuThresholdHigh;
    private final int generationLeap;
    private final boolean generationLeapFallback;
    private final boolean allowBurstable;

    SizingProfile(String name, String description,
                  double cpuThresholdLow, double cpuThresholdHigh,
                  int generationLeap, boolean generationLeapFallback, boolean allowBurstable) {
        this.name = name;
        this.description = description;
        this.cpuThresholdLow = cpuThresholdLow;
        this.cpuThresholdHigh = cpuThresholdHigh;
        this.generationLeap = generationLeap;
        this.generationLeapFallback = generationLeapFallback;
        this.allowBurstable = allowBurstable;
    }

    /**
     * Creates RightsizingSettings based on this profile's values.
     */
    public RightsizingSettings buildSettings() {
        return RightsizingSettings.builder()
                .profileName(name)
                .profileDescription(description)
                .cpuThresholdLow(cpuThresholdLow)
                .cpuThresholdHigh(cpuThresholdHigh)
                .memoryThresholdLow(cpuThresholdLow)
                .memoryThresholdHigh(cpuThresholdHigh)
                .generationLeap(generationLeap)
                .generationLeapFallback(generationLeapFallback)
                .allowBurstable(allowBurstable)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static SizingProfile fromName(String name) {
        for (SizingProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown sizing profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (SizingProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Sizing Profiles:\n\n");
        for (SizingProfile profile : values()) {
            help.append(String.format("  %-15s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
