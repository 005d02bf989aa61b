package org.carball.rightsizer.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private static final double HIGH_SAVINGS_THRESHOLD = 500;
    private static final double MEDIUM_SAVINGS_THRESHOLD = 100;

    private final String displayName;

    Priority(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public static Priority fromMonthlySavings(double savings) {
        if (savings > HIGH_SAVINGS_THRESHOLD) {
            return HIGH;
        } else if (savings > MEDIUM_SAVINGS_THRESHOLD) {
            return MEDIUM;
        } else {
            return LOW;
        }
    }
}
