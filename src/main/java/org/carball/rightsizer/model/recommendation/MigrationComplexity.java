package org.carball.rightsizer.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MigrationComplexity {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String displayName;

    MigrationComplexity(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public static MigrationComplexity fromText(String text) {
        if (text != null) {
            for (MigrationComplexity complexity : values()) {
                if (complexity.displayName.equalsIgnoreCase(text.trim())) {
                    return complexity;
                }
            }
        }
        return MEDIUM;
    }
}
