package org.carball.rightsizer.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String displayName;

    Confidence(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup; anything outside the three levels maps to MEDIUM.
     */
    public static Confidence fromText(String text) {
        if (text != null) {
            for (Confidence confidence : values()) {
                if (confidence.displayName.equalsIgnoreCase(text.trim())) {
                    return confidence;
                }
            }
        }
        return MEDIUM;
    }
}
