package org.carball.rightsizer.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    NONE("none", "No change"),
    RIGHTSIZE("rightsize", "Rightsize"),
    SHUTDOWN("shutdown", "Shutdown"),
    GENERATION_UPGRADE("generation_upgrade", "Generation upgrade"),
    REGION_MOVE("region_move", "Region move");

    private final String code;
    private final String displayName;

    RecommendationType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }
}
