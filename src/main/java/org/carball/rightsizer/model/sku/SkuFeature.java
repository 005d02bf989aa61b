package org.carball.rightsizer.model.sku;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum SkuFeature {
    PREMIUM_STORAGE("PremiumStorage"),
    ACCELERATED_NETWORKING("AcceleratedNetworking"),
    EPHEMERAL_OS_DISK("EphemeralOSDisk"),
    ENCRYPTION_AT_HOST("EncryptionAtHost"),
    ULTRA_SSD("UltraSSD"),
    SPOT_CAPABLE("SpotCapable");

    private final String displayName;

    SkuFeature(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts the display name ("PremiumStorage") or the constant name ("PREMIUM_STORAGE"), ignoring case.
     */
    public static Optional<SkuFeature> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        for (SkuFeature feature : values()) {
            if (feature.displayName.equalsIgnoreCase(trimmed) || feature.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }
}
