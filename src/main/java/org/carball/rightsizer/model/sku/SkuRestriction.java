package org.carball.rightsizer.model.sku;

import java.util.List;

public record SkuRestriction(
    RestrictionType type,
    RestrictionReason reason,
    List<String> zones,
    String message
) {

    public SkuRestriction {
        zones = zones == null ? List.of() : List.copyOf(zones);
    }
}
