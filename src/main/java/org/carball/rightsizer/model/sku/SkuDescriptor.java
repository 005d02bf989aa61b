package org.carball.rightsizer.model.sku;

import lombok.Builder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Catalog entry for a purchasable instance type in one region. Never patched after creation.
 */
@Builder(toBuilder = true)
public record SkuDescriptor(
    String name,
    String family,
    int vcpus,
    double memoryGb,
    int maxDataDisks,
    long maxIops,
    int maxNetworkBandwidthMbps,
    String generation,
    Set<SkuFeature> features,
    List<SkuRestriction> restrictions,
    List<String> availableZones
) {

    public SkuDescriptor {
        features = features == null || features.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(features));
        restrictions = restrictions == null ? List.of() : List.copyOf(restrictions);
        availableZones = availableZones == null ? List.of() : List.copyOf(availableZones);
    }

    public boolean hasFeature(SkuFeature feature) {
        return features.contains(feature);
    }

    public boolean isRestricted() {
        return !restrictions.isEmpty();
    }
}
