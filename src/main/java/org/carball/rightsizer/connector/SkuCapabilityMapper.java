package org.carball.rightsizer.connector;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.analyzer.SkuClassifier;
import org.carball.rightsizer.model.sku.RestrictionReason;
import org.carball.rightsizer.model.sku.RestrictionType;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuFeature;
import org.carball.rightsizer.model.sku.SkuRestriction;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the raw name/value capability list of a resource SKU into a {@link SkuDescriptor}.
 * Capabilities this engine does not use are dropped.
 */
@Slf4j
public final class SkuCapabilityMapper {

    private static final Map<String, SkuFeature> FEATURE_FLAGS = Map.of(
            "PremiumIO", SkuFeature.PREMIUM_STORAGE,
            "AcceleratedNetworkingEnabled", SkuFeature.ACCELERATED_NETWORKING,
            "EphemeralOSDiskSupported", SkuFeature.EPHEMERAL_OS_DISK,
            "EncryptionAtHostSupported", SkuFeature.ENCRYPTION_AT_HOST,
            "UltraSSDAvailable", SkuFeature.ULTRA_SSD,
            "LowPriorityCapable", SkuFeature.SPOT_CAPABLE
    );

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private SkuCapabilityMapper() {
    }

    public static SkuDescriptor toDescriptor(String name, Map<String, String> capabilities,
                                             List<SkuRestriction> restrictions, List<String> zones) {
        int vcpus = 0;
        double memoryGb = 0.0;
        int maxDataDisks = 0;
        long maxIops = 0;
        int bandwidthMbps = 0;
        String generation = "Unknown";
        Set<SkuFeature> features = EnumSet.noneOf(SkuFeature.class);

        for (Map.Entry<String, String> capability : capabilities.entrySet()) {
            String key = capability.getKey();
            String value = capability.getValue() == null ? "" : capability.getValue().trim();

            switch (key) {
                case "vCPUs" -> vcpus = (int) parseLong(name, key, value);
                case "MemoryGB" -> memoryGb = parseDouble(name, key, value);
                case "MaxDataDiskCount" -> maxDataDisks = (int) parseLong(name, key, value);
                case "UncachedDiskIOPS" -> maxIops = parseLong(name, key, value);
                case "MaxNetworkBandwidthMbps" -> bandwidthMbps = (int) parseLong(name, key, value);
                case "UncachedDiskBytesPerSecond" -> {
                    if (bandwidthMbps == 0) {
                        bandwidthMbps = (int) (parseLong(name, key, value) / BYTES_PER_MB);
                    }
                }
                case "HyperVGenerations" -> generation = value.isEmpty() ? generation : value;
                default -> {
                    SkuFeature feature = FEATURE_FLAGS.get(key);
                    if (feature != null && "true".equalsIgnoreCase(value)) {
                        features.add(feature);
                    }
                }
            }
        }

        return SkuDescriptor.builder()
                .name(name)
                .family(SkuClassifier.extractFamily(name))
                .vcpus(vcpus)
                .memoryGb(memoryGb)
                .maxDataDisks(maxDataDisks)
                .maxIops(maxIops)
                .maxNetworkBandwidthMbps(bandwidthMbps)
                .generation(generation)
                .features(features)
                .restrictions(restrictions)
                .availableZones(zones)
                .build();
    }

    /**
     * Builds a restriction from its raw type and reason code. Unknown types map to
     * {@link RestrictionType#SUBSCRIPTION}.
     */
    public static SkuRestriction toRestriction(String type, String reasonCode, List<String> zones) {
        RestrictionType restrictionType;
        try {
            restrictionType = RestrictionType.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            restrictionType = RestrictionType.SUBSCRIPTION;
        }
        RestrictionReason reason = RestrictionReason.fromCode(reasonCode);
        return new SkuRestriction(restrictionType, reason, zones, type + ": " + reasonCode);
    }

    private static long parseLong(String sku, String key, String value) {
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return (long) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric capability {}={} on {}", key, value, sku);
            return 0;
        }
    }

    private static double parseDouble(String sku, String key, String value) {
        if (value.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric capability {}={} on {}", key, value, sku);
            return 0.0;
        }
    }
}
