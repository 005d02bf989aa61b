package org.carball.rightsizer.connector;

import org.carball.rightsizer.model.sku.RestrictionReason;
import org.carball.rightsizer.model.sku.RestrictionType;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuFeature;
import org.carball.rightsizer.model.sku.SkuRestriction;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SkuCapabilityMapperTest {

    @Test
    void shouldMapKnownCapabilities() {
        // Given
        Map<String, String> capabilities = new LinkedHashMap<>();
        capabilities.put("vCPUs", "4");
        capabilities.put("MemoryGB", "16");
        capabilities.put("MaxDataDiskCount", "8");
        capabilities.put("UncachedDiskIOPS", "6400");
        capabilities.put("MaxNetworkBandwidthMbps", "12500");
        capabilities.put("HyperVGenerations", "V1,V2");
        capabilities.put("PremiumIO", "True");
        capabilities.put("AcceleratedNetworkingEnabled", "true");
        capabilities.put("EncryptionAtHostSupported", "False");
        capabilities.put("CpuArchitectureType", "x64");

        // When
        SkuDescriptor sku = SkuCapabilityMapper.toDescriptor("Standard_D4s_v5", capabilities,
                List.of(), List.of("1", "2", "3"));

        // Then
        assertThat(sku.name()).isEqualTo("Standard_D4s_v5");
        assertThat(sku.family()).isEqualTo("D");
        assertThat(sku.vcpus()).isEqualTo(4);
        assertThat(sku.memoryGb()).isEqualTo(16.0);
        assertThat(sku.maxDataDisks()).isEqualTo(8);
        assertThat(sku.maxIops()).isEqualTo(6400);
        assertThat(sku.maxNetworkBandwidthMbps()).isEqualTo(12500);
        assertThat(sku.generation()).isEqualTo("V1,V2");
        assertThat(sku.features()).containsExactlyInAnyOrder(SkuFeature.PREMIUM_STORAGE, SkuFeature.ACCELERATED_NETWORKING);
        assertThat(sku.availableZones()).containsExactly("1", "2", "3");
    }

    @Test
    void shouldDeriveBandwidthFromDiskThroughput() {
        // Given
        Map<String, String> capabilities = Map.of("UncachedDiskBytesPerSecond", String.valueOf(200L * 1024 * 1024));

        // When
        SkuDescriptor sku = SkuCapabilityMapper.toDescriptor("Standard_B2ms", capabilities, List.of(), List.of());

        // Then
        assertThat(sku.maxNetworkBandwidthMbps()).isEqualTo(200);
    }

    @Test
    void shouldReadBadNumbersAsZero() {
        // Given
        Map<String, String> capabilities = Map.of("vCPUs", "four", "MemoryGB", "", "HyperVGenerations", "");

        // When
        SkuDescriptor sku = SkuCapabilityMapper.toDescriptor("Standard_X1", capabilities, List.of(), List.of());

        // Then
        assertThat(sku.vcpus()).isZero();
        assertThat(sku.memoryGb()).isZero();
        assertThat(sku.generation()).isEqualTo("Unknown");
        assertThat(sku.features()).isEmpty();
    }

    @Test
    void shouldMapRestrictionTypes() {
        // When
        SkuRestriction zone = SkuCapabilityMapper.toRestriction("Zone", "NotAvailableForSubscription", List.of("2"));
        SkuRestriction unknown = SkuCapabilityMapper.toRestriction("Tenant", "Retired", List.of());

        // Then
        assertThat(zone.type()).isEqualTo(RestrictionType.ZONE);
        assertThat(zone.reason()).isEqualTo(RestrictionReason.NOT_AVAILABLE_FOR_SUBSCRIPTION);
        assertThat(zone.zones()).containsExactly("2");
        assertThat(zone.message()).isEqualTo("Zone: NotAvailableForSubscription");
        assertThat(unknown.type()).isEqualTo(RestrictionType.SUBSCRIPTION);
        assertThat(unknown.reason()).isEqualTo(RestrictionReason.RETIRED);
    }
}
