package org.carball.rightsizer.cache;

import org.carball.rightsizer.analyzer.PriceLookup;
import org.carball.rightsizer.connector.FakeEstate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

class PriceCacheTest {

    private FakeEstate estate;
    private PriceCache cache;

    @BeforeEach
    void setUp() {
        estate = new FakeEstate().price("Standard_D4s_v5", "eastus", 0.192);
        cache = new PriceCache(estate);
    }

    @Test
    void shouldCacheKnownPrices() {
        // When
        OptionalDouble first = cache.hourlyPrice("Standard_D4s_v5", "eastus", "Linux");
        OptionalDouble second = cache.hourlyPrice("Standard_D4s_v5", "eastus", "Linux");

        // Then
        assertThat(first).hasValue(0.192);
        assertThat(second).hasValue(0.192);
        assertThat(estate.priceCalls()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldNotCacheMissingPrices() {
        // When
        cache.hourlyPrice("Standard_D2s_v5", "eastus", "Linux");
        OptionalDouble price = cache.hourlyPrice("Standard_D2s_v5", "eastus", "Linux");

        // Then
        assertThat(price).isEmpty();
        assertThat(estate.priceCalls()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldKeepFirstStoredPrice() {
        // Given
        cache.hourlyPrice("Standard_D4s_v5", "eastus", "Linux");
        estate.price("Standard_D4s_v5", "eastus", 0.5);

        // When
        OptionalDouble price = cache.hourlyPrice("Standard_D4s_v5", "eastus", "Linux");

        // Then
        assertThat(price).hasValue(0.192);
    }

    @Test
    void shouldKeyByOperatingSystem() {
        // When
        cache.hourlyPrice("Standard_D4s_v5", "eastus", "Linux");
        cache.hourlyPrice("Standard_D4s_v5", "eastus", "Windows");

        // Then
        assertThat(cache.size()).isEqualTo(2);
        assertThat(PriceCache.key("Standard_D4s_v5", "eastus", "Linux")).isEqualTo("Standard_D4s_v5:eastus:Linux");
    }

    @Test
    void shouldExposeRegionalLookup() {
        // Given
        PriceLookup lookup = cache.lookupFor("eastus", "Linux");

        // Then
        assertThat(lookup.hourlyPrice("Standard_D4s_v5")).hasValue(0.192);
        assertThat(lookup.hourlyPrice("Standard_E4s_v5")).isEmpty();
    }
}
