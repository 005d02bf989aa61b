package org.carball.rightsizer.analyzer;

import org.carball.rightsizer.config.ReferenceTables;
import org.carball.rightsizer.connector.FakeEstate;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RegionPriceComparisonTest {

    private FakeEstate estate;
    private RegionPriceComparison comparison;

    @BeforeEach
    void setUp() {
        estate = new FakeEstate();
        comparison = new RegionPriceComparison(ReferenceTables.loadDefaults(), estate);
    }

    @Test
    void shouldSortPricedRegionsAndRecommendCheapest() {
        // Given
        estate.price("Standard_D4s_v5", "eastus", 0.20)
                .price("Standard_D4s_v5", "eastus2", 0.18)
                .price("Standard_D4s_v5", "centralus", 0.22);

        // When
        RegionPriceComparison.Comparison result = comparison.compare(instance("eastus"));

        // Then
        assertThat(result.currentMonthly()).isCloseTo(146.0, within(1e-9));
        assertThat(result.priced()).extracting(RegionPriceComparison.RegionPrice::region)
                .containsExactly("eastus2", "eastus", "centralus");
        assertThat(result.priced().get(1).current()).isTrue();
        assertThat(result.priced().get(2).savings()).isCloseTo(-14.6, within(1e-9));
        assertThat(result.unpriced()).containsExactly("southcentralus", "northcentralus", "westus2");

        RegionPriceComparison.RegionPrice move = result.recommendedMove().orElseThrow();
        assertThat(move.region()).isEqualTo("eastus2");
        assertThat(move.savings()).isCloseTo(14.6, within(1e-9));
        assertThat(move.savingsPercent()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void shouldNotRecommendMoveWhenCurrentRegionIsCheapest() {
        // Given
        estate.price("Standard_D4s_v5", "eastus", 0.15)
                .price("Standard_D4s_v5", "eastus2", 0.18);

        // Then
        assertThat(comparison.compare(instance("eastus")).recommendedMove()).isEmpty();
    }

    @Test
    void shouldNotRecommendMoveWithoutCurrentPrice() {
        // Given
        estate.price("Standard_D4s_v5", "eastus2", 0.18)
                .price("Standard_D4s_v5", "westus2", 0.19);

        // When
        RegionPriceComparison.Comparison result = comparison.compare(instance("eastus"));

        // Then
        assertThat(result.currentMonthly()).isZero();
        assertThat(result.unpriced()).contains("eastus");
        assertThat(result.recommendedMove()).isEmpty();
    }

    @Test
    void shouldReportNoAlternativesForUnmappedRegion() {
        // When
        RegionPriceComparison.Comparison result = comparison.compare(instance("antarcticanorth"));

        // Then
        assertThat(result.hasAlternatives()).isFalse();
        assertThat(result.priced()).isEmpty();
    }

    private static InstanceDescriptor instance(String region) {
        return InstanceDescriptor.builder()
                .name("app-01")
                .resourceGroup("rg-app")
                .region(region)
                .vmSize("Standard_D4s_v5")
                .build();
    }
}
