package org.carball.rightsizer.validation;

import org.carball.rightsizer.model.validation.QuotaSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QuotaUsageSummaryTest {

    private final List<QuotaSnapshot> usage = List.of(
            new QuotaSnapshot("Standard DSv5 Family vCPUs", "eastus", 95, 100),
            new QuotaSnapshot("Standard ESv5 Family vCPUs", "eastus", 90, 100),
            new QuotaSnapshot("Standard FSv2 Family vCPUs", "eastus", 70, 100),
            new QuotaSnapshot("Standard DDSv5 Family vCPUs", "eastus", 10, 100),
            new QuotaSnapshot("Total Regional vCPUs", "eastus", 0, 0));

    @Test
    void shouldGroupByUsageBands() {
        // When
        QuotaUsageSummary summary = QuotaUsageSummary.of("eastus", usage, null);

        // Then
        assertThat(summary.critical()).extracting(QuotaSnapshot::family)
                .containsExactly("Standard DSv5 Family vCPUs", "Standard ESv5 Family vCPUs");
        assertThat(summary.warning()).extracting(QuotaSnapshot::family)
                .containsExactly("Standard FSv2 Family vCPUs");
        assertThat(summary.okCount()).isEqualTo(2);
    }

    @Test
    void shouldFilterByFamilyIgnoringCase() {
        // When
        QuotaUsageSummary summary = QuotaUsageSummary.of("eastus", usage, "dsv5");

        // Then
        assertThat(summary.quotas()).extracting(QuotaSnapshot::family)
                .containsExactly("Standard DSv5 Family vCPUs", "Standard DDSv5 Family vCPUs");
        assertThat(summary.critical()).hasSize(1);
        assertThat(summary.okCount()).isEqualTo(1);
    }

    @Test
    void shouldBeEmptyWhenNothingMatches() {
        assertThat(QuotaUsageSummary.of("eastus", usage, "NC").isEmpty()).isTrue();
        assertThat(QuotaUsageSummary.of("westus", List.of(), null).isEmpty()).isTrue();
    }
}
