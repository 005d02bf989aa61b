package org.carball.rightsizer.cache;

import org.carball.rightsizer.connector.ConnectorException;
import org.carball.rightsizer.connector.FakeEstate;
import org.carball.rightsizer.connector.SkuCapabilityMapper;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SkuCatalogCacheTest {

    private FakeEstate estate;
    private SkuCatalogCache cache;

    @BeforeEach
    void setUp() {
        estate = new FakeEstate()
                .addSku("eastus", SkuDescriptor.builder().name("Standard_D2s_v5").vcpus(2).build())
                .addSku("eastus", SkuDescriptor.builder().name("Standard_D4s_v5").vcpus(4).build())
                .addSku("eastus", SkuDescriptor.builder()
                        .name("Standard_M128s")
                        .vcpus(128)
                        .restrictions(List.of(SkuCapabilityMapper.toRestriction(
                                "Location", "NotAvailableForSubscription", List.of())))
                        .build());
        cache = new SkuCatalogCache(estate);
    }

    @Test
    void shouldLoadRegionOnFirstUseOnly() {
        // When
        List<SkuDescriptor> first = cache.skusFor("eastus");
        List<SkuDescriptor> second = cache.skusFor("eastus");

        // Then
        assertThat(first).isSameAs(second);
        assertThat(estate.catalogCalls("eastus")).isEqualTo(1);
        assertThat(cache.isLoaded("eastus")).isTrue();
        assertThat(cache.regionCount()).isEqualTo(1);
    }

    @Test
    void shouldExcludeRestrictedSkus() {
        // Then
        assertThat(cache.skusFor("eastus")).extracting(SkuDescriptor::name)
                .containsExactly("Standard_D2s_v5", "Standard_D4s_v5");
        assertThat(cache.contains("eastus", "Standard_M128s")).isFalse();
    }

    @Test
    void shouldFindSkuByName() {
        assertThat(cache.find("eastus", "Standard_D4s_v5")).get()
                .extracting(SkuDescriptor::vcpus).isEqualTo(4);
        assertThat(cache.find("eastus", "Standard_D8s_v5")).isEmpty();
    }

    @Test
    void shouldCacheEmptyRegion() {
        // When
        cache.skusFor("antarctica");
        cache.skusFor("antarctica");

        // Then
        assertThat(cache.skusFor("antarctica")).isEmpty();
        assertThat(estate.catalogCalls("antarctica")).isEqualTo(1);
    }

    @Test
    void shouldRememberFailedFetchWithoutRetrying() {
        // Given
        estate.failCatalog("westus");

        // When/Then
        assertThatThrownBy(() -> cache.skusFor("westus")).hasMessageContaining("westus");
        assertThatThrownBy(() -> cache.find("westus", "Standard_D2s_v5"))
                .isInstanceOf(ConnectorException.class)
                .hasMessageContaining("SKU catalog unavailable for westus");
        assertThatThrownBy(() -> cache.contains("westus", "Standard_D2s_v5"))
                .isInstanceOf(ConnectorException.class);

        assertThat(estate.catalogCalls("westus")).isEqualTo(1);
        assertThat(cache.isLoaded("westus")).isFalse();
        assertThat(cache.isUnavailable("westus")).isTrue();
        assertThat(cache.isUnavailable("eastus")).isFalse();
    }

    @Test
    void shouldFetchOnceUnderConcurrentMisses() throws Exception {
        // Given
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<SkuDescriptor>>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.skusFor("eastus");
                }));
            }
            start.countDown();
            for (Future<List<SkuDescriptor>> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).hasSize(2);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertThat(estate.catalogCalls("eastus")).isEqualTo(1);
    }
}
