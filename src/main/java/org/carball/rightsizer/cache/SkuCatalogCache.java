package org.carball.rightsizer.cache;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.connector.ConnectorException;
import org.carball.rightsizer.connector.SkuCatalogClient;
import org.carball.rightsizer.model.sku.SkuDescriptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-region SKU catalogs for the lifetime of one run. Entries are only ever added; once a
 * region is loaded it is read without locking.
 *
 * <p>A failed fetch is remembered for the run, so later lookups for that region fail fast
 * instead of queueing on the fetch lock again.</p>
 */
@Slf4j
public class SkuCatalogCache {

    private final SkuCatalogClient client;
    private final Map<String, RegionCatalog> catalogs = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SkuCatalogCache(SkuCatalogClient client) {
        this.client = client;
    }

    public List<SkuDescriptor> skusFor(String region) {
        return catalogFor(region).skus();
    }

    public Optional<SkuDescriptor> find(String region, String skuName) {
        return Optional.ofNullable(catalogFor(region).byName().get(skuName));
    }

    public boolean contains(String region, String skuName) {
        return catalogFor(region).byName().containsKey(skuName);
    }

    public boolean isLoaded(String region) {
        return catalogs.containsKey(region);
    }

    public boolean isUnavailable(String region) {
        return failures.containsKey(region);
    }

    public int regionCount() {
        return catalogs.size();
    }

    private RegionCatalog catalogFor(String region) {
        RegionCatalog cached = catalogs.get(region);
        if (cached != null) {
            return cached;
        }
        rethrowIfFailed(region);

        // Catalog downloads are large, so concurrent misses wait for a single fetch
        lock.lock();
        try {
            cached = catalogs.get(region);
            if (cached == null) {
                rethrowIfFailed(region);
                List<SkuDescriptor> skus;
                try {
                    skus = client.listSkus(region, false);
                } catch (RuntimeException e) {
                    failures.put(region, e);
                    throw e;
                }
                cached = RegionCatalog.of(skus);
                catalogs.put(region, cached);
                log.debug("Cached {} SKUs for {}", skus.size(), region);
            }
            return cached;
        } finally {
            lock.unlock();
        }
    }

    private void rethrowIfFailed(String region) {
        RuntimeException failure = failures.get(region);
        if (failure != null) {
            throw new ConnectorException("SKU catalog unavailable for " + region + ": " + failure.getMessage(), failure);
        }
    }

    private record RegionCatalog(List<SkuDescriptor> skus, Map<String, SkuDescriptor> byName) {

        static RegionCatalog of(List<SkuDescriptor> skus) {
            Map<String, SkuDescriptor> byName = new LinkedHashMap<>();
            for (SkuDescriptor sku : skus) {
                byName.putIfAbsent(sku.name(), sku);
            }
            return new RegionCatalog(List.copyOf(skus), Map.copyOf(byName));
        }
    }
}
