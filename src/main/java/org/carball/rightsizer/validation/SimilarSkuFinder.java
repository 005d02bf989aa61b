package org.carball.rightsizer.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.connector.SkuCatalogClient;
import org.carball.rightsizer.model.sku.SimilarSku;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuFeature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Suggests deployable stand-ins for a SKU that is restricted or short on capacity in a region.
 */
@Slf4j
public class SimilarSkuFinder {

    public static final int DEFAULT_MAX_RESULTS = 10;
    public static final int DEFAULT_MIN_SIMILARITY = 60;

    private static final int COMPARED_ATTRIBUTES = 5;

    private final SkuCatalogClient catalogClient;

    public SimilarSkuFinder(SkuCatalogClient catalogClient) {
        this.catalogClient = catalogClient;
    }

    public Search find(String skuName, String region, int maxResults, int minSimilarity) {
        List<SkuDescriptor> catalog = catalogClient.listSkus(region, true);
        Optional<SkuDescriptor> target = catalog.stream()
                .filter(sku -> sku.name().equalsIgnoreCase(skuName))
                .findFirst();
        if (target.isEmpty()) {
            log.debug("{} not in the {} catalog, no alternatives searched", skuName, region);
            return new Search(skuName, region, null, List.of());
        }

        List<SimilarSku> similar = new ArrayList<>();
        for (SkuDescriptor sku : catalog) {
            if (sku.isRestricted() || sku.name().equals(target.get().name())) {
                continue;
            }
            int score = similarity(target.get(), sku);
            if (score >= minSimilarity) {
                similar.add(new SimilarSku(sku, score));
            }
        }
        // stable sort, ties keep catalog order
        similar.sort(Comparator.comparingInt(SimilarSku::similarity).reversed());

        List<SimilarSku> alternatives = similar.stream().limit(Math.max(0, maxResults)).toList();
        log.debug("Found {} alternative(s) for {} in {}", alternatives.size(), skuName, region);
        return new Search(skuName, region, target.get(), alternatives);
    }

    /**
     * Share of vCPUs, memory, data disks, premium storage and accelerated networking that match.
     */
    public static int similarity(SkuDescriptor target, SkuDescriptor other) {
        int matches = 0;
        if (target.vcpus() == other.vcpus()) {
            matches++;
        }
        if (Double.compare(target.memoryGb(), other.memoryGb()) == 0) {
            matches++;
        }
        if (target.maxDataDisks() == other.maxDataDisks()) {
            matches++;
        }
        if (target.hasFeature(SkuFeature.PREMIUM_STORAGE) == other.hasFeature(SkuFeature.PREMIUM_STORAGE)) {
            matches++;
        }
        if (target.hasFeature(SkuFeature.ACCELERATED_NETWORKING) == other.hasFeature(SkuFeature.ACCELERATED_NETWORKING)) {
            matches++;
        }
        return matches * 100 / COMPARED_ATTRIBUTES;
    }

    /**
     * Outcome of one search. {@code target} is null when the SKU is not offered in the region.
     */
    public record Search(String skuName, String region, SkuDescriptor target, List<SimilarSku> alternatives) {

        public boolean targetFound() {
            return target != null;
        }

        public boolean targetAvailable() {
            return target != null && !target.isRestricted();
        }
    }
}
