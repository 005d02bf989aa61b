package org.carball.rightsizer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.cache.SkuCatalogCache;
import org.carball.rightsizer.config.ReferenceTables;
import org.carball.rightsizer.connector.PriceClient;
import org.carball.rightsizer.model.analysis.RegionAlternative;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.sku.PriceMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Finds the two moves that keep the instance shape: a newer generation of the same size and the
 * same SKU in a cheaper neighbouring region.
 */
@Slf4j
public class UpgradePathFinder {

    private final ReferenceTables tables;
    private final SkuCatalogCache catalogCache;
    private final PriceClient priceClient;

    public UpgradePathFinder(ReferenceTables tables, SkuCatalogCache catalogCache, PriceClient priceClient) {
        this.tables = tables;
        this.catalogCache = catalogCache;
        this.priceClient = priceClient;
    }

    /**
     * Records the current generation and, when the mapped successor is offered in the region and
     * costs less per month, the upgrade and its savings. Otherwise the upgrade is withheld.
     */
    public void evaluateGenerationUpgrade(RightsizingResult result, PriceLookup prices) {
        InstanceDescriptor instance = result.getInstance();
        String currentSku = instance.getVmSize();
        result.setCurrentGeneration(SkuClassifier.extractGeneration(currentSku));

        Optional<String> successor = tables.findSuccessor(currentSku);
        if (successor.isEmpty()) {
            return;
        }

        String target = successor.get();
        if (target.equals(currentSku) || SkuClassifier.skuVersion(target) <= SkuClassifier.skuVersion(currentSku)) {
            log.debug("Ignoring successor {} for {}: not a newer generation", target, currentSku);
            return;
        }

        boolean offered;
        try {
            offered = catalogCache.contains(instance.getRegion(), target);
        } catch (RuntimeException e) {
            log.debug("SKU catalog for {} unavailable, generation upgrade skipped: {}",
                    instance.getRegion(), e.getMessage());
            return;
        }
        if (!offered) {
            log.debug("Successor {} not offered in {}, generation upgrade withheld", target, instance.getRegion());
            return;
        }

        OptionalDouble hourly = prices.hourlyPrice(target);
        if (hourly.isEmpty()) {
            return;
        }

        double targetMonthly = PriceMath.toMonthly(hourly.getAsDouble());
        double currentMonthly = instance.monthlyCostOrZero();
        if (targetMonthly < currentMonthly) {
            result.setRecommendedGenerationUpgrade(target);
            result.setGenerationSavings(currentMonthly - targetMonthly);
        }
    }

    /**
     * Adjacent regions where the same SKU is cheaper, best savings first. Skipped when the
     * current price is unknown.
     */
    public void evaluateRegionAlternatives(RightsizingResult result) {
        InstanceDescriptor instance = result.getInstance();
        List<String> alternatives = tables.alternativesFor(instance.getRegion());
        double currentMonthly = instance.monthlyCostOrZero();
        if (alternatives.isEmpty() || currentMonthly <= 0) {
            return;
        }

        Map<String, Double> hourlyPrices;
        try {
            hourlyPrices = priceClient.hourlyPrices(instance.getVmSize(), alternatives, instance.getOsType());
        } catch (RuntimeException e) {
            log.debug("Regional prices unavailable for {}: {}", instance.getName(), e.getMessage());
            return;
        }

        List<RegionAlternative> cheaper = new ArrayList<>();
        for (Map.Entry<String, Double> price : hourlyPrices.entrySet()) {
            double monthly = PriceMath.toMonthly(price.getValue());
            double savings = currentMonthly - monthly;
            if (savings > 0) {
                cheaper.add(new RegionAlternative(price.getKey(), monthly, savings));
            }
        }
        cheaper.sort(Comparator.comparingDouble(RegionAlternative::savings).reversed());
        result.setCheaperRegions(cheaper);
    }
}
