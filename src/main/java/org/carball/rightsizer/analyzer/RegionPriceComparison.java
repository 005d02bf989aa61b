package org.carball.rightsizer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.config.ReferenceTables;
import org.carball.rightsizer.connector.PriceClient;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.sku.PriceMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Prices one instance's SKU in its own region and in every adjacent region.
 */
@Slf4j
public class RegionPriceComparison {

    private final ReferenceTables tables;
    private final PriceClient priceClient;

    public RegionPriceComparison(ReferenceTables tables, PriceClient priceClient) {
        this.tables = tables;
        this.priceClient = priceClient;
    }

    public Comparison compare(InstanceDescriptor instance) {
        String currentRegion = instance.getRegion();
        List<String> alternatives = tables.alternativesFor(currentRegion);
        if (alternatives.isEmpty()) {
            return new Comparison(instance, 0, List.of(), List.of());
        }

        OptionalDouble currentHourly = priceClient.hourlyPrice(instance.getVmSize(), currentRegion, instance.getOsType());
        double currentMonthly = currentHourly.isPresent() ? PriceMath.toMonthly(currentHourly.getAsDouble()) : 0;

        List<String> regions = new ArrayList<>();
        regions.add(currentRegion);
        alternatives.stream().filter(region -> !region.equalsIgnoreCase(currentRegion)).forEach(regions::add);

        Map<String, Double> hourlyPrices = priceClient.hourlyPrices(instance.getVmSize(), regions, instance.getOsType());

        List<RegionPrice> priced = new ArrayList<>();
        List<String> unpriced = new ArrayList<>();
        for (String region : regions) {
            Double hourly = hourlyPrices.get(region);
            if (hourly == null || hourly <= 0) {
                unpriced.add(region);
                continue;
            }
            double monthly = PriceMath.toMonthly(hourly);
            double savings = currentMonthly - monthly;
            double savingsPercent = currentMonthly > 0 ? savings / currentMonthly * 100 : 0;
            priced.add(new RegionPrice(region, hourly, monthly, savings, savingsPercent,
                    region.equalsIgnoreCase(currentRegion)));
        }
        priced.sort(Comparator.comparingDouble(RegionPrice::hourly));

        log.debug("Priced {} in {} of {} region(s)", instance.getVmSize(), priced.size(), regions.size());
        return new Comparison(instance, currentMonthly, priced, unpriced);
    }

    public record RegionPrice(String region, double hourly, double monthly, double savings,
                              double savingsPercent, boolean current) {
    }

    /**
     * Priced regions cheapest first, plus the regions that had no price for the SKU.
     */
    public record Comparison(InstanceDescriptor instance, double currentMonthly,
                             List<RegionPrice> priced, List<String> unpriced) {

        public boolean hasAlternatives() {
            return !priced.isEmpty() || !unpriced.isEmpty();
        }

        /**
         * The cheapest region, when it is not the current one and at least two regions are priced.
         */
        public Optional<RegionPrice> recommendedMove() {
            if (priced.size() < 2 || priced.get(0).current() || priced.get(0).savings() <= 0) {
                return Optional.empty();
            }
            return Optional.of(priced.get(0));
        }
    }
}
