package org.carball.rightsizer.connector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

public interface PriceClient {

    /**
     * Pay-as-you-go hourly price, empty when the SKU has no published price there.
     */
    OptionalDouble hourlyPrice(String skuName, String region, String osType);

    /**
     * Hourly prices of one SKU across several regions; regions without a price are left out.
     */
    default Map<String, Double> hourlyPrices(String skuName, List<String> regions, String osType) {
        Map<String, Double> prices = new LinkedHashMap<>();
        for (String region : regions) {
            OptionalDouble price = hourlyPrice(skuName, region, osType);
            if (price.isPresent()) {
                prices.put(region, price.getAsDouble());
            }
        }
        return prices;
    }
}
