package org.carball.rightsizer.cache;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.analyzer.PriceLookup;
import org.carball.rightsizer.connector.PriceClient;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hourly prices keyed by SKU, region and OS. Unknown prices are not cached, so a later lookup
 * asks the price client again.
 */
@Slf4j
public class PriceCache {

    private final PriceClient client;
    private final Map<String, Double> prices = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public PriceCache(PriceClient client) {
        this.client = client;
    }

    public OptionalDouble hourlyPrice(String skuName, String region, String osType) {
        String key = key(skuName, region, osType);
        Double cached = prices.get(key);
        if (cached != null) {
            return OptionalDouble.of(cached);
        }

        OptionalDouble fetched = client.hourlyPrice(skuName, region, osType);
        if (fetched.isEmpty()) {
            log.trace("No price for {}", key);
            return fetched;
        }

        lock.lock();
        try {
            // first writer wins; entries are never replaced
            Double existing = prices.putIfAbsent(key, fetched.getAsDouble());
            return OptionalDouble.of(existing != null ? existing : fetched.getAsDouble());
        } finally {
            lock.unlock();
        }
    }

    public PriceLookup lookupFor(String region, String osType) {
        return skuName -> hourlyPrice(skuName, region, osType);
    }

    public int size() {
        return prices.size();
    }

    static String key(String skuName, String region, String osType) {
        return skuName + ":" + region + ":" + osType;
    }
}
