package org.carball.rightsizer.analyzer;

import java.util.OptionalDouble;

/**
 * Hourly price of a SKU in the region and OS being analyzed; empty when unknown.
 */
@FunctionalInterface
public interface PriceLookup {

    OptionalDouble hourlyPrice(String skuName);
}
