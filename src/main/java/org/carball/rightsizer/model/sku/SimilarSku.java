package org.carball.rightsizer.model.sku;

/**
 * An unrestricted SKU and how many of the compared attributes it shares with a target, in percent.
 */
public record SimilarSku(SkuDescriptor sku, int similarity) {
}
