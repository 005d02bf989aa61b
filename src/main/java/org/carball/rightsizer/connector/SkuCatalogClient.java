package org.carball.rightsizer.connector;

import org.carball.rightsizer.model.sku.SkuDescriptor;

import java.util.List;

public interface SkuCatalogClient {

    List<SkuDescriptor> listSkus(String region, boolean includeRestricted);
}
