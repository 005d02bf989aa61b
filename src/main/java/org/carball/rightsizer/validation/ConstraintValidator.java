package org.carball.rightsizer.validation;

import org.carball.rightsizer.model.sku.SkuFeature;
import org.carball.rightsizer.model.validation.ValidationOutcome;

import java.util.Set;

/**
 * Checks whether a SKU can actually be deployed: restrictions, quota and required features.
 * Implementations may throw on transport failure; a blocked SKU is a normal outcome.
 */
public interface ConstraintValidator {

    ValidationOutcome validate(String skuName, String region, int requiredVcpus, Set<SkuFeature> requiredFeatures);
}
