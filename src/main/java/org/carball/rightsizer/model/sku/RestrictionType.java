package org.carball.rightsizer.model.sku;

public enum RestrictionType {
    LOCATION,
    ZONE,
    SUBSCRIPTION,
    QUOTA,
    CAPACITY,
    FEATURE
}
