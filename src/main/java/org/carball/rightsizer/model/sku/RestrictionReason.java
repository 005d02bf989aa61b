package org.carball.rightsizer.model.sku;

public enum RestrictionReason {
    QUOTA_EXCEEDED("QuotaExceeded"),
    NOT_AVAILABLE_FOR_SUBSCRIPTION("NotAvailableForSubscription"),
    ZONE_NOT_SUPPORTED("ZoneNotSupported"),
    CAPACITY_NOT_AVAILABLE("CapacityNotAvailable"),
    FEATURE_NOT_SUPPORTED("FeatureNotSupported"),
    RETIRED("Retired");

    private final String code;

    RestrictionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static RestrictionReason fromCode(String code) {
        for (RestrictionReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code)) {
                return reason;
            }
        }
        return NOT_AVAILABLE_FOR_SUBSCRIPTION;
    }
}
