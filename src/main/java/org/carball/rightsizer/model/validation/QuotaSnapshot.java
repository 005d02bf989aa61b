package org.carball.rightsizer.model.validation;

/**
 * Point-in-time quota usage for a VM family in a region, in vCPUs.
 */
public record QuotaSnapshot(String family, String region, long used, long limit) {

    public long available() {
        return Math.max(0, limit - used);
    }

    public double usagePercent() {
        return limit > 0 ? (double) used / limit * 100 : 0;
    }
}
