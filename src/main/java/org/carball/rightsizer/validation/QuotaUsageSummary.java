package org.carball.rightsizer.validation;

import org.carball.rightsizer.model.validation.QuotaSnapshot;

import java.util.List;
import java.util.Locale;

/**
 * Quota entries of one region grouped by how close they are to their limit.
 */
public record QuotaUsageSummary(String region, List<QuotaSnapshot> quotas,
                                List<QuotaSnapshot> critical, List<QuotaSnapshot> warning) {

    public static final double CRITICAL_PERCENT = 90.0;
    public static final double WARNING_PERCENT = 70.0;

    public static QuotaUsageSummary of(String region, List<QuotaSnapshot> usage, String familyFilter) {
        List<QuotaSnapshot> quotas = familyFilter == null || familyFilter.isBlank()
                ? List.copyOf(usage)
                : usage.stream()
                        .filter(quota -> quota.family().toLowerCase(Locale.ROOT)
                                .contains(familyFilter.toLowerCase(Locale.ROOT)))
                        .toList();

        List<QuotaSnapshot> critical = quotas.stream()
                .filter(quota -> quota.usagePercent() >= CRITICAL_PERCENT)
                .toList();
        List<QuotaSnapshot> warning = quotas.stream()
                .filter(quota -> quota.usagePercent() >= WARNING_PERCENT && quota.usagePercent() < CRITICAL_PERCENT)
                .toList();
        return new QuotaUsageSummary(region, quotas, critical, warning);
    }

    public int okCount() {
        return quotas.size() - critical.size() - warning.size();
    }

    public boolean isEmpty() {
        return quotas.isEmpty();
    }
}
