package org.carball.rightsizer.model.validation;

import java.util.List;
import java.util.Optional;

/**
 * Result of checking one SKU against live restrictions, quota and zones.
 */
public record ValidationOutcome(
    boolean valid,
    List<String> restrictions,
    List<String> warnings,
    QuotaSnapshot quota,
    List<String> availableZones
) {

    public ValidationOutcome {
        restrictions = restrictions == null ? List.of() : List.copyOf(restrictions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        availableZones = availableZones == null ? List.of() : List.copyOf(availableZones);
    }

    public static ValidationOutcome deployable(QuotaSnapshot quota) {
        return new ValidationOutcome(true, List.of(), List.of(), quota, List.of());
    }

    public static ValidationOutcome blocked(List<String> restrictions) {
        return new ValidationOutcome(false, restrictions, List.of(), null, List.of());
    }

    public Optional<QuotaSnapshot> quotaSnapshot() {
        return Optional.ofNullable(quota);
    }
}
