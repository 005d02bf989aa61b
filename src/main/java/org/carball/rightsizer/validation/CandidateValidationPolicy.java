package org.carball.rightsizer.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.config.RightsizingSettings;
import org.carball.rightsizer.model.analysis.CandidateResult;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.sku.SkuFeature;
import org.carball.rightsizer.model.validation.QuotaSnapshot;
import org.carball.rightsizer.model.validation.ValidationOutcome;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates the head of a ranked candidate list and moves the first deployable SKU to the top.
 *
 * <p>Only the first {@code depth} candidates are checked. When none of them validates, the
 * order is left alone and the result is marked as not deployable.</p>
 */
@Slf4j
public class CandidateValidationPolicy {

    private final ConstraintValidator validator;
    private final int depth;
    private final double quotaWarningPercent;

    public CandidateValidationPolicy(ConstraintValidator validator, int depth, double quotaWarningPercent) {
        this.validator = validator;
        this.depth = depth;
        this.quotaWarningPercent = quotaWarningPercent;
    }

    public static CandidateValidationPolicy fromSettings(ConstraintValidator validator, RightsizingSettings settings) {
        return new CandidateValidationPolicy(validator, settings.getValidationDepth(), settings.getQuotaWarningPercent());
    }

    public void apply(RightsizingResult result, Set<SkuFeature> requiredFeatures) {
        List<CandidateResult> ranked = result.getRankedCandidates();
        if (ranked.isEmpty()) {
            return;
        }

        String region = result.getInstance().getRegion();
        List<String> issues = new ArrayList<>();
        Map<String, QuotaSnapshot> quotas = new HashMap<>();
        int firstValid = -1;

        int limit = Math.min(depth, ranked.size());
        for (int i = 0; i < limit; i++) {
            CandidateResult candidate = ranked.get(i);
            try {
                ValidationOutcome outcome = validator.validate(
                        candidate.getSkuName(), region, candidate.getVcpus(), requiredFeatures);

                candidate.setValid(outcome.valid());
                if (!outcome.valid()) {
                    candidate.addValidationIssues(outcome.restrictions());
                    issues.addAll(outcome.restrictions());
                }
                outcome.quotaSnapshot().ifPresent(quota -> quotas.put(candidate.getSkuName(), quota));
                if (!outcome.warnings().isEmpty()) {
                    log.debug("Validation warnings for {} in {}: {}", candidate.getSkuName(), region, outcome.warnings());
                }
            } catch (RuntimeException e) {
                // unconfirmed, so the candidate keeps whatever validity it had
                log.warn("Could not validate {} in {} for {}: {}",
                        candidate.getSkuName(), region, result.getInstance().getName(), e.getMessage());
            }

            if (firstValid < 0 && candidate.isValid()) {
                firstValid = i;
            }
        }

        if (firstValid > 0) {
            CandidateResult promoted = ranked.remove(firstValid);
            ranked.add(0, promoted);
            log.debug("Promoted {} from rank {} for {}", promoted.getSkuName(), firstValid + 1,
                    result.getInstance().getName());
        }

        if (firstValid < 0) {
            result.setDeploymentFeasible(false);
            result.getConstraintIssues().addAll(issues);
        } else {
            result.setDeploymentFeasible(true);
        }

        CandidateResult top = ranked.get(0);
        QuotaSnapshot quota = quotas.get(top.getSkuName());
        if (quota != null && quota.usagePercent() >= quotaWarningPercent) {
            result.getQuotaWarnings().add(String.format("Quota warning for %s: %.1f%% used",
                    top.getSkuName(), quota.usagePercent()));
        }
    }
}
