package org.carball.rightsizer.model.analysis;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.carball.rightsizer.model.sku.SkuFeature;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A ranked replacement SKU. Only validity and validation issues change after scoring.
 */
@Getter
@Builder
@ToString
public class CandidateResult {

    private final String skuName;
    private final int vcpus;
    private final double memoryGb;
    private final String generation;

    @Builder.Default
    private final Set<SkuFeature> features = Set.of();

    private final double monthlyPrice;
    private final double savings;
    private final double savingsPercent;
    private final double score;

    @Setter
    @Builder.Default
    private boolean valid = true;

    @Builder.Default
    private final List<String> validationIssues = new ArrayList<>();

    public void addValidationIssues(List<String> issues) {
        validationIssues.addAll(issues);
    }
}
