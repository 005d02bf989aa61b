package org.carball.rightsizer.model.instance;

import lombok.Builder;

/**
 * A platform advisor's cost recommendation for a single instance.
 */
@Builder
public record AdvisorHint(
    String id,
    String instanceName,
    String resourceGroup,
    String category,
    String impact,
    String problem,
    String solution,
    String currentSku,
    String recommendedSku,
    Double estimatedSavings,
    Double estimatedSavingsPercent
) {

    public boolean appliesTo(InstanceDescriptor instance) {
        return instanceName != null && instanceName.equalsIgnoreCase(instance.getName());
    }

    public double savingsOrZero() {
        return estimatedSavings != null ? estimatedSavings : 0.0;
    }
}
