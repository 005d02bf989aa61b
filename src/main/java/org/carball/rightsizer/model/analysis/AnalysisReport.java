package org.carball.rightsizer.model.analysis;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one analysis run. Callers serialize access to {@link #record}.
 */
@Data
public class AnalysisReport {

    private final Instant timestamp;
    private final String scope;

    private int totalInstances;
    private int analyzedInstances;
    private int instancesWithRecommendations;

    private double totalCurrentCost;
    private double totalPotentialSavings;

    private final Map<RecommendationType, Integer> typeCounts = new EnumMap<>(RecommendationType.class);
    private final List<RightsizingResult> results = new ArrayList<>();

    private String executiveSummary = "";

    public void record(RightsizingResult result) {
        results.add(result);
        totalCurrentCost += result.getInstance().monthlyCostOrZero();

        if (result.hasSavings()) {
            totalPotentialSavings += result.getTotalPotentialSavings();
            instancesWithRecommendations++;
            typeCounts.merge(result.getRecommendationType(), 1, Integer::sum);
        }
        analyzedInstances++;
    }

    public void sortBySavings() {
        results.sort(Comparator.comparingDouble(RightsizingResult::getTotalPotentialSavings).reversed());
    }

    public int countFor(RecommendationType type) {
        return typeCounts.getOrDefault(type, 0);
    }

    public double getTotalAnnualSavings() {
        return totalPotentialSavings * 12;
    }
}
