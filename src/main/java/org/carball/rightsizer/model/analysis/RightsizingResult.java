package org.carball.rightsizer.model.analysis;

import lombok.Data;
import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.recommendation.AIRecommendation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Analysis outcome for one instance, filled in stage by stage by the analyzer.
 */
@Data
public class RightsizingResult {

    public static final String NO_CHANGE = "No change";

    private final InstanceDescriptor instance;

    private AdvisorHint advisorHint;
    private AIRecommendation aiRecommendation;

    private String currentGeneration = "";
    private String recommendedGenerationUpgrade;
    private double generationSavings;

    private List<RegionAlternative> cheaperRegions = new ArrayList<>();
    private List<CandidateResult> rankedCandidates = new ArrayList<>();

    private List<String> constraintIssues = new ArrayList<>();
    private List<String> quotaWarnings = new ArrayList<>();

    private double totalPotentialSavings;
    private RecommendationType recommendationType = RecommendationType.NONE;
    private Priority priority = Priority.MEDIUM;
    private boolean deploymentFeasible = true;

    public Optional<CandidateResult> topCandidate() {
        return rankedCandidates.isEmpty() ? Optional.empty() : Optional.of(rankedCandidates.get(0));
    }

    public Optional<RegionAlternative> bestRegion() {
        return cheaperRegions.isEmpty() ? Optional.empty() : Optional.of(cheaperRegions.get(0));
    }

    /**
     * SKU to show as the recommendation: AI, then advisor, then generation upgrade, then the top
     * ranked candidate.
     */
    public String recommendedSku() {
        if (aiRecommendation != null) {
            return aiRecommendation.recommendedSku();
        }
        if (advisorHint != null && advisorHint.recommendedSku() != null && !advisorHint.recommendedSku().isBlank()) {
            return advisorHint.recommendedSku();
        }
        if (recommendedGenerationUpgrade != null) {
            return recommendedGenerationUpgrade;
        }
        return topCandidate().map(CandidateResult::getSkuName).orElse(NO_CHANGE);
    }

    public boolean hasSavings() {
        return totalPotentialSavings > 0;
    }
}
