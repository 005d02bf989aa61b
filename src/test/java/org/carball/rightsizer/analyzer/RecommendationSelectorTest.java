package org.carball.rightsizer.analyzer;

import org.carball.rightsizer.model.analysis.CandidateResult;
import org.carball.rightsizer.model.analysis.Priority;
import org.carball.rightsizer.model.analysis.RecommendationType;
import org.carball.rightsizer.model.analysis.RegionAlternative;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.recommendation.AIRecommendation;
import org.carball.rightsizer.model.recommendation.Confidence;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationSelectorTest {

    private final RecommendationSelector selector = new RecommendationSelector();

    @Test
    void shouldRecommendShutdownForIdleInstance() {
        // Given
        RightsizingResult result = result(3.0, 8.0, 140.16);
        result.setGenerationSavings(30.0);

        // When
        selector.select(result);

        // Then
        assertThat(result.getRecommendationType()).isEqualTo(RecommendationType.SHUTDOWN);
        assertThat(result.getTotalPotentialSavings()).isEqualTo(140.16);
        assertThat(result.getPriority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void shouldNotTreatMissingMetricsAsIdle() {
        // Given
        RightsizingResult result = result(null, null, 140.16);

        // When
        selector.select(result);

        // Then
        assertThat(result.getRecommendationType()).isEqualTo(RecommendationType.NONE);
        assertThat(result.getTotalPotentialSavings()).isZero();
        assertThat(result.getPriority()).isEqualTo(Priority.LOW);
    }

    @Test
    void shouldRequireBothCpuSignalsBelowShutdownThresholds() {
        // Given
        RightsizingResult result = result(3.0, 12.0, 140.16);

        // When
        selector.select(result);

        // Then
        assertThat(result.getRecommendationType()).isNotEqualTo(RecommendationType.SHUTDOWN);
    }

    @Test
    void shouldPickLargestSavingsSource() {
        // Given
        RightsizingResult result = result(40.0, 70.0, 1000.0);
        result.setGenerationSavings(50.0);
        result.setAdvisorHint(AdvisorHint.builder().instanceName("vm").estimatedSavings(120.0).build());
        result.setCheaperRegions(new ArrayList<>(List.of(new RegionAlternative("eastus2", 400.0, 600.0))));
        result.setRankedCandidates(new ArrayList<>(List.of(candidate(200.0))));

        // When
        selector.select(result);

        // Then
        assertThat(result.getRecommendationType()).isEqualTo(RecommendationType.REGION_MOVE);
        assertThat(result.getTotalPotentialSavings()).isEqualTo(600.0);
        assertThat(result.getPriority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void shouldKeepEarlierSourceOnTie() {
        // Given
        RightsizingResult result = result(40.0, 70.0, 500.0);
        result.setGenerationSavings(150.0);
        result.setRankedCandidates(new ArrayList<>(List.of(candidate(150.0))));

        // When
        selector.select(result);

        // Then
        assertThat(result.getRecommendationType()).isEqualTo(RecommendationType.GENERATION_UPGRADE);
        assertThat(result.getPriority()).isEqualTo(Priority.MEDIUM);
    }

    @Test
    void shouldUseAiSavingsWhenLargest() {
        // Given
        RightsizingResult result = result(40.0, 70.0, 500.0);
        result.setAdvisorHint(AdvisorHint.builder().instanceName("vm").estimatedSavings(40.0).build());
        result.setAiRecommendation(AIRecommendation.builder()
                .recommendedSku("Standard_D2s_v5")
                .confidence(Confidence.HIGH)
                .estimatedMonthlySavings(80.0)
                .build());

        // When
        selector.select(result);

        // Then
        assertThat(result.getRecommendationType()).isEqualTo(RecommendationType.RIGHTSIZE);
        assertThat(result.getTotalPotentialSavings()).isEqualTo(80.0);
        assertThat(result.getPriority()).isEqualTo(Priority.LOW);
        assertThat(result.recommendedSku()).isEqualTo("Standard_D2s_v5");
    }

    private static RightsizingResult result(Double avgCpu, Double maxCpu, double monthly) {
        InstanceDescriptor instance = InstanceDescriptor.builder()
                .name("vm")
                .region("eastus")
                .vmSize("Standard_D4s_v3")
                .build();
        instance.setAvgCpu(avgCpu);
        instance.setMaxCpu(maxCpu);
        instance.setCurrentPriceMonthly(monthly);
        return new RightsizingResult(instance);
    }

    private static CandidateResult candidate(double savings) {
        return CandidateResult.builder()
                .skuName("Standard_D2s_v5")
                .vcpus(2)
                .memoryGb(8)
                .savings(savings)
                .build();
    }
}
