package org.carball.rightsizer.ai;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.rightsizer.model.recommendation.AIRecommendation;
import org.carball.rightsizer.model.recommendation.Confidence;
import org.carball.rightsizer.model.recommendation.MigrationComplexity;

import java.util.ArrayList;
import java.util.List;

/**
 * Coerces a parsed model response into an {@link AIRecommendation} whose enums are in range,
 * savings are non-negative and recommended SKU is never empty.
 */
public class RecommendationNormalizer {

    public AIRecommendation normalize(JsonNode response, String instanceName, String currentSku) {
        String recommendedSku = text(response, "recommended_sku");
        if (recommendedSku.isBlank()) {
            recommendedSku = currentSku;
        }

        return AIRecommendation.builder()
                .instanceName(instanceName)
                .currentSku(currentSku)
                .recommendedSku(recommendedSku)
                .confidence(Confidence.fromText(text(response, "confidence")))
                .reasoning(text(response, "reasoning"))
                .estimatedMonthlySavings(savings(response.get("estimated_monthly_savings_usd")))
                .riskAssessment(text(response, "risk_assessment"))
                .migrationComplexity(MigrationComplexity.fromText(text(response, "migration_complexity")))
                .recommendedActions(actions(response.get("recommended_actions")))
                .build();
    }

    static double savings(JsonNode node) {
        double value = 0.0;
        if (node == null || node.isNull()) {
            return value;
        }
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim().replace("$", "").replace(",", ""));
            } catch (NumberFormatException e) {
                value = 0.0;
            }
        }
        return Double.isFinite(value) ? Math.max(0.0, value) : 0.0;
    }

    static List<String> actions(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            return List.of();
        }

        List<String> actions = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isNull()) {
                actions.add(item.isTextual() ? item.asText() : item.toString());
            }
        }
        return actions;
    }

    private static String text(JsonNode response, String field) {
        JsonNode node = response.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : "";
    }
}
