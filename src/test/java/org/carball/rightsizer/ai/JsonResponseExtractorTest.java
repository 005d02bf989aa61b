package org.carball.rightsizer.ai;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResponseExtractorTest {

    private final JsonResponseExtractor extractor = new JsonResponseExtractor();

    @Test
    void shouldParsePlainJson() {
        // When
        Optional<JsonNode> json = extractor.extract("{\"recommended_sku\": \"Standard_D2s_v5\"}");

        // Then
        assertThat(json).isPresent();
        assertThat(json.get().get("recommended_sku").asText()).isEqualTo("Standard_D2s_v5");
    }

    @Test
    void shouldParseFencedBlock() {
        // Given
        String response = """
            Here is my recommendation:
            ```json
            {"recommended_sku": "Standard_E4s_v5", "confidence": "High"}
            ```
            Let me know if you need more detail.
            """;

        // When
        Optional<JsonNode> json = extractor.extract(response);

        // Then
        assertThat(json).isPresent();
        assertThat(json.get().get("confidence").asText()).isEqualTo("High");
    }

    @Test
    void shouldFindBalancedObjectInProse() {
        // Given
        String response = "Based on the metrics {\"recommended_sku\": \"Standard_B2ms\", "
                + "\"reasoning\": \"low usage {idle}\"} is the best option.";

        // When
        Optional<JsonNode> json = extractor.extract(response);

        // Then
        assertThat(json).isPresent();
        assertThat(json.get().get("reasoning").asText()).isEqualTo("low usage {idle}");
    }

    @Test
    void shouldIgnoreBracesInsideEscapedStrings() {
        // Given
        String text = "prefix {\"a\": \"quote \\\" and } brace\"} suffix";

        // When
        Optional<String> span = JsonResponseExtractor.findBalancedObject(text);

        // Then
        assertThat(span).hasValue("{\"a\": \"quote \\\" and } brace\"}");
    }

    @Test
    void shouldRejectNonObjectJson() {
        assertThat(extractor.extract("[1, 2, 3]")).isEmpty();
        assertThat(extractor.extract("\"just a string\"")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForUnusableText() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
        assertThat(extractor.extract("I cannot help with that.")).isEmpty();
        assertThat(extractor.extract("{ unterminated")).isEmpty();
    }
}
