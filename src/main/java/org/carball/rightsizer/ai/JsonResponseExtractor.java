package org.carball.rightsizer.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of free-form model output. Tries the whole text, then a fenced code
 * block, then the first balanced brace span. An empty result means the model gave no usable
 * structure.
 */
@Slf4j
public class JsonResponseExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public JsonResponseExtractor() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    public Optional<JsonNode> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Optional<JsonNode> plain = parseObject(text.trim());
        if (plain.isPresent()) {
            return plain;
        }

        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            Optional<JsonNode> block = parseObject(fenced.group(1).trim());
            if (block.isPresent()) {
                return block;
            }
        }

        return findBalancedObject(text).flatMap(this::parseObject);
    }

    /**
     * Substring from the first '{' to its matching '}', ignoring braces inside string literals.
     */
    static Optional<String> findBalancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\' && inString) {
                escaped = true;
            } else if (c == '"') {
                inString = !inString;
            } else if (!inString) {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private Optional<JsonNode> parseObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("Not a JSON object: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
