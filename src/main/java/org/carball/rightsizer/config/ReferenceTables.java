package org.carball.rightsizer.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static upgrade-path and region-adjacency data.
 */
@Data
@Slf4j
public class ReferenceTables {

    static final String DEFAULT_RESOURCE = "/reference-tables.yml";

    @JsonProperty("generation_map")
    private LinkedHashMap<String, String> generationMap = new LinkedHashMap<>();

    @JsonProperty("region_alternatives")
    private Map<String, List<String>> regionAlternatives = new LinkedHashMap<>();

    public static ReferenceTables loadDefaults() {
        try (InputStream in = ReferenceTables.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            ReferenceTables tables = new ObjectMapper(new YAMLFactory()).readValue(in, ReferenceTables.class);
            log.debug("Loaded {} generation mappings and {} region groups",
                    tables.generationMap.size(), tables.regionAlternatives.size());
            return tables;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads tables from a user YAML file. Sections missing from the file keep the built-in data.
     */
    public static ReferenceTables load(String path) {
        ReferenceTables defaults = loadDefaults();
        if (path == null || path.isBlank()) {
            return defaults;
        }

        File file = new File(path);
        if (!file.exists()) {
            log.warn("Reference tables file not found: {}, using built-in tables", path);
            return defaults;
        }

        try {
            ReferenceTables custom = new ObjectMapper(new YAMLFactory()).readValue(file, ReferenceTables.class);
            if (custom.generationMap.isEmpty()) {
                custom.generationMap = defaults.generationMap;
            }
            if (custom.regionAlternatives.isEmpty()) {
                custom.regionAlternatives = defaults.regionAlternatives;
            }
            log.info("Loaded reference tables from: {}", path);
            return custom;
        } catch (IOException e) {
            log.warn("Could not parse reference tables {}: {}. Using built-in tables", path, e.getMessage());
            return defaults;
        }
    }

    /**
     * Successor for a SKU: an exact entry wins, otherwise the longest entry that prefixes the
     * name without splitting a size number (Standard_D1 does not match Standard_D16s_v5).
     */
    public Optional<String> findSuccessor(String skuName) {
        if (skuName == null) {
            return Optional.empty();
        }
        String exact = generationMap.get(skuName);
        if (exact != null) {
            return Optional.of(exact);
        }

        String bestKey = null;
        for (String key : generationMap.keySet()) {
            if (isPrefixMatch(skuName, key) && (bestKey == null || key.length() > bestKey.length())) {
                bestKey = key;
            }
        }
        return Optional.ofNullable(bestKey).map(generationMap::get);
    }

    public List<String> alternativesFor(String region) {
        if (region == null) {
            return List.of();
        }
        return Collections.unmodifiableList(regionAlternatives.getOrDefault(region.toLowerCase(), List.of()));
    }

    private static boolean isPrefixMatch(String skuName, String key) {
        if (!skuName.startsWith(key) || skuName.length() == key.length()) {
            return false;
        }
        return !Character.isDigit(skuName.charAt(key.length()));
    }
}
