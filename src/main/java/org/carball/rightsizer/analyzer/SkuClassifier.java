package org.carball.rightsizer.analyzer;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives generation and family from SKU names. All methods are total: unknown shapes map to
 * "v1", version 1 or an empty family rather than failing.
 */
public final class SkuClassifier {

    private static final String SKU_PREFIX = "Standard_";

    // Tried in order: Standard_D4s_v5, Standard_NC4as_T4_v3, Standard_Dpsv5
    private static final Pattern TRAILING_VERSION = Pattern.compile("_v(\\d+)$");
    private static final Pattern EMBEDDED_VERSION = Pattern.compile("_v(\\d+)_");
    private static final Pattern INLINE_VERSION = Pattern.compile("[a-z]v(\\d+)$", Pattern.CASE_INSENSITIVE);

    // First-generation sizes that predate the version suffix
    private static final Pattern LEGACY_SIZE =
            Pattern.compile("Standard_(DS|D[1-9]|A\\d|B\\d+[ms]*|F\\d+s?)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern ANY_VERSION = Pattern.compile("v(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern FAMILY = Pattern.compile("Standard_([A-Z]+)");

    private static final Set<String> TWO_LETTER_FAMILIES =
            Set.of("DC", "EC", "NC", "ND", "NV", "HB", "HC", "HX", "FX", "EB");

    private static final String DEFAULT_GENERATION = "v1";

    private SkuClassifier() {
    }

    public static String extractGeneration(String skuName) {
        if (skuName == null || skuName.isEmpty()) {
            return DEFAULT_GENERATION;
        }

        for (Pattern pattern : new Pattern[]{TRAILING_VERSION, EMBEDDED_VERSION, INLINE_VERSION}) {
            Matcher matcher = pattern.matcher(skuName);
            if (matcher.find()) {
                return "v" + matcher.group(1);
            }
        }

        if (LEGACY_SIZE.matcher(skuName).matches()) {
            return DEFAULT_GENERATION;
        }

        Matcher anyVersion = ANY_VERSION.matcher(skuName);
        if (anyVersion.find()) {
            return "v" + anyVersion.group(1);
        }

        return DEFAULT_GENERATION;
    }

    public static String extractFamily(String skuName) {
        if (skuName == null) {
            return "";
        }

        Matcher matcher = FAMILY.matcher(skuName);
        if (!matcher.lookingAt()) {
            return "";
        }

        String familyPart = matcher.group(1);
        if (familyPart.length() >= 2 && TWO_LETTER_FAMILIES.contains(familyPart.substring(0, 2))) {
            return familyPart.substring(0, 2);
        }
        return familyPart.substring(0, 1);
    }

    /**
     * Numeric generation of either a raw SKU name or a generation label. Comma-joined labels
     * such as the hypervisor list "V1,V2" yield their highest value.
     */
    public static int extractVersionNumber(String generationOrSku) {
        if (generationOrSku == null || generationOrSku.isEmpty()) {
            return 1;
        }

        if (generationOrSku.startsWith(SKU_PREFIX)) {
            return versionOf(extractGeneration(generationOrSku));
        }

        int max = 0;
        Matcher matcher = ANY_VERSION.matcher(generationOrSku);
        while (matcher.find()) {
            max = Math.max(max, parseOrZero(matcher.group(1)));
        }
        return max > 0 ? max : 1;
    }

    /**
     * Version number of the SKU naming scheme, as opposed to the hypervisor generation.
     */
    public static int skuVersion(String skuName) {
        return versionOf(extractGeneration(skuName));
    }

    private static int versionOf(String generationLabel) {
        Matcher matcher = ANY_VERSION.matcher(generationLabel);
        if (matcher.find()) {
            int version = parseOrZero(matcher.group(1));
            return version > 0 ? version : 1;
        }
        return 1;
    }

    private static int parseOrZero(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return 0;
        }
    }
}
