package org.carball.rightsizer.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.connector.QuotaClient;
import org.carball.rightsizer.connector.SkuCatalogClient;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuFeature;
import org.carball.rightsizer.model.sku.SkuRestriction;
import org.carball.rightsizer.model.validation.QuotaSnapshot;
import org.carball.rightsizer.model.validation.ValidationOutcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates SKUs against the full regional catalog (restricted entries included) and the
 * regional quota usage. Both are read once per region and kept for the run.
 */
@Slf4j
public class CatalogConstraintValidator implements ConstraintValidator {

    private static final String SKU_PREFIX = "Standard_";
    private static final Pattern QUOTA_FAMILY_TOKEN =
            Pattern.compile("standard\\s+(\\S+)\\s+family", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOKEN_VERSION = Pattern.compile("v(\\d+)$", Pattern.CASE_INSENSITIVE);

    private final SkuCatalogClient catalogClient;
    private final QuotaClient quotaClient;

    private final Map<String, Map<String, SkuDescriptor>> catalogs = new ConcurrentHashMap<>();
    private final Map<String, List<QuotaSnapshot>> quotas = new ConcurrentHashMap<>();

    public CatalogConstraintValidator(SkuCatalogClient catalogClient, QuotaClient quotaClient) {
        this.catalogClient = catalogClient;
        this.quotaClient = quotaClient;
    }

    @Override
    public ValidationOutcome validate(String skuName, String region, int requiredVcpus,
                                      Set<SkuFeature> requiredFeatures) {
        return validate(skuName, region, requiredVcpus, requiredFeatures, List.of());
    }

    public ValidationOutcome validate(String skuName, String region, int requiredVcpus,
                                      Set<SkuFeature> requiredFeatures, List<String> requiredZones) {
        SkuDescriptor sku = catalogFor(region).get(skuName);
        if (sku == null) {
            return ValidationOutcome.blocked(List.of("SKU " + skuName + " not offered in " + region));
        }

        List<String> restrictions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (SkuRestriction restriction : sku.restrictions()) {
            restrictions.add(restriction.message());
        }

        QuotaSnapshot quota = null;
        if (requiredVcpus > 0) {
            quota = findQuota(skuName, region).orElse(null);
            if (quota == null) {
                warnings.add("No quota information for family " + quotaFamily(skuName) + " in " + region);
            } else if (quota.available() < requiredVcpus) {
                restrictions.add(String.format("Insufficient quota: need %d vCPUs, only %d available",
                        requiredVcpus, quota.available()));
            }
        }

        if (requiredZones != null && !requiredZones.isEmpty()) {
            List<String> missingZones = requiredZones.stream()
                    .filter(zone -> !sku.availableZones().contains(zone))
                    .toList();
            if (!missingZones.isEmpty()) {
                restrictions.add("SKU not available in zones: " + String.join(", ", missingZones));
            }
        }

        if (requiredFeatures != null && !requiredFeatures.isEmpty()) {
            String missingFeatures = requiredFeatures.stream()
                    .filter(feature -> !sku.hasFeature(feature))
                    .map(SkuFeature::getDisplayName)
                    .collect(Collectors.joining(", "));
            if (!missingFeatures.isEmpty()) {
                restrictions.add("Missing required features: " + missingFeatures);
            }
        }

        log.debug("Validated {} in {}: {} restriction(s)", skuName, region, restrictions.size());
        return new ValidationOutcome(restrictions.isEmpty(), restrictions, warnings, quota, sku.availableZones());
    }

    /**
     * Quota entry for the SKU's family. A family entry with the same version wins over other
     * entries of the family; without any family entry the total regional vCPU quota applies.
     */
    Optional<QuotaSnapshot> findQuota(String skuName, String region) {
        List<QuotaSnapshot> usage = quotaFor(region);
        String family = quotaFamily(skuName).toUpperCase(Locale.ROOT);
        int version = versionOf(skuName);

        QuotaSnapshot familyMatch = null;
        for (QuotaSnapshot quota : usage) {
            Matcher matcher = QUOTA_FAMILY_TOKEN.matcher(quota.family());
            if (!matcher.find()) {
                continue;
            }
            String token = matcher.group(1).toUpperCase(Locale.ROOT);
            if (!token.startsWith(family)) {
                continue;
            }
            if (versionOf(token) == version) {
                return Optional.of(quota);
            }
            if (familyMatch == null) {
                familyMatch = quota;
            }
        }
        if (familyMatch != null) {
            return Optional.of(familyMatch);
        }

        return usage.stream()
                .filter(quota -> {
                    String name = quota.family().toLowerCase(Locale.ROOT);
                    return name.contains("total") && name.contains("vcpu");
                })
                .findFirst();
    }

    /**
     * Letter prefix of the size part: Standard_D4s_v5 gives D, Standard_NC24ads_A100_v4 gives NC.
     */
    static String quotaFamily(String skuName) {
        String sizePart = skuName.startsWith(SKU_PREFIX) ? skuName.substring(SKU_PREFIX.length()) : skuName;
        int end = sizePart.indexOf('_');
        if (end >= 0) {
            sizePart = sizePart.substring(0, end);
        }

        StringBuilder family = new StringBuilder();
        for (char c : sizePart.toCharArray()) {
            if (!Character.isLetter(c)) {
                break;
            }
            family.append(c);
        }
        return family.isEmpty() ? "Standard" : family.toString();
    }

    private static int versionOf(String text) {
        Matcher matcher = TOKEN_VERSION.matcher(text);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 1;
    }

    private Map<String, SkuDescriptor> catalogFor(String region) {
        return catalogs.computeIfAbsent(region, key -> {
            Map<String, SkuDescriptor> byName = new LinkedHashMap<>();
            for (SkuDescriptor sku : catalogClient.listSkus(key, true)) {
                byName.putIfAbsent(sku.name(), sku);
            }
            return byName;
        });
    }

    private List<QuotaSnapshot> quotaFor(String region) {
        return quotas.computeIfAbsent(region, key -> List.copyOf(quotaClient.quotaUsage(key)));
    }
}
