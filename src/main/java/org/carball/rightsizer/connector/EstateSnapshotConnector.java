package org.carball.rightsizer.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.sku.RestrictionReason;
import org.carball.rightsizer.model.sku.RestrictionType;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuRestriction;
import org.carball.rightsizer.model.validation.QuotaSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Reads an exported estate snapshot (inventory, metrics, advisor output, SKU catalogs, prices
 * and quotas) from a JSON file instead of calling the cloud APIs.
 */
@Slf4j
public class EstateSnapshotConnector implements InventoryClient, SkuCatalogClient, PriceClient, QuotaClient {

    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    private final JsonNode exportData;
    private final Map<String, Double> prices = new HashMap<>();

    public EstateSnapshotConnector(String filePath) throws IOException {
        ObjectMapper objectMapper = new ObjectMapper();
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("Estate snapshot file not found: " + filePath);
        }

        String content = Files.readString(path);
        exportData = objectMapper.readTree(content);

        validateExportFormat();
        indexPrices();
    }

    @Override
    public String scopeName() {
        JsonNode metadata = exportData.get("export_metadata");
        if (metadata != null && metadata.hasNonNull("subscription")) {
            return metadata.get("subscription").asText();
        }
        return "snapshot";
    }

    @Override
    public List<InstanceDescriptor> listInstances(String resourceGroup) {
        List<InstanceDescriptor> results = new ArrayList<>();
        for (JsonNode node : exportData.get("instances")) {
            InstanceDescriptor instance = parseInstance(node);
            if (resourceGroup == null || resourceGroup.equalsIgnoreCase(instance.getResourceGroup())) {
                results.add(instance);
            }
        }
        return results;
    }

    /**
     * Copies the exported utilization summaries onto the instance. Memory exported as available
     * bytes is converted to a used percentage with the size's memory from the catalog.
     */
    @Override
    public void enrichWithMetrics(InstanceDescriptor instance, int lookbackDays) {
        JsonNode metrics = exportData.path("metrics").get(instance.getName());
        if (metrics == null || !metrics.isObject()) {
            log.debug("No metrics exported for {}", instance.getName());
            return;
        }

        instance.setAvgCpu(optionalDouble(metrics, "avg_cpu"));
        instance.setMaxCpu(optionalDouble(metrics, "max_cpu"));
        instance.setAvgDiskIops(optionalDouble(metrics, "avg_disk_iops"));
        instance.setAvgNetworkIn(optionalDouble(metrics, "avg_network_in"));
        instance.setAvgNetworkOut(optionalDouble(metrics, "avg_network_out"));

        if (metrics.has("avg_memory")) {
            instance.setAvgMemory(optionalDouble(metrics, "avg_memory"));
            instance.setMaxMemory(optionalDouble(metrics, "max_memory"));
        } else if (metrics.has("available_memory_bytes")) {
            applyAvailableMemory(instance, metrics.get("available_memory_bytes"));
        }
    }

    @Override
    public List<AdvisorHint> advisorHints() {
        List<AdvisorHint> hints = new ArrayList<>();
        JsonNode recommendations = exportData.get("advisor_recommendations");
        if (recommendations == null || !recommendations.isArray()) {
            return hints;
        }

        for (JsonNode node : recommendations) {
            hints.add(AdvisorHint.builder()
                    .id(node.path("id").asText(""))
                    .instanceName(node.path("instance_name").asText(null))
                    .resourceGroup(node.path("resource_group").asText(null))
                    .category(node.path("category").asText("Cost"))
                    .impact(node.path("impact").asText("Medium"))
                    .problem(node.path("problem").asText(""))
                    .solution(node.path("solution").asText(""))
                    .currentSku(node.path("current_sku").asText(null))
                    .recommendedSku(node.path("recommended_sku").asText(null))
                    .estimatedSavings(optionalDouble(node, "estimated_savings"))
                    .estimatedSavingsPercent(optionalDouble(node, "estimated_savings_percent"))
                    .build());
        }
        return hints;
    }

    @Override
    public List<SkuDescriptor> listSkus(String region, boolean includeRestricted) {
        List<SkuDescriptor> results = new ArrayList<>();
        JsonNode skus = regionNode("skus", region);
        if (skus == null || !skus.isArray()) {
            log.debug("No SKU catalog exported for {}", region);
            return results;
        }

        for (JsonNode node : skus) {
            List<SkuRestriction> restrictions = parseRestrictions(node.get("restrictions"), region);
            if (!includeRestricted && blocksRegion(restrictions)) {
                continue;
            }
            results.add(SkuCapabilityMapper.toDescriptor(
                    node.get("name").asText(),
                    parseCapabilities(node.get("capabilities")),
                    restrictions,
                    textList(node.get("zones"))));
        }
        return results;
    }

    @Override
    public OptionalDouble hourlyPrice(String skuName, String region, String osType) {
        Double price = prices.get(priceKey(skuName, region, osType));
        return price != null ? OptionalDouble.of(price) : OptionalDouble.empty();
    }

    @Override
    public List<QuotaSnapshot> quotaUsage(String region) {
        List<QuotaSnapshot> results = new ArrayList<>();
        JsonNode quotas = regionNode("quotas", region);
        if (quotas == null || !quotas.isArray()) {
            return results;
        }

        for (JsonNode node : quotas) {
            results.add(new QuotaSnapshot(
                    node.get("name").asText(),
                    region,
                    node.path("current_value").asLong(0),
                    node.path("limit").asLong(0)));
        }
        return results;
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in snapshot file");
        }

        JsonNode instances = exportData.get("instances");
        if (instances == null || !instances.isArray()) {
            throw new IllegalStateException("Missing or invalid instances section in snapshot file");
        }

        String[] requiredFields = {"name", "location", "vm_size"};
        for (JsonNode instance : instances) {
            for (String field : requiredFields) {
                if (!instance.hasNonNull(field)) {
                    throw new IllegalStateException("Instance entry missing required field: " + field);
                }
            }
        }

        for (String section : new String[]{"skus", "quotas", "metrics", "prices"}) {
            JsonNode node = exportData.get(section);
            if (node != null && !node.isObject()) {
                throw new IllegalStateException("Invalid " + section + " section in snapshot file");
            }
        }

        JsonNode skus = exportData.get("skus");
        if (skus != null) {
            Iterator<Map.Entry<String, JsonNode>> regions = skus.fields();
            while (regions.hasNext()) {
                Map.Entry<String, JsonNode> entry = regions.next();
                for (JsonNode sku : entry.getValue()) {
                    if (!sku.hasNonNull("name")) {
                        throw new IllegalStateException("SKU entry without name in region " + entry.getKey());
                    }
                }
            }
        }
    }

    private void indexPrices() {
        JsonNode priceNode = exportData.get("prices");
        if (priceNode == null) {
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> entries = priceNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String[] parts = entry.getKey().split("\\|");
            if (parts.length != 3 || !entry.getValue().isNumber()) {
                log.warn("Skipping malformed price entry: {}", entry.getKey());
                continue;
            }
            prices.put(priceKey(parts[0], parts[1], parts[2]), entry.getValue().asDouble());
        }
        log.debug("Indexed {} prices from snapshot", prices.size());
    }

    private InstanceDescriptor parseInstance(JsonNode node) {
        Map<String, String> tags = new LinkedHashMap<>();
        JsonNode tagNode = node.get("tags");
        if (tagNode != null && tagNode.isObject()) {
            tagNode.fields().forEachRemaining(tag -> tags.put(tag.getKey(), tag.getValue().asText()));
        }

        return InstanceDescriptor.builder()
                .name(node.get("name").asText())
                .resourceGroup(node.path("resource_group").asText(""))
                .region(node.get("location").asText())
                .vmSize(node.get("vm_size").asText())
                .instanceId(node.path("instance_id").asText(""))
                .osType(node.path("os_type").asText("Linux"))
                .powerState(node.path("power_state").asText("running"))
                .tags(tags)
                .dataDiskCount(node.path("data_disk_count").asInt(0))
                .nicCount(node.path("nic_count").asInt(1))
                .build();
    }

    private void applyAvailableMemory(InstanceDescriptor instance, JsonNode availableBytes) {
        Double avgAvailable = optionalDouble(availableBytes, "avg");
        if (avgAvailable == null) {
            return;
        }
        Double minAvailable = optionalDouble(availableBytes, "min");

        double totalBytes = listSkus(instance.getRegion(), true).stream()
                .filter(sku -> sku.name().equalsIgnoreCase(instance.getVmSize()))
                .mapToDouble(sku -> sku.memoryGb() * BYTES_PER_GB)
                .findFirst()
                .orElse(0.0);
        if (totalBytes <= 0) {
            log.debug("Cannot convert memory metrics for {}: size {} not in catalog",
                    instance.getName(), instance.getVmSize());
            return;
        }

        // Lowest available memory marks the peak usage
        double lowest = minAvailable != null ? minAvailable : avgAvailable;
        instance.setAvgMemory(usedPercent(totalBytes, avgAvailable));
        instance.setMaxMemory(usedPercent(totalBytes, lowest));
    }

    static double usedPercent(double totalBytes, double availableBytes) {
        double used = (totalBytes - availableBytes) / totalBytes * 100;
        return Math.max(0, Math.min(100, used));
    }

    private List<SkuRestriction> parseRestrictions(JsonNode node, String region) {
        List<SkuRestriction> restrictions = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return restrictions;
        }

        for (JsonNode restriction : node) {
            String type = restriction.path("type").asText("Location");
            List<String> locations = textList(restriction.get("locations"));
            boolean appliesHere = "Zone".equalsIgnoreCase(type)
                    || locations.isEmpty()
                    || locations.stream().anyMatch(location -> location.equalsIgnoreCase(region));
            if (appliesHere) {
                restrictions.add(SkuCapabilityMapper.toRestriction(
                        type,
                        restriction.path("reason_code").asText("NotAvailableForSubscription"),
                        textList(restriction.get("zones"))));
            }
        }
        return restrictions;
    }

    private static boolean blocksRegion(List<SkuRestriction> restrictions) {
        return restrictions.stream().anyMatch(restriction ->
                restriction.type() == RestrictionType.LOCATION
                        || restriction.reason() == RestrictionReason.NOT_AVAILABLE_FOR_SUBSCRIPTION);
    }

    private static Map<String, String> parseCapabilities(JsonNode node) {
        Map<String, String> capabilities = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(entry -> capabilities.put(entry.getKey(), entry.getValue().asText()));
        }
        return capabilities;
    }

    private JsonNode regionNode(String section, String region) {
        JsonNode sectionNode = exportData.get(section);
        if (sectionNode == null) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> regions = sectionNode.fields();
        while (regions.hasNext()) {
            Map.Entry<String, JsonNode> entry = regions.next();
            if (entry.getKey().equalsIgnoreCase(region)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(value -> values.add(value.asText()));
        }
        return values;
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static String priceKey(String skuName, String region, String osType) {
        return (skuName + "|" + region + "|" + osType).toLowerCase(Locale.ROOT);
    }
}
