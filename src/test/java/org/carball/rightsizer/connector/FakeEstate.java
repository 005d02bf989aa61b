package org.carball.rightsizer.connector;

import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.validation.QuotaSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory estate for tests. Records call counts and lets a test hook into metrics enrichment.
 */
public class FakeEstate implements InventoryClient, SkuCatalogClient, PriceClient, QuotaClient {

    private final List<InstanceDescriptor> instances = new ArrayList<>();
    private final List<AdvisorHint> hints = new ArrayList<>();
    private final Map<String, List<SkuDescriptor>> skus = new ConcurrentHashMap<>();
    private final Map<String, Double> prices = new ConcurrentHashMap<>();
    private final Map<String, List<QuotaSnapshot>> quotas = new ConcurrentHashMap<>();
    private final Map<String, double[]> metrics = new ConcurrentHashMap<>();
    private final Set<String> failingCatalogRegions = ConcurrentHashMap.newKeySet();

    private final Map<String, AtomicInteger> catalogCalls = new ConcurrentHashMap<>();
    private final AtomicInteger priceCalls = new AtomicInteger();

    private volatile Consumer<InstanceDescriptor> metricsHook = instance -> { };

    public FakeEstate addInstance(InstanceDescriptor instance) {
        instances.add(instance);
        return this;
    }

    public FakeEstate addSku(String region, SkuDescriptor sku) {
        skus.computeIfAbsent(region, key -> new ArrayList<>()).add(sku);
        return this;
    }

    public FakeEstate price(String sku, String region, double hourly) {
        prices.put(sku + "|" + region, hourly);
        return this;
    }

    public FakeEstate quota(String region, String name, long used, long limit) {
        quotas.computeIfAbsent(region, key -> new ArrayList<>()).add(new QuotaSnapshot(name, region, used, limit));
        return this;
    }

    public FakeEstate metrics(String instanceName, double avgCpu, double maxCpu) {
        metrics.put(instanceName, new double[]{avgCpu, maxCpu});
        return this;
    }

    public FakeEstate hint(AdvisorHint hint) {
        hints.add(hint);
        return this;
    }

    public FakeEstate failCatalog(String region) {
        failingCatalogRegions.add(region);
        return this;
    }

    public FakeEstate onMetrics(Consumer<InstanceDescriptor> hook) {
        this.metricsHook = hook;
        return this;
    }

    public int catalogCalls(String region) {
        AtomicInteger calls = catalogCalls.get(region);
        return calls != null ? calls.get() : 0;
    }

    public int priceCalls() {
        return priceCalls.get();
    }

    @Override
    public List<InstanceDescriptor> listInstances(String resourceGroup) {
        return instances.stream()
                .filter(instance -> resourceGroup == null || resourceGroup.equals(instance.getResourceGroup()))
                .toList();
    }

    @Override
    public void enrichWithMetrics(InstanceDescriptor instance, int lookbackDays) {
        metricsHook.accept(instance);
        double[] cpu = metrics.get(instance.getName());
        if (cpu != null) {
            instance.setAvgCpu(cpu[0]);
            instance.setMaxCpu(cpu[1]);
        }
    }

    @Override
    public List<AdvisorHint> advisorHints() {
        return List.copyOf(hints);
    }

    @Override
    public String scopeName() {
        return "test-subscription";
    }

    @Override
    public List<SkuDescriptor> listSkus(String region, boolean includeRestricted) {
        catalogCalls.computeIfAbsent(region, key -> new AtomicInteger()).incrementAndGet();
        if (failingCatalogRegions.contains(region)) {
            throw new ConnectorException("catalog unavailable for " + region);
        }
        List<SkuDescriptor> regional = skus.getOrDefault(region, List.of());
        return regional.stream()
                .filter(sku -> includeRestricted || !sku.isRestricted())
                .toList();
    }

    @Override
    public OptionalDouble hourlyPrice(String skuName, String region, String osType) {
        priceCalls.incrementAndGet();
        Double price = prices.get(skuName + "|" + region);
        return price != null ? OptionalDouble.of(price) : OptionalDouble.empty();
    }

    @Override
    public List<QuotaSnapshot> quotaUsage(String region) {
        return quotas.getOrDefault(region, List.of());
    }
}
