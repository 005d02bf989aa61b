package org.carball.rightsizer.analyzer;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.ai.AIRecommendationAdapter;
import org.carball.rightsizer.cache.PriceCache;
import org.carball.rightsizer.cache.SkuCatalogCache;
import org.carball.rightsizer.config.ReferenceTables;
import org.carball.rightsizer.config.RightsizingSettings;
import org.carball.rightsizer.connector.InventoryClient;
import org.carball.rightsizer.connector.PriceClient;
import org.carball.rightsizer.model.analysis.AnalysisReport;
import org.carball.rightsizer.model.analysis.CandidateResult;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.validation.CandidateValidationPolicy;
import org.carball.rightsizer.validation.ConstraintValidator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one rightsizing analysis: discover the inventory, warm the caches, analyze every
 * instance on a bounded worker pool and summarize.
 *
 * <p>Instance analyses are independent. A failure or timeout drops that instance from the
 * report and never stops the batch. A region whose SKU catalog cannot be read only loses
 * candidate ranking. Results are merged under a single lock and sorted by
 * savings once all of them are in, so completion order does not matter.</p>
 */
@Slf4j
public class RightsizingAnalyzer {

    private static final long POLL_INTERVAL_MILLIS = 100;
    private static final int MAX_AI_SKUS = 20;

    private final RightsizingSettings settings;
    private final InventoryClient inventory;
    private final SkuCatalogCache catalogCache;
    private final PriceCache priceCache;
    private final CandidateScorer scorer;
    private final CandidateValidationPolicy validationPolicy;
    private final UpgradePathFinder upgradePathFinder;
    private final RecommendationSelector selector = new RecommendationSelector();
    private final AIRecommendationAdapter aiAdapter;

    private final ReentrantLock mergeLock = new ReentrantLock();

    @Builder
    public RightsizingAnalyzer(RightsizingSettings settings,
                               InventoryClient inventory,
                               SkuCatalogCache catalogCache,
                               PriceCache priceCache,
                               PriceClient priceClient,
                               ConstraintValidator constraintValidator,
                               AIRecommendationAdapter aiAdapter,
                               ReferenceTables referenceTables) {
        this.settings = settings != null ? settings : RightsizingSettings.defaults();
        this.inventory = inventory;
        this.catalogCache = catalogCache;
        this.priceCache = priceCache;
        this.scorer = new CandidateScorer(ScoringPolicy.fromSettings(this.settings));
        this.validationPolicy = constraintValidator != null
                ? CandidateValidationPolicy.fromSettings(constraintValidator, this.settings)
                : null;
        this.upgradePathFinder = new UpgradePathFinder(
                referenceTables != null ? referenceTables : ReferenceTables.loadDefaults(),
                catalogCache, priceClient);
        this.aiAdapter = aiAdapter != null ? aiAdapter : AIRecommendationAdapter.disabled();
    }

    public AnalysisReport analyze(String resourceGroup, boolean includeMetrics, boolean includeAi) {
        String scope = resourceGroup != null
                ? inventory.scopeName() + "/" + resourceGroup
                : inventory.scopeName();
        AnalysisReport report = new AnalysisReport(Instant.now(), scope);

        // Discover
        log.info("Discovering instances in {}", scope);
        List<InstanceDescriptor> instances;
        try {
            instances = inventory.listInstances(resourceGroup);
        } catch (RuntimeException e) {
            log.error("Failed to list instances in {}: {}", scope, e.getMessage());
            throw new AnalysisException("Failed to list instances in " + scope, e);
        }
        report.setTotalInstances(instances.size());

        if (instances.isEmpty()) {
            log.warn("No instances found in the specified scope");
            report.setExecutiveSummary(AIRecommendationAdapter.basicSummary(report));
            return report;
        }
        log.info("Found {} instances", instances.size());

        List<AdvisorHint> advisorHints = discoverAdvisorHints();

        ExecutorService pool = newWorkerPool();
        try {
            prefetch(pool, instances);
            analyzeAll(pool, instances, advisorHints, includeMetrics, includeAi, report);
        } finally {
            // queued work was already cancelled; in-flight tasks are left to finish
            pool.shutdown();
        }

        // Summarize
        report.sortBySavings();
        boolean aiSummary = includeAi && aiAdapter.isAvailable();
        log.info("Analyzed {}/{} instances, {} with recommendations{}", report.getAnalyzedInstances(),
                report.getTotalInstances(), report.getInstancesWithRecommendations(),
                aiSummary ? ", generating AI summary" : "");
        report.setExecutiveSummary(aiSummary
                ? aiAdapter.executiveSummary(report)
                : AIRecommendationAdapter.basicSummary(report));

        return report;
    }

    /**
     * Analyzes a single instance. Runs on a worker thread and touches shared state only through
     * the caches.
     */
    RightsizingResult analyzeInstance(InstanceDescriptor instance,
                                      List<AdvisorHint> advisorHints,
                                      boolean includeMetrics,
                                      boolean includeAi) {
        RightsizingResult result = new RightsizingResult(instance);
        String region = instance.getRegion();
        PriceLookup prices = pricesFor(region, instance.getOsType());

        prices.hourlyPrice(instance.getVmSize()).ifPresent(instance::applyHourlyPrice);

        if (includeMetrics) {
            try {
                inventory.enrichWithMetrics(instance, settings.getLookbackDays());
            } catch (RuntimeException e) {
                log.warn("Could not read metrics for {}: {}", instance.getName(), e.getMessage());
            }
        }

        advisorHints.stream()
                .filter(hint -> hint.appliesTo(instance))
                .findFirst()
                .ifPresent(result::setAdvisorHint);

        upgradePathFinder.evaluateGenerationUpgrade(result, prices);
        upgradePathFinder.evaluateRegionAlternatives(result);

        List<SkuDescriptor> catalog = regionalCatalog(instance);
        Optional<SkuDescriptor> currentSku = catalog.isEmpty()
                ? Optional.empty()
                : catalogCache.find(region, instance.getVmSize());
        if (currentSku.isPresent()) {
            result.setRankedCandidates(scorer.rank(instance, currentSku.get(), catalog, prices));
            if (validationPolicy != null) {
                validationPolicy.apply(result, currentSku.get().features());
            }
        } else {
            log.debug("Current SKU {} of {} not in the {} catalog, no candidates ranked",
                    instance.getVmSize(), instance.getName(), region);
        }

        if (includeAi && aiAdapter.isAvailable()) {
            List<SkuDescriptor> promptSkus = promptSkus(result, catalog);
            Map<String, Double> hourlyPrices = new LinkedHashMap<>();
            if (instance.getCurrentPriceHourly() != null) {
                hourlyPrices.put(instance.getVmSize(), instance.getCurrentPriceHourly());
            }
            for (SkuDescriptor sku : promptSkus) {
                prices.hourlyPrice(sku.name()).ifPresent(price -> hourlyPrices.put(sku.name(), price));
            }
            aiAdapter.recommend(instance, promptSkus, hourlyPrices, result.getAdvisorHint())
                    .ifPresent(result::setAiRecommendation);
        }

        selector.select(result);
        log.debug("Analyzed {}: {} saving {}", instance.getName(),
                result.getRecommendationType().getCode(), result.getTotalPotentialSavings());
        return result;
    }

    /**
     * The cached catalog of the instance's region. An unavailable catalog reads as empty, so the
     * instance keeps its shutdown, advisor and region recommendations without candidates.
     */
    private List<SkuDescriptor> regionalCatalog(InstanceDescriptor instance) {
        try {
            return catalogCache.skusFor(instance.getRegion());
        } catch (RuntimeException e) {
            log.debug("No SKU catalog for {}, candidate ranking skipped for {}: {}",
                    instance.getRegion(), instance.getName(), e.getMessage());
            return List.of();
        }
    }

    private List<AdvisorHint> discoverAdvisorHints() {
        try {
            List<AdvisorHint> hints = inventory.advisorHints();
            log.info("Found {} advisor recommendations", hints.size());
            return hints;
        } catch (RuntimeException e) {
            log.warn("Advisor recommendations unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    private void prefetch(ExecutorService pool, List<InstanceDescriptor> instances) {
        List<String> regions = instances.stream()
                .map(InstanceDescriptor::getRegion)
                .distinct()
                .toList();

        log.info("Prefetching SKU catalogs for {} region(s)", regions.size());
        List<Future<?>> catalogFetches = new ArrayList<>();
        for (String region : regions) {
            catalogFetches.add(pool.submit(() -> catalogCache.skusFor(region)));
        }
        int catalogFailures = awaitPrefetch(catalogFetches, "SKU catalog");
        if (catalogFailures == regions.size()) {
            log.error("SKU catalog unavailable for every region");
            throw new AnalysisException("SKU catalog unavailable for all " + regions.size() + " region(s)");
        }
        List<String> withoutCatalog = regions.stream().filter(catalogCache::isUnavailable).toList();
        if (!withoutCatalog.isEmpty()) {
            log.warn("SKU catalog unavailable for {}, instances there are analyzed without candidate ranking",
                    withoutCatalog);
        }

        log.info("Prefetching prices for {} instance(s)", instances.size());
        List<Future<?>> priceFetches = new ArrayList<>();
        for (InstanceDescriptor instance : instances) {
            priceFetches.add(pool.submit(() ->
                    priceCache.hourlyPrice(instance.getVmSize(), instance.getRegion(), instance.getOsType())));
        }
        awaitPrefetch(priceFetches, "price");
    }

    /**
     * Waits for prefetch tasks. Failures are counted and logged, not raised; the caches hold
     * whatever the later lookups will see.
     */
    private int awaitPrefetch(List<Future<?>> fetches, String kind) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(settings.getBatchTimeoutSeconds());
        int failures = 0;

        for (Future<?> fetch : fetches) {
            try {
                fetch.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                failures++;
                log.debug("{} prefetch failed: {}", kind, e.getCause().getMessage());
            } catch (TimeoutException e) {
                failures++;
                fetch.cancel(true);
                log.debug("{} prefetch timed out", kind);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnalysisException("Interrupted while prefetching " + kind + " data", e);
            }
        }

        if (failures > 0) {
            log.debug("{} of {} {} prefetches failed", failures, fetches.size(), kind);
        }
        return failures;
    }

    private void analyzeAll(ExecutorService pool,
                            List<InstanceDescriptor> instances,
                            List<AdvisorHint> advisorHints,
                            boolean includeMetrics,
                            boolean includeAi,
                            AnalysisReport report) {
        log.info("Analyzing {} instances with {} workers", instances.size(), settings.getMaxWorkers());

        CompletionService<RightsizingResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<RightsizingResult>, InstanceTask> pending = new HashMap<>();
        for (InstanceDescriptor instance : instances) {
            InstanceTask task = new InstanceTask(instance, advisorHints, includeMetrics, includeAi);
            pending.put(completion.submit(task), task);
        }

        long batchDeadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(settings.getBatchTimeoutSeconds());
        long instanceTimeout = TimeUnit.SECONDS.toNanos(settings.getInstanceTimeoutSeconds());

        while (!pending.isEmpty()) {
            long remaining = batchDeadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Batch timeout after {}s, {} instance(s) not analyzed",
                        settings.getBatchTimeoutSeconds(), pending.size());
                // stop accepting results; tasks not yet started are dropped
                pending.keySet().forEach(future -> future.cancel(false));
                break;
            }

            Future<RightsizingResult> done;
            try {
                done = completion.poll(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_INTERVAL_MILLIS)),
                        TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.keySet().forEach(future -> future.cancel(true));
                throw new AnalysisException("Interrupted while analyzing instances", e);
            }

            // drain everything already finished before judging the rest overdue
            while (done != null) {
                InstanceTask task = pending.remove(done);
                if (task != null) {
                    collect(done, task.instance, report);
                }
                done = completion.poll();
            }
            expireOverdue(pending, instanceTimeout);
        }
    }

    private void collect(Future<RightsizingResult> done, InstanceDescriptor instance, AnalysisReport report) {
        try {
            RightsizingResult result = done.get();
            mergeLock.lock();
            try {
                report.record(result);
            } finally {
                mergeLock.unlock();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Failed to analyze instance {}: {}", instance.getName(), cause.getMessage());
            log.debug("Analysis failure for {}", instance.getName(), cause);
        } catch (CancellationException e) {
            log.debug("Analysis of {} was cancelled", instance.getName());
        } catch (InterruptedException e) {
            // done.get() on a completed future does not block
            Thread.currentThread().interrupt();
            throw new AnalysisException("Interrupted while collecting results", e);
        }
    }

    /**
     * Cancels started tasks that ran past the instance timeout. A task that already finished is
     * left for collection even when its result has not been taken yet.
     */
    int expireOverdue(Map<Future<RightsizingResult>, InstanceTask> pending, long instanceTimeout) {
        long now = System.nanoTime();
        int expired = 0;
        Iterator<Map.Entry<Future<RightsizingResult>, InstanceTask>> entries = pending.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<Future<RightsizingResult>, InstanceTask> entry = entries.next();
            InstanceTask task = entry.getValue();
            if (entry.getKey().isDone()) {
                continue;
            }
            if (task.started && now - task.startedAt > instanceTimeout) {
                entry.getKey().cancel(true);
                entries.remove();
                expired++;
                log.warn("Timeout analyzing instance {} after {}s",
                        task.instance.getName(), settings.getInstanceTimeoutSeconds());
            }
        }
        return expired;
    }

    /**
     * Ranked candidates first, then the rest of the regional catalog, without duplicates.
     */
    private List<SkuDescriptor> promptSkus(RightsizingResult result, List<SkuDescriptor> catalog) {
        Map<String, SkuDescriptor> byName = new LinkedHashMap<>();
        for (SkuDescriptor sku : catalog) {
            byName.putIfAbsent(sku.name(), sku);
        }

        Map<String, SkuDescriptor> selected = new LinkedHashMap<>();
        for (CandidateResult candidate : result.getRankedCandidates()) {
            SkuDescriptor sku = byName.get(candidate.getSkuName());
            if (sku != null) {
                selected.putIfAbsent(sku.name(), sku);
            }
        }
        for (SkuDescriptor sku : catalog) {
            if (selected.size() >= MAX_AI_SKUS) {
                break;
            }
            selected.putIfAbsent(sku.name(), sku);
        }
        return selected.values().stream().limit(MAX_AI_SKUS).toList();
    }

    /**
     * Price lookups for one region and OS. A failing price collaborator reads as an unknown price.
     */
    private PriceLookup pricesFor(String region, String osType) {
        PriceLookup cached = priceCache.lookupFor(region, osType);
        return skuName -> {
            try {
                return cached.hourlyPrice(skuName);
            } catch (RuntimeException e) {
                log.debug("Price lookup failed for {} in {}: {}", skuName, region, e.getMessage());
                return OptionalDouble.empty();
            }
        };
    }

    private ExecutorService newWorkerPool() {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("rightsizer-worker-%d")
                .setDaemon(true)
                .build();
        return Executors.newFixedThreadPool(Math.max(1, settings.getMaxWorkers()), threadFactory);
    }

    final class InstanceTask implements Callable<RightsizingResult> {

        private final InstanceDescriptor instance;
        private final List<AdvisorHint> advisorHints;
        private final boolean includeMetrics;
        private final boolean includeAi;

        private volatile long startedAt;
        private volatile boolean started;

        InstanceTask(InstanceDescriptor instance, List<AdvisorHint> advisorHints,
                     boolean includeMetrics, boolean includeAi) {
            this.instance = instance;
            this.advisorHints = advisorHints;
            this.includeMetrics = includeMetrics;
            this.includeAi = includeAi;
        }

        void markStarted(long nanoTime) {
            startedAt = nanoTime;
            started = true;
        }

        @Override
        public RightsizingResult call() {
            markStarted(System.nanoTime());
            return analyzeInstance(instance, advisorHints, includeMetrics, includeAi);
        }
    }
}
