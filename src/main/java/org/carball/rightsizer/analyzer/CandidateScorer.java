package org.carball.rightsizer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.model.analysis.CandidateResult;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.sku.PriceMath;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuFeature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Turns a regional SKU catalog into a short, ranked list of replacement candidates.
 */
@Slf4j
public class CandidateScorer {

    private static final int PREMIUM_STORAGE_POINTS = 30;
    private static final int ACCELERATED_NETWORKING_POINTS = 30;
    private static final int EPHEMERAL_OS_DISK_POINTS = 20;
    private static final int GENERATION_STEP_PENALTY = 15;
    private static final int GENERATION_TARGET_BONUS = 10;
    private static final int HIGH_BANDWIDTH_MBPS = 1000;
    private static final String BURSTABLE_PREFIX = "Standard_B";

    private final ScoringPolicy policy;

    public CandidateScorer(ScoringPolicy policy) {
        this.policy = policy;
    }

    /**
     * vCPU and memory bounds a candidate must fall within.
     */
    public record AcceptableRange(int minVcpus, int maxVcpus, double minMemoryGb, double maxMemoryGb) {

        public boolean contains(SkuDescriptor sku) {
            return sku.vcpus() >= minVcpus && sku.vcpus() <= maxVcpus
                    && sku.memoryGb() >= minMemoryGb && sku.memoryGb() <= maxMemoryGb;
        }
    }

    public List<CandidateResult> rank(InstanceDescriptor instance, List<SkuDescriptor> catalog, PriceLookup prices) {
        Optional<SkuDescriptor> current = catalog.stream()
                .filter(sku -> sku.name().equals(instance.getVmSize()))
                .findFirst();

        if (current.isEmpty()) {
            log.debug("Current SKU {} of {} not in the {} catalog, skipping candidate ranking",
                    instance.getVmSize(), instance.getName(), instance.getRegion());
            return new ArrayList<>();
        }
        return rank(instance, current.get(), catalog, prices);
    }

    public List<CandidateResult> rank(InstanceDescriptor instance,
                                      SkuDescriptor currentSku,
                                      List<SkuDescriptor> catalog,
                                      PriceLookup prices) {
        AcceptableRange range = acceptableRange(instance, currentSku);
        double currentMonthly = instance.monthlyCostOrZero();
        int currentVersion = SkuClassifier.skuVersion(currentSku.name());

        List<ScoredCandidate> scored = new ArrayList<>();
        SkipCounters skipped = new SkipCounters();

        for (SkuDescriptor sku : catalog) {
            if (sku.name().equals(currentSku.name()) || !range.contains(sku)) {
                continue;
            }
            if (rejectedByHardFilters(instance, currentSku, sku, currentVersion, skipped)) {
                continue;
            }

            OptionalDouble hourly = prices.hourlyPrice(sku.name());
            if (hourly.isEmpty() || hourly.getAsDouble() <= 0) {
                skipped.unpriced++;
                continue;
            }

            double monthly = PriceMath.toMonthly(hourly.getAsDouble());
            double score = score(sku, currentSku, monthly, currentMonthly, currentVersion);
            scored.add(new ScoredCandidate(sku, monthly, score));
        }

        log.debug("Ranked {} candidates for {} (skipped disk={}, network={}, family={}, generation={}, burstable={}, unpriced={})",
                scored.size(), instance.getName(), skipped.disk, skipped.network, skipped.family,
                skipped.generation, skipped.burstable, skipped.unpriced);

        // List.sort is stable, so equal scores keep catalog order
        scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());

        return scored.stream()
                .limit(policy.maxCandidates())
                .map(candidate -> toResult(candidate, currentMonthly))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public AcceptableRange acceptableRange(InstanceDescriptor instance, SkuDescriptor currentSku) {
        double cpuFactor = stretchFactor(instance.getAvgCpu(), instance.getMaxCpu(),
                policy.cpuThresholdLow(), policy.cpuThresholdHigh());
        double memoryFactor = stretchFactor(instance.getAvgMemory(), instance.getMaxMemory(),
                policy.memoryThresholdLow(), policy.memoryThresholdHigh());

        int minVcpus = Math.max(1, (int) (currentSku.vcpus() * cpuFactor * 0.5));
        int maxVcpus = (int) (currentSku.vcpus() * cpuFactor * 1.5);
        double minMemory = Math.max(1, currentSku.memoryGb() * memoryFactor * 0.5);
        double maxMemory = currentSku.memoryGb() * memoryFactor * 1.5;

        return new AcceptableRange(minVcpus, maxVcpus, minMemory, maxMemory);
    }

    /**
     * Weighted sum of the price, performance-fit, generation and feature sub-scores.
     */
    public double score(SkuDescriptor sku, SkuDescriptor currentSku,
                        double monthlyPrice, double currentMonthly, int currentVersion) {
        double score = 0.0;

        if (currentMonthly > 0) {
            score += priceScore(monthlyPrice, currentMonthly) * policy.priceWeight();
        }
        score += performanceScore(sku, currentSku) * policy.performanceWeight();
        score += generationScore(SkuClassifier.skuVersion(sku.name()), currentVersion) * policy.generationWeight();
        score += featureScore(sku) * policy.featureWeight();

        return score;
    }

    public static double priceScore(double monthlyPrice, double currentMonthly) {
        double priceRatio = monthlyPrice / currentMonthly;
        return Math.max(0, (2 - priceRatio) * 50);
    }

    public static double performanceScore(SkuDescriptor sku, SkuDescriptor currentSku) {
        double vcpuRatio = currentSku.vcpus() > 0 ? (double) sku.vcpus() / currentSku.vcpus() : 1;
        double memoryRatio = currentSku.memoryGb() > 0 ? sku.memoryGb() / currentSku.memoryGb() : 1;

        double vcpuFit = Math.max(0, 100 - Math.abs(1 - vcpuRatio) * 100);
        double memoryFit = Math.max(0, 100 - Math.abs(1 - memoryRatio) * 100);
        return (vcpuFit + memoryFit) / 2;
    }

    public double generationScore(int candidateVersion, int currentVersion) {
        if (!policy.leapEnabled()) {
            return Math.min(100, candidateVersion * 20);
        }

        int targetVersion = currentVersion + policy.leap();
        double score = Math.max(0, 100 - GENERATION_STEP_PENALTY * Math.abs(candidateVersion - targetVersion));
        if (candidateVersion >= targetVersion) {
            score = Math.min(100, score + GENERATION_TARGET_BONUS);
        }
        return score;
    }

    public static double featureScore(SkuDescriptor sku) {
        int points = 0;
        if (sku.hasFeature(SkuFeature.PREMIUM_STORAGE)) {
            points += PREMIUM_STORAGE_POINTS;
        }
        if (sku.hasFeature(SkuFeature.ACCELERATED_NETWORKING)) {
            points += ACCELERATED_NETWORKING_POINTS;
        }
        if (sku.hasFeature(SkuFeature.EPHEMERAL_OS_DISK)) {
            points += EPHEMERAL_OS_DISK_POINTS;
        }
        return Math.min(100, points);
    }

    private boolean rejectedByHardFilters(InstanceDescriptor instance, SkuDescriptor currentSku,
                                          SkuDescriptor sku, int currentVersion, SkipCounters skipped) {
        if (policy.checkDiskRequirements() && sku.maxDataDisks() < instance.getDataDiskCount()) {
            skipped.disk++;
            return true;
        }

        if (policy.checkNetworkRequirements()
                && sku.maxNetworkBandwidthMbps() > 0
                && sku.maxNetworkBandwidthMbps() < HIGH_BANDWIDTH_MBPS
                && currentSku.maxNetworkBandwidthMbps() >= HIGH_BANDWIDTH_MBPS) {
            skipped.network++;
            return true;
        }

        if (policy.sameFamilyOnly()) {
            String currentFamily = SkuClassifier.extractFamily(currentSku.name());
            String skuFamily = SkuClassifier.extractFamily(sku.name());
            if (!currentFamily.isEmpty() && !skuFamily.isEmpty() && !currentFamily.equals(skuFamily)) {
                skipped.family++;
                return true;
            }
        }

        if (policy.leapEnabled()) {
            int skuVersion = SkuClassifier.skuVersion(sku.name());
            // never regress below the current generation, even when falling back
            if (skuVersion < currentVersion
                    || (!policy.leapFallback() && skuVersion < currentVersion + policy.leap())) {
                skipped.generation++;
                return true;
            }
        }

        if (!policy.allowBurstable() && sku.name().startsWith(BURSTABLE_PREFIX)) {
            skipped.burstable++;
            return true;
        }

        return false;
    }

    private double stretchFactor(Double average, Double peak, double lowThreshold, double highThreshold) {
        if (average != null && average < lowThreshold) {
            return policy.lowUtilizationStretch();
        } else if (peak != null && peak > highThreshold) {
            return policy.highUtilizationStretch();
        }
        return 1.0;
    }

    private CandidateResult toResult(ScoredCandidate candidate, double currentMonthly) {
        SkuDescriptor sku = candidate.sku();
        double savings = currentMonthly - candidate.monthlyPrice();
        double savingsPercent = currentMonthly > 0 ? PriceMath.round(savings / currentMonthly * 100, 1) : 0;

        return CandidateResult.builder()
                .skuName(sku.name())
                .vcpus(sku.vcpus())
                .memoryGb(sku.memoryGb())
                .generation(SkuClassifier.extractGeneration(sku.name()))
                .features(sku.features())
                .monthlyPrice(PriceMath.round(candidate.monthlyPrice(), 2))
                .savings(PriceMath.round(savings, 2))
                .savingsPercent(savingsPercent)
                .score(PriceMath.round(candidate.score(), 2))
                .build();
    }

    private record ScoredCandidate(SkuDescriptor sku, double monthlyPrice, double score) {
    }

    private static final class SkipCounters {
        int disk;
        int network;
        int family;
        int generation;
        int burstable;
        int unpriced;
    }
}
