package org.carball.rightsizer.model.instance;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.carball.rightsizer.model.sku.PriceMath;

import java.util.Map;

/**
 * A running virtual machine as reported by the inventory. Identity fields are fixed at
 * construction; utilization and price fields are filled in by enrichment.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class InstanceDescriptor {

    private final String name;
    private final String resourceGroup;
    private final String region;
    private final String vmSize;
    private final String instanceId;

    @Builder.Default
    private final String osType = "Linux";

    @Builder.Default
    private final String powerState = "running";

    @Builder.Default
    private final Map<String, String> tags = Map.of();

    private final int dataDiskCount;
    private final int nicCount;

    // Utilization summaries, null when unknown
    @Setter private Double avgCpu;
    @Setter private Double maxCpu;
    @Setter private Double avgMemory;
    @Setter private Double maxMemory;
    @Setter private Double avgDiskIops;
    @Setter private Double avgNetworkIn;
    @Setter private Double avgNetworkOut;

    @Setter private Double currentPriceHourly;
    @Setter private Double currentPriceMonthly;

    public void applyHourlyPrice(double hourlyPrice) {
        this.currentPriceHourly = hourlyPrice;
        this.currentPriceMonthly = PriceMath.toMonthly(hourlyPrice);
    }

    /**
     * Current monthly cost, or zero when the price could not be determined.
     */
    public double monthlyCostOrZero() {
        return currentPriceMonthly != null ? currentPriceMonthly : 0.0;
    }

    public boolean hasCpuMetrics() {
        return avgCpu != null && maxCpu != null;
    }
}
