package org.carball.rightsizer.connector;

import org.carball.rightsizer.model.instance.AdvisorHint;
import org.carball.rightsizer.model.instance.InstanceDescriptor;

import java.util.List;

public interface InventoryClient {

    /**
     * Lists instances, optionally limited to one resource group (null for the whole estate).
     */
    List<InstanceDescriptor> listInstances(String resourceGroup);

    /**
     * Fills in utilization summaries over the lookback window. Leaves fields null when no data exists.
     */
    void enrichWithMetrics(InstanceDescriptor instance, int lookbackDays);

    List<AdvisorHint> advisorHints();

    String scopeName();
}
