package org.carball.rightsizer.connector;

import org.carball.rightsizer.model.validation.QuotaSnapshot;

import java.util.List;

public interface QuotaClient {

    List<QuotaSnapshot> quotaUsage(String region);
}
