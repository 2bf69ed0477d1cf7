package com.logimetrics.coordinator.tenant;

import com.logimetrics.coordinator.job.CancellationToken;

@FunctionalInterface
public interface TenantWork {

  void process(Tenant tenant, CancellationToken token) throws Exception;
}
