package com.registrygateway.gateway.cost;

import com.registrygateway.common.model.OperationKind;

/**
 * Sink for per-call provider spend. Bookkeeping only: implementations must not
 * block, and the gateway never lets a tracker failure fail a request.
 */
public interface CostTracker {

    void record(String providerName, OperationKind operation, double cost);
}
