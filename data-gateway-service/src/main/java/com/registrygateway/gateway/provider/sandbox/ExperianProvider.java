package com.registrygateway.gateway.provider.sandbox;

import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.provider.ProviderDescriptor;

import java.time.Clock;
import java.util.EnumSet;

/** Experian business sandbox: credit-bureau style data, no news feed. */
public class ExperianProvider extends AbstractSandboxProvider {

    public static final String TYPE = "experian";

    public ExperianProvider(ProviderDescriptor descriptor, Clock clock) {
        super(descriptor,
            EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.FINANCIAL, OperationKind.COMPLIANCE),
            "Experian", clock);
    }
}
