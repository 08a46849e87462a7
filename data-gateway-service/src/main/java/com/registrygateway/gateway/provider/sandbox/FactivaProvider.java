package com.registrygateway.gateway.provider.sandbox;

import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.provider.ProviderDescriptor;

import java.time.Clock;
import java.util.EnumSet;

/** Factiva sandbox: a news archive. Company search and profiles, but no financial or compliance data. */
public class FactivaProvider extends AbstractSandboxProvider {

    public static final String TYPE = "factiva";

    public FactivaProvider(ProviderDescriptor descriptor, Clock clock) {
        super(descriptor, EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.NEWS),
            "Factiva", clock);
    }
}
