package com.registrygateway.gateway.provider.sandbox;

import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.provider.ProviderDescriptor;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;

/** Bloomberg sandbox: market-oriented, strong on financials and news, no compliance screening. */
public class BloombergProvider extends AbstractSandboxProvider {

    public static final String TYPE = "bloomberg";

    public BloombergProvider(ProviderDescriptor descriptor, Clock clock) {
        super(descriptor,
            EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.FINANCIAL, OperationKind.NEWS),
            "Bloomberg", clock);
    }

    @Override
    protected List<String> industryCodes() {
        return List.of("BICS:1010");
    }
}
