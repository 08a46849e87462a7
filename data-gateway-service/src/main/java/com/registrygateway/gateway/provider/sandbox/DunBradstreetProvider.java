package com.registrygateway.gateway.provider.sandbox;

import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.provider.ProviderDescriptor;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;

/** Dun &amp; Bradstreet sandbox: full coverage of all five operations. */
public class DunBradstreetProvider extends AbstractSandboxProvider {

    public static final String TYPE = "dnb";

    public DunBradstreetProvider(ProviderDescriptor descriptor, Clock clock) {
        super(descriptor, EnumSet.allOf(OperationKind.class), "Dun & Bradstreet", clock);
    }

    @Override
    protected List<String> industryCodes() {
        return List.of("NAICS:541511", "SIC:7372");
    }
}
