package com.registrygateway.common.exception;

/** A direct-by-name operation named a provider that is not registered. */
public class ProviderNotFoundException extends GatewayException {

    public ProviderNotFoundException(String providerName) {
        super(providerName, "provider " + providerName + " not found");
    }
}
