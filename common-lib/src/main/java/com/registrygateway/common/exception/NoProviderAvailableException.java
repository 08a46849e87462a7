package com.registrygateway.common.exception;

/** Selection found no healthy provider for the query. */
public class NoProviderAvailableException extends GatewayException {

    public NoProviderAvailableException() {
        super(null, "no suitable provider found for query");
    }
}
