package com.registrygateway.common.exception;

public class RateLimitedException extends GatewayException {

    public RateLimitedException(String providerName) {
        super(providerName, "rate limit exceeded for provider " + providerName);
    }
}
