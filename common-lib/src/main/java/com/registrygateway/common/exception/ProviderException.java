package com.registrygateway.common.exception;

/**
 * Raised by a provider adapter to report that a call failed: upstream error,
 * unsupported operation, malformed response. This is the only failure the gateway
 * answers with a fallback attempt; anything else an adapter throws travels to the
 * caller untouched.
 */
public class ProviderException extends GatewayException {

    public ProviderException(String providerName, String message) {
        super(providerName, message);
    }

    public ProviderException(String providerName, String message, Throwable cause) {
        super(providerName, message, cause);
    }
}
