package com.registrygateway.common.exception;

/**
 * Root of every error the gateway surfaces to its callers. Carries the name of the
 * provider involved, or {@code null} when the failure is not tied to one provider.
 */
public class GatewayException extends RuntimeException {
    private final String providerName;

    public GatewayException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    public GatewayException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
