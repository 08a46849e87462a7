package com.registrygateway.common.exception;

import com.registrygateway.common.model.OperationKind;

/**
 * Both the primary provider and the configured fallback failed. The cause is the
 * fallback's error; the primary's error is attached as a suppressed exception.
 */
public class ProviderCallFailedException extends GatewayException {
    private final OperationKind operation;
    private final String fallbackProviderName;

    public ProviderCallFailedException(OperationKind operation, String primaryProviderName,
                                       String fallbackProviderName, Throwable cause) {
        super(primaryProviderName,
            operation.code() + " failed on provider " + primaryProviderName
                + " and fallback " + fallbackProviderName + ": " + cause.getMessage(),
            cause);
        this.operation = operation;
        this.fallbackProviderName = fallbackProviderName;
    }

    public OperationKind getOperation() {
        return operation;
    }

    public String getFallbackProviderName() {
        return fallbackProviderName;
    }
}
