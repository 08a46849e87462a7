package com.registrygateway.common.exception;

import com.registrygateway.common.model.OperationKind;
import com.registrygateway.common.model.ValidationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GatewayExceptionTest {

    @Test
    @DisplayName("caller-facing messages are stable")
    void messages() {
        assertEquals("no suitable provider found for query", new NoProviderAvailableException().getMessage());
        assertEquals("provider non-existent-provider not found",
            new ProviderNotFoundException("non-existent-provider").getMessage());
        assertEquals("rate limit exceeded for provider dnb", new RateLimitedException("dnb").getMessage());
    }

    @Test
    @DisplayName("ProviderCallFailedException keeps both provider names and the fallback cause")
    void callFailed() {
        ProviderException cause = new ProviderException("experian", "upstream 503");
        ProviderCallFailedException ex =
            new ProviderCallFailedException(OperationKind.SEARCH, "dnb", "experian", cause);

        assertEquals("dnb", ex.getProviderName());
        assertEquals("experian", ex.getFallbackProviderName());
        assertEquals(OperationKind.SEARCH, ex.getOperation());
        assertSame(cause, ex.getCause());
        assertEquals("search failed on provider dnb and fallback experian: upstream 503", ex.getMessage());
    }

    @Test
    @DisplayName("QualityBelowThresholdException formats scores with two decimals")
    void qualityMessage() {
        QualityBelowThresholdException ex = new QualityBelowThresholdException(
            "factiva", 0.5, 0.8, List.of(ValidationIssue.missing("company_name")));

        assertEquals("data quality 0.50 from provider factiva is below threshold 0.80", ex.getMessage());
        assertEquals(1, ex.getIssues().size());
        assertInstanceOf(GatewayException.class, ex);
    }
}
