package com.registrygateway.gateway.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderWebClientFactoryTest {

    @Test
    @DisplayName("credentials in query strings are masked before logging")
    void sanitize() {
        assertEquals("https://x/api?apikey=***&symbol=A",
            ProviderWebClientFactory.sanitize("https://x/api?apikey=SECRET&symbol=A"));
        assertEquals("https://x/api?token=***", ProviderWebClientFactory.sanitize("https://x/api?token=abc"));
        assertEquals("https://data.sec.gov/submissions/CIK0000320193.json",
            ProviderWebClientFactory.sanitize("https://data.sec.gov/submissions/CIK0000320193.json"));
    }
}
