package com.registrygateway.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BusinessSearchQueryTest {

    @Test
    @DisplayName("empty query has every field unset")
    void emptyQuery() {
        BusinessSearchQuery query = BusinessSearchQuery.empty();
        assertNull(query.companyName());
        assertNull(query.country());
        assertEquals(0, query.maxResults());
        assertEquals(0, query.requestedFeatureCount());
    }

    @Test
    @DisplayName("requestedFeatureCount counts financial, compliance and news flags")
    void requestedFeatureCount() {
        BusinessSearchQuery query = BusinessSearchQuery.builder()
            .companyName("Test Company")
            .includeFinancial(true)
            .includeNews(true)
            .build();
        assertEquals(2, query.requestedFeatureCount());
    }

    @Test
    @DisplayName("builder produces value-equal records for identical input")
    void builderEquality() {
        BusinessSearchQuery a = BusinessSearchQuery.builder().companyName("Acme").country("US").build();
        BusinessSearchQuery b = BusinessSearchQuery.builder().country("US").companyName("Acme").build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
