package com.registrygateway.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BusinessDataTest {

    @Test
    @DisplayName("namespacedId and nativeId are inverse operations")
    void namespacing() {
        String id = BusinessData.namespacedId("dnb", "123456789");
        assertEquals("dnb:123456789", id);
        assertEquals("123456789", BusinessData.nativeId("dnb", id));
        assertEquals("123456789", BusinessData.nativeId("dnb", "123456789"));
        assertEquals("experian:42", BusinessData.nativeId("dnb", "experian:42"));
    }

    @Test
    @DisplayName("lists are copied and null sub-records default to empty")
    void defensiveCopies() {
        List<String> codes = new ArrayList<>(List.of("NAICS:541511"));
        BusinessData data = new BusinessData("dnb:1", "Acme", null, null, null, null, codes,
            null, null, null, 0.9, 0.8, "dnb", Instant.EPOCH);
        codes.add("NAICS:999999");

        assertEquals(List.of("NAICS:541511"), data.industryCodes());
        assertTrue(data.news().isEmpty());
        assertEquals(Address.empty(), data.address());
        assertThrows(UnsupportedOperationException.class, () -> data.industryCodes().add("x"));
    }
}
