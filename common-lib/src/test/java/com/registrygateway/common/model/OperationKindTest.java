package com.registrygateway.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationKindTest {

    @Test
    @DisplayName("fromCode is case-insensitive and trims whitespace")
    void fromCode_caseInsensitive() {
        assertEquals(OperationKind.FINANCIAL, OperationKind.fromCode("financial"));
        assertEquals(OperationKind.NEWS, OperationKind.fromCode(" NEWS "));
        assertEquals(OperationKind.SEARCH, OperationKind.fromCode("Search"));
    }

    @Test
    @DisplayName("unknown or null code → IllegalArgumentException")
    void fromCode_unknown() {
        assertThrows(IllegalArgumentException.class, () -> OperationKind.fromCode("ratings"));
        assertThrows(IllegalArgumentException.class, () -> OperationKind.fromCode(null));
    }

    @Test
    @DisplayName("description is used for unsupported-operation messages")
    void description() {
        assertEquals("financial data", OperationKind.FINANCIAL.description());
        assertEquals("details", OperationKind.DETAILS.code());
    }
}
