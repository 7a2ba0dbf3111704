package com.flagship.bank_transfer.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.end();
    }

    @Test
    @DisplayName("A plain caller-supplied id is kept")
    void testAcceptsPlainId() {
        assertEquals("req-42.a_b", CorrelationContext.begin("req-42.a_b"));
        assertEquals("req-42.a_b", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"has space", "line\nbreak", "<script>"})
    @DisplayName("Missing or unusable ids are replaced with a generated one")
    void testReplacesUnusableId(String requested) {
        String id = CorrelationContext.begin(requested);

        assertNotEquals(requested, id);
        assertEquals(8, id.length());
        assertEquals(id, CorrelationContext.getCorrelationId());
    }

    @Test
    @DisplayName("Overlong ids are replaced")
    void testRejectsOverlongId() {
        assertEquals(8, CorrelationContext.begin("x".repeat(65)).length());
    }

    @Test
    @DisplayName("end() clears every key")
    void testEndClearsAllKeys() {
        CorrelationContext.begin("cid");
        CorrelationContext.bindUser("alice");
        CorrelationContext.bindTransfer("tr_1");

        CorrelationContext.end();

        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.USERNAME_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.TRANSFER_ID_MDC_KEY));
    }
}
