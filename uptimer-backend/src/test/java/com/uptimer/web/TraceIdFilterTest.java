package com.uptimer.web;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TraceIdFilterTest {

    @Test
    void resolveTraceId_keepsWellFormedId() {
        assertEquals("req-42", TraceIdFilter.resolveTraceId("req-42"));
    }

    @Test
    void resolveTraceId_replacesMissingOrUnsafeId() {
        assertDoesNotThrow(() -> UUID.fromString(TraceIdFilter.resolveTraceId(null)));
        assertDoesNotThrow(() -> UUID.fromString(TraceIdFilter.resolveTraceId("")));
        assertDoesNotThrow(() -> UUID.fromString(TraceIdFilter.resolveTraceId("abc\nFAKE LOG LINE")));
        assertDoesNotThrow(() -> UUID.fromString(TraceIdFilter.resolveTraceId("x".repeat(65))));
    }
}
