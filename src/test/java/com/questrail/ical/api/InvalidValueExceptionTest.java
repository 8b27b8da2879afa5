package com.questrail.ical.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class InvalidValueExceptionTest
{
    @Test
    void messageNamesTypeTextAndReason() {
        InvalidValueException e = new InvalidValueException("maybe", "BOOLEAN", "expected TRUE or FALSE");

        assertEquals("Invalid BOOLEAN value 'maybe': expected TRUE or FALSE", e.getMessage());
        assertEquals("maybe", e.rawText());
        assertEquals("BOOLEAN", e.typeName());
        assertEquals("expected TRUE or FALSE", e.reason());
    }

    @Test
    void reasonIsOptional() {
        InvalidValueException e = new InvalidValueException("x", "DATE", null);
        assertEquals("Invalid DATE value 'x'", e.getMessage());
        assertNull(e.reason());
    }
}
