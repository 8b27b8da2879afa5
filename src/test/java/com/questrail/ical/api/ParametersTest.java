package com.questrail.ical.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ParametersTest
{
    @Test
    void rendersInInsertionOrder() {
        Parameters p = Parameters.of("encoding", "BASE64", "Value", "BINARY");
        assertEquals("ENCODING=BASE64;VALUE=BINARY", p.toIcal());
    }

    @Test
    void oddArgumentCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Parameters.of("TZID"));
    }

    @Test
    void emptyParametersRenderEmpty() {
        assertEquals("", new Parameters().toIcal());
    }
}
