package com.questrail.ical.registry;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.model.DateTimeValue;
import com.questrail.ical.model.IntegerValue;
import com.questrail.ical.model.TextValue;
import com.questrail.ical.model.UriValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class RegistryConfigTest
{
    @Test
    void defaults() {
        RegistryConfig config = RegistryConfig.defaults();

        assertEquals(ValueType.TEXT, config.defaultType());
        assertFalse(config.strictTimezones());
        assertEquals(StandardCharsets.UTF_8, config.fallbackCharset());
        assertTrue(config.typeOverrides().isEmpty());
    }

    @Test
    void overrideKeysAreNormalized() {
        RegistryConfig config = RegistryConfig.builder().withType("x-priority", ValueType.INTEGER).build();
        assertEquals(ValueType.INTEGER, config.typeOverrides().get("X-PRIORITY"));
    }

    @Test
    void overridesAddAndReplaceMappings() {
        ValueTypeRegistry registry = new ValueTypeRegistry(RegistryConfig.builder()
                .withType("X-PRIORITY", ValueType.INTEGER)
                .withType("attach", ValueType.TEXT)
                .build());

        assertEquals(new IntegerValue(2), registry.decode("x-priority", "2"));
        assertEquals(ValueType.TEXT, registry.typeFor("ATTACH"));
        assertEquals(ValueType.URI, ValueTypeRegistry.defaults().typeFor("ATTACH"));
    }

    @Test
    void defaultTypeIsConfigurable() {
        ValueTypeRegistry registry = new ValueTypeRegistry(RegistryConfig.builder()
                .withDefaultType(ValueType.URI)
                .build());

        assertEquals(new UriValue("http://example.com"), registry.decode("X-LINK", "http://example.com"));
    }

    @Test
    void lenientRegistryIgnoresUnknownTzid() {
        DateTimeValue v = (DateTimeValue) ValueTypeRegistry.defaults()
                .decode("DTSTART", "20230101T090000", "Nowhere/Atlantis");
        assertFalse(v.isZoned());
    }

    @Test
    void strictRegistryRejectsUnknownTzid() {
        ValueTypeRegistry registry = new ValueTypeRegistry(RegistryConfig.builder()
                .withStrictTimezones(true)
                .build());

        InvalidValueException e = assertThrows(InvalidValueException.class,
                () -> registry.decode("DTSTART", "20230101T090000", "Nowhere/Atlantis"));
        assertEquals("TZID", e.typeName());
        assertEquals("Nowhere/Atlantis", e.rawText());

        assertTrue(((DateTimeValue) registry.decode("DTSTART", "20230101T090000", "Europe/Rome")).isZoned());
    }

    @Test
    void fallbackCharsetIsUsedWithoutHint() {
        ValueTypeRegistry registry = new ValueTypeRegistry(RegistryConfig.builder()
                .withFallbackCharset(StandardCharsets.ISO_8859_1)
                .build());

        byte[] latin = "Straße".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals(new TextValue("Straße"), registry.decode("LOCATION", latin, null, null));
    }
}
