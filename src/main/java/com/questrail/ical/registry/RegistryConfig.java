package com.questrail.ical.registry;

import com.questrail.ical.api.CaselessMap;
import com.questrail.ical.codec.impl.IcalText;

import java.nio.charset.Charset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a {@link ValueTypeRegistry}.
 *
 * @param typeOverrides   extra or replacement name → type mappings, keyed by
 *                        normalized (upper-case) name
 * @param defaultType     type used for names with no mapping
 * @param strictTimezones reject unknown {@code TZID} hints instead of ignoring them
 * @param fallbackCharset charset for tolerant decoding of foreign bytes
 */
public record RegistryConfig(
    Map<String, ValueType> typeOverrides,
    ValueType defaultType,
    boolean strictTimezones,
    Charset fallbackCharset
) {
    public RegistryConfig {
        Objects.requireNonNull(typeOverrides, "typeOverrides");
        Objects.requireNonNull(defaultType, "defaultType");
        Objects.requireNonNull(fallbackCharset, "fallbackCharset");
        Map<String, ValueType> normalized = new LinkedHashMap<>();
        typeOverrides.forEach((name, type) -> normalized.put(CaselessMap.normalize(name), type));
        typeOverrides = Map.copyOf(normalized);
    }

    public static RegistryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ValueType> typeOverrides = new LinkedHashMap<>();
        private ValueType defaultType = ValueType.TEXT;
        private boolean strictTimezones = false;
        private Charset fallbackCharset = IcalText.DEFAULT_CHARSET;

        public Builder withType(String name, ValueType type) {
            typeOverrides.put(CaselessMap.normalize(name), Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder withDefaultType(ValueType defaultType) {
            this.defaultType = defaultType;
            return this;
        }

        public Builder withStrictTimezones(boolean strictTimezones) {
            this.strictTimezones = strictTimezones;
            return this;
        }

        public Builder withFallbackCharset(Charset fallbackCharset) {
            this.fallbackCharset = fallbackCharset;
            return this;
        }

        public RegistryConfig build() {
            return new RegistryConfig(typeOverrides, defaultType, strictTimezones, fallbackCharset);
        }
    }
}
