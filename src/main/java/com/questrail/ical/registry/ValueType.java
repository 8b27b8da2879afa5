package com.questrail.ical.registry;

import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.codec.impl.ValueCodecs;
import com.questrail.ical.model.PropertyValue;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Value types addressable by name, each bound to the codec that handles it.
 *
 * <p>{@code date}, {@code date-time}, {@code duration} and {@code time} all
 * share the temporal dispatcher, so a property declared as
 * {@code date-time} still accepts a {@code DATE} value.</p>
 */
public enum ValueType
{
    BINARY("binary", ValueCodecs.BINARY),
    BOOLEAN("boolean", ValueCodecs.BOOLEAN),
    CAL_ADDRESS("cal-address", ValueCodecs.CAL_ADDRESS),
    DATE("date", ValueCodecs.TEMPORAL),
    DATE_TIME("date-time", ValueCodecs.TEMPORAL),
    DURATION("duration", ValueCodecs.TEMPORAL),
    FLOAT("float", ValueCodecs.FLOAT),
    INTEGER("integer", ValueCodecs.INTEGER),
    PERIOD("period", ValueCodecs.PERIOD),
    RECUR("recur", ValueCodecs.RECUR),
    TEXT("text", ValueCodecs.TEXT),
    TIME("time", ValueCodecs.TEMPORAL),
    URI("uri", ValueCodecs.URI),
    UTC_OFFSET("utc-offset", ValueCodecs.UTC_OFFSET),
    GEO("geo", ValueCodecs.GEO),
    INLINE("inline", ValueCodecs.INLINE),
    DATE_TIME_LIST("date-time-list", ValueCodecs.DATE_TIME_LIST);

    private final String key;
    private final ValueCodec<? extends PropertyValue> codec;

    ValueType(String key, ValueCodec<? extends PropertyValue> codec) {
        this.key = key;
        this.codec = codec;
    }

    /**
     * @return the lower-case type key, e.g. {@code date-time}
     */
    public String key() {
        return key;
    }

    public ValueCodec<? extends PropertyValue> codec() {
        return codec;
    }

    /**
     * Case-insensitive lookup by type key ({@code DATE-TIME}, {@code recur}, ...).
     */
    public static Optional<ValueType> fromKey(String key) {
        Objects.requireNonNull(key, "key");
        String lower = key.trim().toLowerCase(Locale.ROOT);
        for (ValueType t : values()) {
            if (t.key.equals(lower)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
