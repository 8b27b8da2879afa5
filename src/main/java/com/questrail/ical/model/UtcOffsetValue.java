package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;

import java.time.Duration;
import java.util.Objects;

/**
 * 3.3.14 UTC Offset: a signed offset from UTC, in whole seconds, strictly
 * less than 24 hours in magnitude.
 *
 * <p>A {@link Duration} is used instead of {@link java.time.ZoneOffset}
 * because the RFC range exceeds the ±18 hours {@code ZoneOffset} allows.</p>
 */
public record UtcOffsetValue(Duration offset) implements PropertyValue
{
    /** Exclusive upper bound on the offset magnitude. */
    public static final Duration LIMIT = Duration.ofHours(24);

    public UtcOffsetValue {
        Objects.requireNonNull(offset, "offset");
        if (offset.abs().compareTo(LIMIT) >= 0) {
            throw new InvalidValueException(offset.toString(), "UTC-OFFSET",
                    "offset must be less than 24 hours");
        }
        if (offset.getNano() != 0) {
            throw new InvalidValueException(offset.toString(), "UTC-OFFSET",
                    "offset must be a whole number of seconds");
        }
    }

    @Override
    public String typeName() {
        return "UTC-OFFSET";
    }
}
