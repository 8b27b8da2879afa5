package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Objects;

/**
 * The temporal subset of {@link PropertyValue}: a date, a time of day, a
 * calendar moment or a signed duration.
 *
 * <p>These are the variants that the temporal dispatcher selects between and
 * that may appear in a date-time list or a recurrence rule's {@code UNTIL}.</p>
 */
public sealed interface TemporalValue extends PropertyValue
        permits DateValue, DateTimeValue, DurationValue, TimeValue {

    /**
     * Builds the temporal variant matching a native {@code java.time} value.
     *
     * <ul>
     *   <li>date and time fields present → {@link DateTimeValue} (zone kept if the
     *       value carries one)</li>
     *   <li>date fields only → {@link DateValue}</li>
     *   <li>time fields only → {@link TimeValue}</li>
     *   <li>{@link Duration} → {@link DurationValue}</li>
     *   <li>{@link Instant} → UTC {@link DateTimeValue}</li>
     * </ul>
     *
     * @param value native value
     * @return the matching variant
     * @throws InvalidValueException if the native type is not supported
     */
    static TemporalValue of(Object value) {
        Objects.requireNonNull(value, "value");

        if (value instanceof TemporalValue temporal) {
            return temporal;
        }
        if (value instanceof Duration duration) {
            return new DurationValue(duration);
        }
        if (value instanceof Instant instant) {
            return DateTimeValue.utc(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        if (value instanceof TemporalAccessor accessor) {
            boolean hasDate = accessor.isSupported(ChronoField.EPOCH_DAY);
            boolean hasTime = accessor.isSupported(ChronoField.NANO_OF_DAY);
            ZoneId zone = accessor.query(TemporalQueries.zone());

            if (hasDate && hasTime) {
                return new DateTimeValue(LocalDateTime.from(accessor), zone);
            }
            if (hasDate) {
                return new DateValue(LocalDate.from(accessor));
            }
            if (hasTime) {
                return new TimeValue(LocalTime.from(accessor), zone);
            }
        }

        throw new InvalidValueException(String.valueOf(value), "DATE-TIME",
                "unsupported native type " + value.getClass().getName());
    }
}
