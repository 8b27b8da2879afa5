package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.api.Parameters;
import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * 3.3.5 Date-Time: a calendar moment at second precision.
 *
 * <h2>Zone forms</h2>
 * <ul>
 *   <li>{@code zone == null}: zone-naive ("floating") local time</li>
 *   <li>{@code zone == ZoneOffset.UTC}: UTC, written with a trailing {@code Z}</li>
 *   <li>any other zone: local time in that zone, published via {@code TZID}</li>
 * </ul>
 *
 * <p>The wall-clock fields are stored as given; the zone is only consulted
 * when moments are compared or shifted. Every UTC spelling is collapsed to
 * {@link ZoneOffset#UTC} so that equality does not depend on it.</p>
 */
public record DateTimeValue(LocalDateTime dateTime, @Nullable ZoneId zone) implements TemporalValue
{
    public DateTimeValue {
        Objects.requireNonNull(dateTime, "dateTime");
        if (dateTime.getYear() < 0 || dateTime.getYear() > 9999) {
            throw new InvalidValueException(dateTime.toString(), "DATE-TIME", "year must have four digits");
        }
        dateTime = dateTime.truncatedTo(ChronoUnit.SECONDS);
        zone = Timezones.canonical(zone);
    }

    public static DateTimeValue naive(LocalDateTime dateTime) {
        return new DateTimeValue(dateTime, null);
    }

    public static DateTimeValue utc(LocalDateTime dateTime) {
        return new DateTimeValue(dateTime, ZoneOffset.UTC);
    }

    public static DateTimeValue of(ZonedDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        return new DateTimeValue(dateTime.toLocalDateTime(), dateTime.getZone());
    }

    public boolean isUtc() {
        return Timezones.isUtc(zone);
    }

    public boolean isZoned() {
        return zone != null;
    }

    /**
     * @return this moment on the timeline, or empty for a zone-naive value
     */
    public Optional<ZonedDateTime> toZonedDateTime() {
        return zone == null ? Optional.empty() : Optional.of(ZonedDateTime.ofLocal(dateTime, zone, null));
    }

    /**
     * Compares two moments chronologically.
     *
     * <p>Zone-naive values compare by wall clock; zoned values compare by
     * instant. A zone-naive moment has no position on the timeline, so mixing
     * the two forms is rejected.</p>
     *
     * @throws InvalidValueException if exactly one of the two values is zoned
     */
    public int compareMoment(DateTimeValue other) {
        Objects.requireNonNull(other, "other");
        if (zone == null && other.zone == null) {
            return dateTime.compareTo(other.dateTime);
        }
        if (zone == null || other.zone == null) {
            throw new InvalidValueException(this + " / " + other, "DATE-TIME",
                    "cannot compare zone-naive and zone-aware moments");
        }
        return toZonedDateTime().orElseThrow().toInstant()
                .compareTo(other.toZonedDateTime().orElseThrow().toInstant());
    }

    /**
     * Shifts this moment by a signed duration.
     *
     * <p>Whole days are nominal: they move the wall clock and keep the time of
     * day across DST transitions. The remainder is exact elapsed time.</p>
     *
     * @throws InvalidValueException if the result leaves the four-digit year range
     */
    public DateTimeValue plus(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        long days = duration.toDays();
        Duration exact = duration.minusDays(days);
        try {
            LocalDateTime shifted = dateTime.plusDays(days);
            if (zone == null) {
                return new DateTimeValue(shifted.plus(exact), null);
            }
            ZonedDateTime moved = ZonedDateTime.ofLocal(shifted, zone, null).plus(exact);
            return new DateTimeValue(moved.toLocalDateTime(), zone);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidValueException(this + " + " + duration, "DATE-TIME", "result is out of range", e);
        }
    }

    /**
     * Exact elapsed time from this moment to {@code other}.
     *
     * @throws InvalidValueException if exactly one of the two values is zoned
     */
    public Duration until(DateTimeValue other) {
        compareMoment(other);
        if (zone == null) {
            return Duration.between(dateTime, other.dateTime);
        }
        return Duration.between(toZonedDateTime().orElseThrow(), other.toZonedDateTime().orElseThrow());
    }

    @Override
    public String typeName() {
        return "DATE-TIME";
    }

    @Override
    public Parameters parameters() {
        Parameters p = Parameters.of(Parameters.VALUE, "DATE-TIME");
        Timezones.tzidOf(zone).ifPresent(tzid -> p.put(Parameters.TZID, tzid));
        return p;
    }
}
