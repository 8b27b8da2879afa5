package com.questrail.ical.model;

import com.questrail.ical.api.Parameters;
import org.jspecify.annotations.Nullable;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 3.3.12 Time: a time of day at second precision, optionally bound to a
 * timezone.
 *
 * <p>Every UTC spelling is stored as {@link ZoneOffset#UTC}; a {@code null}
 * zone means the time is zone-naive ("floating").</p>
 */
public record TimeValue(LocalTime time, @Nullable ZoneId zone) implements TemporalValue
{
    public TimeValue {
        Objects.requireNonNull(time, "time");
        time = time.truncatedTo(ChronoUnit.SECONDS);
        zone = Timezones.canonical(zone);
    }

    public static TimeValue naive(LocalTime time) {
        return new TimeValue(time, null);
    }

    public static TimeValue utc(LocalTime time) {
        return new TimeValue(time, ZoneOffset.UTC);
    }

    public boolean isUtc() {
        return Timezones.isUtc(zone);
    }

    @Override
    public String typeName() {
        return "TIME";
    }

    @Override
    public Parameters parameters() {
        Parameters p = Parameters.of(Parameters.VALUE, "TIME");
        Timezones.tzidOf(zone).ifPresent(tzid -> p.put(Parameters.TZID, tzid));
        return p;
    }
}
