package com.questrail.ical.model;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 3.3.6 Duration: a signed span at second precision.
 *
 * <p>Weeks are folded into days on decode ({@code P7W} equals {@code P49D}).</p>
 */
public record DurationValue(Duration duration) implements TemporalValue
{
    public DurationValue {
        Objects.requireNonNull(duration, "duration");
        duration = duration.truncatedTo(ChronoUnit.SECONDS);
    }

    public static DurationValue ofDays(long days) {
        return new DurationValue(Duration.ofDays(days));
    }

    @Override
    public String typeName() {
        return "DURATION";
    }
}
