package com.questrail.ical.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Recurrence frequencies ({@code FREQ} rule part).
 */
public enum Frequency
{
    SECONDLY,
    MINUTELY,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    /**
     * Case-insensitive lookup of a frequency literal.
     */
    public static Optional<Frequency> fromName(String name) {
        Objects.requireNonNull(name, "name");
        String upper = name.toUpperCase(Locale.ROOT);
        for (Frequency f : values()) {
            if (f.name().equals(upper)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
