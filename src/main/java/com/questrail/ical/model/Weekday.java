package com.questrail.ical.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * The seven two-letter weekday codes of RFC 5545 ({@code SU} .. {@code SA}).
 */
public enum Weekday
{
    SU,
    MO,
    TU,
    WE,
    TH,
    FR,
    SA;

    public String code() {
        return name();
    }

    /**
     * Case-insensitive lookup of a two-letter code.
     */
    public static Optional<Weekday> fromCode(String code) {
        Objects.requireNonNull(code, "code");
        String upper = code.toUpperCase(Locale.ROOT);
        for (Weekday w : values()) {
            if (w.name().equals(upper)) {
                return Optional.of(w);
            }
        }
        return Optional.empty();
    }
}
