package com.questrail.ical.model;

import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Timezone helpers shared by the zoned temporal values.
 */
public final class Timezones
{
    private Timezones() {}

    /**
     * Returns true if {@code zone} is UTC under any of its spellings
     * ({@code Z}, {@code UTC}, {@code Etc/UTC}, {@code GMT}, ...).
     */
    public static boolean isUtc(@Nullable ZoneId zone) {
        return zone != null && ZoneOffset.UTC.equals(zone.normalized());
    }

    /**
     * Collapses every UTC spelling to {@link ZoneOffset#UTC}; other zones are
     * returned unchanged.
     */
    public static @Nullable ZoneId canonical(@Nullable ZoneId zone) {
        return isUtc(zone) ? ZoneOffset.UTC : zone;
    }

    /**
     * Resolves a timezone identifier (typically a {@code TZID} parameter value).
     *
     * @return the zone, or empty if the identifier is blank or unknown
     */
    public static Optional<ZoneId> resolve(@Nullable String tzid) {
        if (tzid == null || tzid.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(tzid.trim()));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * The timezone identifier to publish as a {@code TZID} parameter for a
     * value carrying {@code zone}. UTC values are marked with a trailing
     * {@code Z} instead and therefore have none.
     */
    public static Optional<String> tzidOf(@Nullable ZoneId zone) {
        if (zone == null || isUtc(zone)) {
            return Optional.empty();
        }
        return Optional.of(zone.getId());
    }
}
