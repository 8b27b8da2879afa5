package com.questrail.ical.codec.impl;

import com.questrail.ical.model.Timezones;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.Optional;

/**
 * Resolves the caller's timezone hint for the temporal codecs. Unknown
 * identifiers are logged and ignored, so the value decodes as if no hint
 * had been given.
 */
final class ZoneHints
{
    private static final Logger log = LoggerFactory.getLogger(ZoneHints.class);

    private ZoneHints() {}

    static Optional<ZoneId> resolve(@Nullable String tzid)
    {
        if (tzid == null || tzid.isBlank()) {
            return Optional.empty();
        }
        Optional<ZoneId> zone = Timezones.resolve(tzid);
        if (zone.isEmpty()) {
            log.warn("Ignoring unknown timezone identifier '{}'", tzid);
        }
        return zone;
    }
}
