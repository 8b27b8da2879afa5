package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.TimeValue;
import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * TIME: {@code HHMMSS[Z]}.
 *
 * <p>Zone resolution follows {@link DateTimeCodec}: a resolvable timezone hint
 * wins, otherwise a trailing {@code Z} means UTC and no suffix means
 * zone-naive. Numeric offset suffixes are not part of the grammar.</p>
 */
public final class TimeCodec implements ValueCodec<TimeValue>
{
    @Override
    public String typeName() {
        return "TIME";
    }

    @Override
    public Class<TimeValue> valueClass() {
        return TimeValue.class;
    }

    @Override
    public String encode(TimeValue value) {
        return format(value.time()) + (value.isUtc() ? "Z" : "");
    }

    @Override
    public TimeValue decode(String text) {
        return decode(text, null);
    }

    @Override
    public TimeValue decode(String text, @Nullable String tzid) {
        Objects.requireNonNull(text, "text");
        if (text.length() != 6 && text.length() != 7) {
            throw new InvalidValueException(text, typeName(), "expected HHMMSS or HHMMSSZ");
        }

        LocalTime time = parse(text, 0, typeName());
        String suffix = text.substring(6);
        if (!suffix.isEmpty() && !suffix.equals("Z")) {
            throw new InvalidValueException(text, typeName(),
                    "only a trailing 'Z' or a TZID parameter may designate a timezone");
        }

        Optional<ZoneId> hint = ZoneHints.resolve(tzid);
        if (hint.isPresent()) {
            return new TimeValue(time, hint.get());
        }
        return new TimeValue(time, suffix.isEmpty() ? null : ZoneOffset.UTC);
    }

    static String format(LocalTime time)
    {
        return String.format(Locale.ROOT, "%02d%02d%02d",
                time.getHour(), time.getMinute(), time.getSecond());
    }

    /**
     * Parses {@code HHMMSS} starting at {@code from}. A leap second
     * ({@code 60}) is clamped to {@code 59}.
     */
    static LocalTime parse(String text, int from, String typeName)
    {
        int hour = FixedWidthFields.digits(text, from, 2, typeName);
        int minute = FixedWidthFields.digits(text, from + 2, 2, typeName);
        int second = FixedWidthFields.digits(text, from + 4, 2, typeName);
        try {
            return LocalTime.of(hour, minute, second == 60 ? 59 : second);
        } catch (DateTimeException e) {
            throw new InvalidValueException(text, typeName, e.getMessage(), e);
        }
    }
}
