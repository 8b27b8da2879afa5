package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.DateTimeValue;
import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;

/**
 * DATE-TIME: {@code YYYYMMDDTHHMMSS[Z]}.
 *
 * <h2>Zone resolution on decode</h2>
 * <ol>
 *   <li>a resolvable timezone hint (the property's {@code TZID}) localizes the
 *       wall-clock fields into that zone</li>
 *   <li>no suffix → zone-naive moment</li>
 *   <li>{@code Z} → UTC moment</li>
 *   <li>any other suffix, such as a numeric offset, is rejected</li>
 * </ol>
 *
 * <p>On encode, {@code Z} is appended if and only if the value is UTC. A
 * non-UTC zone is published through {@code TZID} (see
 * {@link DateTimeValue#parameters()}), never inline.</p>
 */
public final class DateTimeCodec implements ValueCodec<DateTimeValue>
{
    @Override
    public String typeName() {
        return "DATE-TIME";
    }

    @Override
    public Class<DateTimeValue> valueClass() {
        return DateTimeValue.class;
    }

    @Override
    public String encode(DateTimeValue value) {
        LocalDateTime dt = value.dateTime();
        return DateCodec.format(dt.toLocalDate()) + "T" + TimeCodec.format(dt.toLocalTime())
                + (value.isUtc() ? "Z" : "");
    }

    @Override
    public DateTimeValue decode(String text) {
        return decode(text, null);
    }

    @Override
    public DateTimeValue decode(String text, @Nullable String tzid) {
        Objects.requireNonNull(text, "text");
        if (text.length() < 15 || text.charAt(8) != 'T') {
            throw new InvalidValueException(text, typeName(), "expected YYYYMMDDTHHMMSS");
        }

        LocalDateTime local = LocalDateTime.of(
                DateCodec.parse(text, typeName()),
                TimeCodec.parse(text, 9, typeName()));

        String suffix = text.substring(15);
        if (!suffix.isEmpty() && !suffix.equals("Z")) {
            throw new InvalidValueException(text, typeName(),
                    "only a trailing 'Z' or a TZID parameter may designate a timezone");
        }

        Optional<ZoneId> hint = ZoneHints.resolve(tzid);
        if (hint.isPresent()) {
            return new DateTimeValue(local, hint.get());
        }
        return new DateTimeValue(local, suffix.isEmpty() ? null : ZoneOffset.UTC);
    }
}
