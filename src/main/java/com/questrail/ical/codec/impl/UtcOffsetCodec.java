package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.UtcOffsetValue;

import java.time.Duration;
import java.util.Objects;

/**
 * UTC-OFFSET: {@code (+|-)HHMM[SS]}.
 *
 * <p>The sign is always written, including for a zero offset: some clients
 * reject {@code 0000} but accept {@code +0000}. The seconds group is written
 * only when non-zero.</p>
 */
public final class UtcOffsetCodec implements ValueCodec<UtcOffsetValue>
{
    @Override
    public String typeName() {
        return "UTC-OFFSET";
    }

    @Override
    public Class<UtcOffsetValue> valueClass() {
        return UtcOffsetValue.class;
    }

    @Override
    public String encode(UtcOffsetValue value) {
        Duration offset = value.offset();
        char sign = offset.isNegative() ? '-' : '+';
        long total = offset.abs().getSeconds();

        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long seconds = total % 60;

        StringBuilder out = new StringBuilder(7).append(sign);
        appendTwoDigits(out, hours);
        appendTwoDigits(out, minutes);
        if (seconds != 0) {
            appendTwoDigits(out, seconds);
        }
        return out.toString();
    }

    @Override
    public UtcOffsetValue decode(String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() != 5 && text.length() != 7) {
            throw new InvalidValueException(text, typeName(), "expected (+|-)HHMM or (+|-)HHMMSS");
        }

        char sign = text.charAt(0);
        if (sign != '+' && sign != '-') {
            throw new InvalidValueException(text, typeName(), "offset must start with '+' or '-'");
        }

        int hours = FixedWidthFields.digits(text, 1, 2, typeName());
        int minutes = FixedWidthFields.digits(text, 3, 2, typeName());
        int seconds = text.length() == 7 ? FixedWidthFields.digits(text, 5, 2, typeName()) : 0;
        if (minutes > 59 || seconds > 59) {
            throw new InvalidValueException(text, typeName(), "minutes and seconds must be below 60");
        }

        Duration offset = Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
        if (offset.compareTo(UtcOffsetValue.LIMIT) >= 0) {
            throw new InvalidValueException(text, typeName(), "offset must be less than 24 hours");
        }
        return new UtcOffsetValue(sign == '-' ? offset.negated() : offset);
    }

    private static void appendTwoDigits(StringBuilder out, long v) {
        if (v < 10) {
            out.append('0');
        }
        out.append(v);
    }
}
