package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.Weekday;
import com.questrail.ical.model.WeekdayValue;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weekday selector of {@code BYDAY} and {@code WKST}:
 * {@code [(+|-)][ordinal]weekday}, e.g. {@code MO}, {@code 2TU}, {@code -1FR}.
 *
 * <p>Codes are case-insensitive on decode and written in upper case. A sign
 * is only meaningful in front of an ordinal.</p>
 */
public final class WeekdayCodec implements ValueCodec<WeekdayValue>
{
    private static final Pattern WEEKDAY = Pattern.compile("([+-]?)(\\d{0,2})(\\w{2})");

    @Override
    public String typeName() {
        return "WEEKDAY";
    }

    @Override
    public Class<WeekdayValue> valueClass() {
        return WeekdayValue.class;
    }

    @Override
    public String encode(WeekdayValue value) {
        String code = value.weekday().code();
        return value.hasOrdinal() ? value.ordinal() + code : code;
    }

    @Override
    public WeekdayValue decode(String text) {
        Objects.requireNonNull(text, "text");
        Matcher m = WEEKDAY.matcher(text);
        if (!m.matches()) {
            throw new InvalidValueException(text, typeName(), "expected [+|-][ordinal]weekday");
        }

        String sign = m.group(1);
        String ordinal = m.group(2);
        Weekday weekday = Weekday.fromCode(m.group(3))
                .orElseThrow(() -> new InvalidValueException(text, typeName(),
                        "weekday must be one of SU, MO, TU, WE, TH, FR, SA"));

        if (ordinal.isEmpty()) {
            if (!sign.isEmpty()) {
                throw new InvalidValueException(text, typeName(), "sign without ordinal");
            }
            return WeekdayValue.of(weekday);
        }

        int n = Integer.parseInt(ordinal);
        if (n == 0) {
            throw new InvalidValueException(text, typeName(), "ordinal must not be zero");
        }
        if (n > WeekdayValue.MAX_ORDINAL) {
            throw new InvalidValueException(text, typeName(),
                    "ordinal must not exceed " + WeekdayValue.MAX_ORDINAL);
        }
        return WeekdayValue.of("-".equals(sign) ? -n : n, weekday);
    }
}
