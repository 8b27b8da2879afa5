package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.DurationValue;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DURATION: {@code [+|-]P(nW | [nD][T[nH][nM][nS]])}.
 *
 * <p>Designators are matched case-insensitively on decode.
 * Encoding is canonical: weeks are never written, the {@code T} block is
 * omitted when there is no sub-day part, the {@code D} segment is omitted
 * when there is no day part, and an empty duration is {@code P0D}. Minutes
 * are written when non-zero or when they separate hours from seconds.</p>
 */
public final class DurationCodec implements ValueCodec<DurationValue>
{
    private static final Pattern DURATION = Pattern.compile(
            "([-+]?)P(?:(\\d+)W|(?:(\\d+)D)?(T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?)?)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String typeName() {
        return "DURATION";
    }

    @Override
    public Class<DurationValue> valueClass() {
        return DurationValue.class;
    }

    @Override
    public String encode(DurationValue value) {
        Duration d = value.duration();
        String sign = "";
        if (d.isNegative()) {
            sign = "-";
            d = d.negated();
        }

        long days = d.toDays();
        long rest = d.minusDays(days).getSeconds();

        StringBuilder time = new StringBuilder();
        if (rest != 0) {
            long hours = rest / 3600;
            long minutes = (rest % 3600) / 60;
            long seconds = rest % 60;
            time.append('T');
            if (hours != 0) {
                time.append(hours).append('H');
            }
            if (minutes != 0 || (hours != 0 && seconds != 0)) {
                time.append(minutes).append('M');
            }
            if (seconds != 0) {
                time.append(seconds).append('S');
            }
        }

        if (days == 0 && time.length() > 0) {
            return sign + "P" + time;
        }
        return sign + "P" + days + "D" + time;
    }

    @Override
    public DurationValue decode(String text) {
        Objects.requireNonNull(text, "text");
        Matcher m = DURATION.matcher(text);
        if (!m.matches()) {
            throw new InvalidValueException(text, typeName(), "expected [+|-]P(nW | [nD][T[nH][nM][nS]])");
        }

        String weeks = m.group(2);
        String days = m.group(3);
        String timeBlock = m.group(4);
        String hours = m.group(5);
        String minutes = m.group(6);
        String seconds = m.group(7);

        if (weeks == null && days == null && timeBlock == null) {
            throw new InvalidValueException(text, typeName(), "duration has no components");
        }
        if (timeBlock != null && hours == null && minutes == null && seconds == null) {
            throw new InvalidValueException(text, typeName(), "'T' must be followed by hours, minutes or seconds");
        }

        try {
            Duration d;
            if (weeks != null) {
                d = Duration.ofDays(Math.multiplyExact(Long.parseLong(weeks), 7L));
            } else {
                d = Duration.ofDays(parse(days))
                        .plusHours(parse(hours))
                        .plusMinutes(parse(minutes))
                        .plusSeconds(parse(seconds));
            }
            return new DurationValue("-".equals(m.group(1)) ? d.negated() : d);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidValueException(text, typeName(), "duration is out of range", e);
        }
    }

    private static long parse(String group) {
        return group == null ? 0L : Long.parseLong(group);
    }
}
