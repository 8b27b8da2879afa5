package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.DurationValue;
import com.questrail.ical.model.PeriodValue;
import com.questrail.ical.model.TemporalValue;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * PERIOD: {@code <start>/<end>} or {@code <start>/<duration>}.
 *
 * <p>Both operands are decoded by the {@link TemporalCodec}; the timezone
 * hint, if any, applies to both. The start is a DATE or a DATE-TIME; the
 * second operand is of the same kind or a DURATION. The form a period was
 * built with is the form it is written back in.</p>
 */
public final class PeriodCodec implements ValueCodec<PeriodValue>
{
    private final TemporalCodec temporalCodec = new TemporalCodec();
    private final DurationCodec durationCodec = new DurationCodec();

    @Override
    public String typeName() {
        return "PERIOD";
    }

    @Override
    public Class<PeriodValue> valueClass() {
        return PeriodValue.class;
    }

    @Override
    public String encode(PeriodValue value) {
        String start = temporalCodec.encode(value.start());
        String second = value.byDuration()
                ? durationCodec.encode(new DurationValue(value.duration()))
                : temporalCodec.encode(value.end());
        return start + "/" + second;
    }

    @Override
    public PeriodValue decode(String text) {
        return decode(text, null);
    }

    @Override
    public PeriodValue decode(String text, @Nullable String tzid) {
        Objects.requireNonNull(text, "text");
        String[] operands = text.split("/", -1);
        if (operands.length != 2) {
            throw new InvalidValueException(text, typeName(), "expected <start>/<end> or <start>/<duration>");
        }

        try {
            TemporalValue start = temporalCodec.decode(operands[0], tzid);
            TemporalValue endOrDuration = temporalCodec.decode(operands[1], tzid);
            return PeriodValue.of(start, endOrDuration);
        } catch (InvalidValueException e) {
            if (e.rawText().equals(text) && e.typeName().equals(typeName())) {
                throw e;
            }
            throw new InvalidValueException(text, typeName(), e.getMessage(), e);
        }
    }
}
