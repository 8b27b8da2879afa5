package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.DateTimeListValue;
import com.questrail.ical.model.TemporalValue;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Comma-separated list of one temporal variant ({@code RDATE},
 * {@code EXDATE}). Every element is decoded with the same timezone hint.
 */
public final class DateTimeListCodec implements ValueCodec<DateTimeListValue>
{
    private final TemporalCodec temporalCodec = new TemporalCodec();

    @Override
    public String typeName() {
        return "DATE-TIME-LIST";
    }

    @Override
    public Class<DateTimeListValue> valueClass() {
        return DateTimeListValue.class;
    }

    @Override
    public String encode(DateTimeListValue value) {
        StringJoiner joiner = new StringJoiner(",");
        for (TemporalValue v : value.values()) {
            joiner.add(temporalCodec.encode(v));
        }
        return joiner.toString();
    }

    @Override
    public DateTimeListValue decode(String text) {
        return decode(text, null);
    }

    @Override
    public DateTimeListValue decode(String text, @Nullable String tzid) {
        Objects.requireNonNull(text, "text");
        List<TemporalValue> values = new ArrayList<>();
        try {
            for (String element : text.split(",", -1)) {
                values.add(temporalCodec.decode(element, tzid));
            }
            return new DateTimeListValue(values);
        } catch (InvalidValueException e) {
            throw new InvalidValueException(text, typeName(), e.getMessage(), e);
        }
    }
}
