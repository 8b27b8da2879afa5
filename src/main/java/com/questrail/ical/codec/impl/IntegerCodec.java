package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.IntegerValue;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * INTEGER: optionally signed decimal digits within the 32-bit range.
 */
public final class IntegerCodec implements ValueCodec<IntegerValue>
{
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    @Override
    public String typeName() {
        return "INTEGER";
    }

    @Override
    public Class<IntegerValue> valueClass() {
        return IntegerValue.class;
    }

    @Override
    public String encode(IntegerValue value) {
        return Integer.toString(value.value());
    }

    @Override
    public IntegerValue decode(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (!INTEGER.matcher(trimmed).matches()) {
            throw new InvalidValueException(text, typeName(), "expected an integer");
        }
        try {
            return new IntegerValue(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new InvalidValueException(text, typeName(), "integer out of 32-bit range", e);
        }
    }
}
