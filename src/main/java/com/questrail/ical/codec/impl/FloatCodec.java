package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.FloatValue;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * FLOAT: locale-independent decimal notation. Exponents are accepted on
 * decode but never written.
 */
public final class FloatCodec implements ValueCodec<FloatValue>
{
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    @Override
    public String typeName() {
        return "FLOAT";
    }

    @Override
    public Class<FloatValue> valueClass() {
        return FloatValue.class;
    }

    @Override
    public String encode(FloatValue value) {
        return format(value.value());
    }

    @Override
    public FloatValue decode(String text) {
        return new FloatValue(parse(text, typeName()));
    }

    static String format(double v)
    {
        String plain = Double.toString(v);
        if (plain.indexOf('E') < 0) {
            return plain;
        }
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    static double parse(String text, String typeName)
    {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new InvalidValueException(text, typeName, "expected a decimal number");
        }
        double v = Double.parseDouble(trimmed);
        if (!Double.isFinite(v)) {
            throw new InvalidValueException(text, typeName, "number is out of range");
        }
        return v;
    }
}
