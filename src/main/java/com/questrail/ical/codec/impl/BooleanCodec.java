package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.BooleanValue;

import java.util.Objects;

/**
 * BOOLEAN: {@code TRUE} or {@code FALSE}, case-insensitive on decode.
 */
public final class BooleanCodec implements ValueCodec<BooleanValue>
{
    @Override
    public String typeName() {
        return "BOOLEAN";
    }

    @Override
    public Class<BooleanValue> valueClass() {
        return BooleanValue.class;
    }

    @Override
    public String encode(BooleanValue value) {
        return value.value() ? "TRUE" : "FALSE";
    }

    @Override
    public BooleanValue decode(String text) {
        Objects.requireNonNull(text, "text");
        if ("TRUE".equalsIgnoreCase(text)) {
            return new BooleanValue(true);
        }
        if ("FALSE".equalsIgnoreCase(text)) {
            return new BooleanValue(false);
        }
        throw new InvalidValueException(text, typeName(), "expected TRUE or FALSE");
    }
}
