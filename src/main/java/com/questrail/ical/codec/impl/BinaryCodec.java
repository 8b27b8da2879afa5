package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.BinaryValue;

import java.util.Base64;
import java.util.Objects;

/**
 * BINARY: base64 per RFC 4648, without line breaks.
 */
public final class BinaryCodec implements ValueCodec<BinaryValue>
{
    @Override
    public String typeName() {
        return "BINARY";
    }

    @Override
    public Class<BinaryValue> valueClass() {
        return BinaryValue.class;
    }

    @Override
    public String encode(BinaryValue value) {
        Objects.requireNonNull(value, "value");
        return Base64.getEncoder().encodeToString(value.data());
    }

    @Override
    public BinaryValue decode(String text) {
        Objects.requireNonNull(text, "text");
        try {
            return new BinaryValue(Base64.getDecoder().decode(text));
        } catch (IllegalArgumentException e) {
            throw new InvalidValueException(text, typeName(), "not valid base64", e);
        }
    }
}
