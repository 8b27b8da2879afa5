package com.questrail.ical.codec.impl;

import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.InlineValue;

import java.util.Objects;

/**
 * Pass-through codec for raw text interpreted by a higher layer.
 */
public final class InlineCodec implements ValueCodec<InlineValue>
{
    @Override
    public String typeName() {
        return "INLINE";
    }

    @Override
    public Class<InlineValue> valueClass() {
        return InlineValue.class;
    }

    @Override
    public String encode(InlineValue value) {
        return value.text();
    }

    @Override
    public InlineValue decode(String text) {
        return new InlineValue(Objects.requireNonNull(text, "text"));
    }
}
