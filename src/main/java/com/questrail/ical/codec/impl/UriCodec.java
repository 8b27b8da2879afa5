package com.questrail.ical.codec.impl;

import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.UriValue;

import java.util.Objects;

public final class UriCodec implements ValueCodec<UriValue>
{
    @Override
    public String typeName() {
        return "URI";
    }

    @Override
    public Class<UriValue> valueClass() {
        return UriValue.class;
    }

    @Override
    public String encode(UriValue value) {
        return value.uri();
    }

    @Override
    public UriValue decode(String text) {
        return new UriValue(Objects.requireNonNull(text, "text"));
    }
}
