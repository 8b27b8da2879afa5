package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.GeoValue;

import java.util.Objects;

/**
 * GEO: {@code <latitude>;<longitude>}, both as FLOAT.
 */
public final class GeoCodec implements ValueCodec<GeoValue>
{
    @Override
    public String typeName() {
        return "GEO";
    }

    @Override
    public Class<GeoValue> valueClass() {
        return GeoValue.class;
    }

    @Override
    public String encode(GeoValue value) {
        return FloatCodec.format(value.latitude()) + ";" + FloatCodec.format(value.longitude());
    }

    @Override
    public GeoValue decode(String text) {
        Objects.requireNonNull(text, "text");
        String[] fields = text.split(";", -1);
        if (fields.length != 2) {
            throw new InvalidValueException(text, typeName(), "expected '<latitude>;<longitude>'");
        }
        return new GeoValue(FloatCodec.parse(fields[0], typeName()), FloatCodec.parse(fields[1], typeName()));
    }
}
