package com.questrail.ical.codec.impl;

import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.TextValue;

import java.util.Objects;

/**
 * TEXT: the only codec that escapes. Values are held unescaped.
 */
public final class TextCodec implements ValueCodec<TextValue>
{
    @Override
    public String typeName() {
        return "TEXT";
    }

    @Override
    public Class<TextValue> valueClass() {
        return TextValue.class;
    }

    @Override
    public String encode(TextValue value) {
        return IcalEscaping.escape(value.text());
    }

    @Override
    public TextValue decode(String text) {
        return new TextValue(IcalEscaping.unescape(Objects.requireNonNull(text, "text")));
    }
}
