package com.questrail.ical.model;

import java.util.Objects;

/**
 * 3.3.11 Text, held unescaped.
 */
public record TextValue(String text) implements PropertyValue
{
    public TextValue {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String typeName() {
        return "TEXT";
    }
}
