package com.questrail.ical.model;

/**
 * 3.3.8 Integer: a signed 32-bit value.
 */
public record IntegerValue(int value) implements PropertyValue
{
    @Override
    public String typeName() {
        return "INTEGER";
    }
}
