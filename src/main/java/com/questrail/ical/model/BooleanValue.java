package com.questrail.ical.model;

/**
 * 3.3.2 Boolean.
 */
public record BooleanValue(boolean value) implements PropertyValue
{
    @Override
    public String typeName() {
        return "BOOLEAN";
    }
}
