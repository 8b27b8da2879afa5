package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;

/**
 * 3.3.7 Float. Only finite values are representable in the RFC grammar.
 */
public record FloatValue(double value) implements PropertyValue
{
    public FloatValue {
        if (!Double.isFinite(value)) {
            throw new InvalidValueException(Double.toString(value), "FLOAT", "value must be finite");
        }
    }

    @Override
    public String typeName() {
        return "FLOAT";
    }
}
