package com.questrail.ical.model;

import java.util.Objects;

/**
 * The value of a {@code FREQ} rule part.
 */
public record FrequencyValue(Frequency frequency) implements PropertyValue
{
    public FrequencyValue {
        Objects.requireNonNull(frequency, "frequency");
    }

    @Override
    public String typeName() {
        return "FREQUENCY";
    }
}
