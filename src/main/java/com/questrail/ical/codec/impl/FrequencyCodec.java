package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.Frequency;
import com.questrail.ical.model.FrequencyValue;

import java.util.Objects;

/**
 * {@code FREQ} literal: one of the seven frequencies, case-insensitive on
 * decode and written in upper case.
 */
public final class FrequencyCodec implements ValueCodec<FrequencyValue>
{
    @Override
    public String typeName() {
        return "FREQUENCY";
    }

    @Override
    public Class<FrequencyValue> valueClass() {
        return FrequencyValue.class;
    }

    @Override
    public String encode(FrequencyValue value) {
        return value.frequency().name();
    }

    @Override
    public FrequencyValue decode(String text) {
        Objects.requireNonNull(text, "text");
        return Frequency.fromName(text)
                .map(FrequencyValue::new)
                .orElseThrow(() -> new InvalidValueException(text, typeName(),
                        "expected SECONDLY, MINUTELY, HOURLY, DAILY, WEEKLY, MONTHLY or YEARLY"));
    }
}
