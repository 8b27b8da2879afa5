package com.questrail.ical.codec.impl;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.DateTimeValue;
import com.questrail.ical.model.DateValue;
import com.questrail.ical.model.DurationValue;
import com.questrail.ical.model.TemporalValue;
import com.questrail.ical.model.TimeValue;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * TemporalCodec
 * -----------------------------------------------------------------------------
 * Polymorphic codec over the {@link TemporalValue} variants.
 *
 * <p><strong>Encode</strong> selects the codec matching the variant.</p>
 *
 * <p><strong>Decode</strong> tries candidates in a fixed priority order:</p>
 * <ol>
 *   <li>text starting with {@code P}, {@code +P} or {@code -P} → DURATION</li>
 *   <li>DATE-TIME</li>
 *   <li>DATE</li>
 *   <li>TIME</li>
 * </ol>
 *
 * <p>The first success wins. Candidate failures are not surfaced; only when
 * every candidate has failed is a single {@link InvalidValueException}
 * raised, carrying the individual failures as suppressed exceptions.</p>
 */
public final class TemporalCodec implements ValueCodec<TemporalValue>
{
    private static final Logger log = LoggerFactory.getLogger(TemporalCodec.class);

    private final DateTimeCodec dateTimeCodec = new DateTimeCodec();
    private final DateCodec dateCodec = new DateCodec();
    private final TimeCodec timeCodec = new TimeCodec();
    private final DurationCodec durationCodec = new DurationCodec();

    @Override
    public String typeName() {
        return "DATE-TIME";
    }

    @Override
    public Class<TemporalValue> valueClass() {
        return TemporalValue.class;
    }

    @Override
    public String encode(TemporalValue value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof DateTimeValue dateTime) {
            return dateTimeCodec.encode(dateTime);
        }
        if (value instanceof DateValue date) {
            return dateCodec.encode(date);
        }
        if (value instanceof TimeValue time) {
            return timeCodec.encode(time);
        }
        return durationCodec.encode((DurationValue) value);
    }

    /**
     * Encodes a native {@code java.time} value via {@link TemporalValue#of(Object)}.
     *
     * @throws InvalidValueException if the native type is not supported
     */
    public String encodeNative(Object value) {
        return encode(TemporalValue.of(value));
    }

    @Override
    public TemporalValue decode(String text) {
        return decode(text, null);
    }

    @Override
    public TemporalValue decode(String text, @Nullable String tzid) {
        Objects.requireNonNull(text, "text");

        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P") || upper.startsWith("-P") || upper.startsWith("+P")) {
            return durationCodec.decode(text);
        }

        InvalidValueException asDateTime;
        try {
            return dateTimeCodec.decode(text, tzid);
        } catch (InvalidValueException e) {
            log.debug("'{}' is not a DATE-TIME ({}), trying DATE", text, e.reason());
            asDateTime = e;
        }

        InvalidValueException asDate;
        try {
            return dateCodec.decode(text);
        } catch (InvalidValueException e) {
            log.debug("'{}' is not a DATE ({}), trying TIME", text, e.reason());
            asDate = e;
        }

        try {
            return timeCodec.decode(text, tzid);
        } catch (InvalidValueException asTime) {
            InvalidValueException failure = new InvalidValueException(text, "DATE-TIME",
                    "not a DATE-TIME, DATE or TIME");
            failure.addSuppressed(asDateTime);
            failure.addSuppressed(asDate);
            failure.addSuppressed(asTime);
            throw failure;
        }
    }
}
