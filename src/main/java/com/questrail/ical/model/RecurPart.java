package com.questrail.ical.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * The rule parts of a recurrence rule, declared in canonical serialization
 * order (RFC 5545 section 3.3.10). Some clients ignore a rule whose first
 * part is not {@code FREQ}, so encoders must follow this order.
 *
 * <p>Each part fixes the variant its values must have.</p>
 */
public enum RecurPart
{
    FREQ(FrequencyValue.class),
    UNTIL(TemporalValue.class),
    COUNT(IntegerValue.class),
    INTERVAL(IntegerValue.class),
    BYSECOND(IntegerValue.class),
    BYMINUTE(IntegerValue.class),
    BYHOUR(IntegerValue.class),
    BYDAY(WeekdayValue.class),
    BYMONTHDAY(IntegerValue.class),
    BYYEARDAY(IntegerValue.class),
    BYWEEKNO(IntegerValue.class),
    BYMONTH(IntegerValue.class),
    BYSETPOS(IntegerValue.class),
    WKST(WeekdayValue.class);

    private final Class<? extends PropertyValue> valueClass;

    RecurPart(Class<? extends PropertyValue> valueClass) {
        this.valueClass = valueClass;
    }

    public Class<? extends PropertyValue> valueClass() {
        return valueClass;
    }

    /**
     * Case-insensitive lookup of a rule-part name. Extension parts
     * ({@code X-...}) and unknown names yield empty.
     */
    public static Optional<RecurPart> lookup(String key) {
        Objects.requireNonNull(key, "key");
        String upper = key.toUpperCase(Locale.ROOT);
        for (RecurPart p : values()) {
            if (p.name().equals(upper)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
