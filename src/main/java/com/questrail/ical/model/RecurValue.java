package com.questrail.ical.model;

import com.questrail.ical.api.CaselessMap;
import com.questrail.ical.api.InvalidValueException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 3.3.10 Recurrence Rule.
 *
 * <h2>Structure</h2>
 * <p>
 * A mapping from rule-part name to a non-empty ordered list of values. Names
 * are normalized to upper case. For the parts listed in {@link RecurPart} the
 * value variant is fixed (e.g. {@code BYDAY} holds {@link WeekdayValue}s);
 * extension parts hold {@link TextValue}s.
 * </p>
 *
 * <h2>What this type does NOT check</h2>
 * <p>
 * The presence of exactly one {@code FREQ}, or combinations forbidden by
 * the RFC (such as {@code COUNT} together with {@code UNTIL}), are the
 * consumer's concern. The rule holds whatever parts it is given.
 * </p>
 *
 * <p>Equality ignores insertion order.</p>
 */
public final class RecurValue implements PropertyValue
{
    private final Map<String, List<PropertyValue>> parts;

    private RecurValue(Map<String, List<PropertyValue>> parts) {
        this.parts = Collections.unmodifiableMap(parts);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the parts keyed by normalized name, in insertion order
     */
    public Map<String, List<PropertyValue>> parts() {
        return parts;
    }

    /**
     * @return the values of {@code key} (case-insensitive), or an empty list
     */
    public List<PropertyValue> get(String key) {
        return parts.getOrDefault(CaselessMap.normalize(key), List.of());
    }

    public boolean contains(String key) {
        return parts.containsKey(CaselessMap.normalize(key));
    }

    /**
     * Returns the present part names in serialization order: the
     * {@link RecurPart} parts in declaration order, followed by extension
     * parts sorted by name.
     */
    public List<String> canonicalKeys() {
        List<String> keys = new ArrayList<>();
        for (RecurPart part : RecurPart.values()) {
            if (parts.containsKey(part.name())) {
                keys.add(part.name());
            }
        }
        List<String> extensions = new ArrayList<>();
        for (String key : parts.keySet()) {
            if (RecurPart.lookup(key).isEmpty()) {
                extensions.add(key);
            }
        }
        Collections.sort(extensions);
        keys.addAll(extensions);
        return keys;
    }

    // ------------------------------------------------------------------------
    // Typed accessors
    // ------------------------------------------------------------------------

    public Optional<Frequency> frequency() {
        List<PropertyValue> values = get(RecurPart.FREQ.name());
        return values.isEmpty() ? Optional.empty() : Optional.of(((FrequencyValue) values.get(0)).frequency());
    }

    public Optional<TemporalValue> until() {
        List<PropertyValue> values = get(RecurPart.UNTIL.name());
        return values.isEmpty() ? Optional.empty() : Optional.of((TemporalValue) values.get(0));
    }

    public OptionalInt count() {
        return firstInt(RecurPart.COUNT);
    }

    public OptionalInt interval() {
        return firstInt(RecurPart.INTERVAL);
    }

    public List<Integer> bySecond() {
        return ints(RecurPart.BYSECOND);
    }

    public List<Integer> byMinute() {
        return ints(RecurPart.BYMINUTE);
    }

    public List<Integer> byHour() {
        return ints(RecurPart.BYHOUR);
    }

    public List<WeekdayValue> byDay() {
        List<WeekdayValue> out = new ArrayList<>();
        for (PropertyValue v : get(RecurPart.BYDAY.name())) {
            out.add((WeekdayValue) v);
        }
        return Collections.unmodifiableList(out);
    }

    public List<Integer> byMonthDay() {
        return ints(RecurPart.BYMONTHDAY);
    }

    public List<Integer> byYearDay() {
        return ints(RecurPart.BYYEARDAY);
    }

    public List<Integer> byWeekNo() {
        return ints(RecurPart.BYWEEKNO);
    }

    public List<Integer> byMonth() {
        return ints(RecurPart.BYMONTH);
    }

    public List<Integer> bySetPos() {
        return ints(RecurPart.BYSETPOS);
    }

    public Optional<Weekday> weekStart() {
        List<PropertyValue> values = get(RecurPart.WKST.name());
        return values.isEmpty() ? Optional.empty() : Optional.of(((WeekdayValue) values.get(0)).weekday());
    }

    private OptionalInt firstInt(RecurPart part) {
        List<PropertyValue> values = get(part.name());
        return values.isEmpty() ? OptionalInt.empty() : OptionalInt.of(((IntegerValue) values.get(0)).value());
    }

    private List<Integer> ints(RecurPart part) {
        List<Integer> out = new ArrayList<>();
        for (PropertyValue v : get(part.name())) {
            out.add(((IntegerValue) v).value());
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String typeName() {
        return "RECUR";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecurValue that)) return false;
        return parts.equals(that.parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return "RecurValue" + parts;
    }

    /**
     * Collects rule parts and validates each part's value variant.
     */
    public static final class Builder
    {
        private final Map<String, List<PropertyValue>> parts = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Sets the values of a rule part, replacing any earlier values.
         *
         * @throws InvalidValueException if the list is empty or holds a variant
         *         the part does not accept
         */
        public Builder part(String key, List<? extends PropertyValue> values) {
            Objects.requireNonNull(values, "values");
            String name = CaselessMap.normalize(key);
            if (name.isBlank()) {
                throw new InvalidValueException(key, "RECUR", "rule part name must not be blank");
            }
            if (values.isEmpty()) {
                throw new InvalidValueException(name, "RECUR", "rule part " + name + " has no values");
            }
            Class<? extends PropertyValue> expected =
                    RecurPart.lookup(name).<Class<? extends PropertyValue>>map(RecurPart::valueClass)
                            .orElse(TextValue.class);
            for (PropertyValue v : values) {
                if (!expected.isInstance(v)) {
                    throw new InvalidValueException(String.valueOf(v), "RECUR",
                            "rule part " + name + " does not accept " + (v == null ? "null" : v.typeName()));
                }
            }
            parts.put(name, List.copyOf(values));
            return this;
        }

        public boolean has(String key) {
            return parts.containsKey(CaselessMap.normalize(key));
        }

        public Builder frequency(Frequency frequency) {
            return part(RecurPart.FREQ.name(), List.of(new FrequencyValue(frequency)));
        }

        public Builder until(TemporalValue until) {
            return part(RecurPart.UNTIL.name(), List.of(until));
        }

        public Builder count(int count) {
            return part(RecurPart.COUNT.name(), List.of(new IntegerValue(count)));
        }

        public Builder interval(int interval) {
            return part(RecurPart.INTERVAL.name(), List.of(new IntegerValue(interval)));
        }

        public Builder bySecond(int... seconds) {
            return ints(RecurPart.BYSECOND, seconds);
        }

        public Builder byMinute(int... minutes) {
            return ints(RecurPart.BYMINUTE, minutes);
        }

        public Builder byHour(int... hours) {
            return ints(RecurPart.BYHOUR, hours);
        }

        public Builder byDay(WeekdayValue... days) {
            return part(RecurPart.BYDAY.name(), Arrays.asList(days));
        }

        public Builder byMonthDay(int... days) {
            return ints(RecurPart.BYMONTHDAY, days);
        }

        public Builder byYearDay(int... days) {
            return ints(RecurPart.BYYEARDAY, days);
        }

        public Builder byWeekNo(int... weeks) {
            return ints(RecurPart.BYWEEKNO, weeks);
        }

        public Builder byMonth(int... months) {
            return ints(RecurPart.BYMONTH, months);
        }

        public Builder bySetPos(int... positions) {
            return ints(RecurPart.BYSETPOS, positions);
        }

        public Builder weekStart(Weekday weekday) {
            return part(RecurPart.WKST.name(), List.of(WeekdayValue.of(weekday)));
        }

        private Builder ints(RecurPart part, int... values) {
            List<IntegerValue> list = new ArrayList<>(values.length);
            for (int v : values) {
                list.add(new IntegerValue(v));
            }
            return part(part.name(), list);
        }

        public RecurValue build() {
            return new RecurValue(new LinkedHashMap<>(parts));
        }
    }
}
