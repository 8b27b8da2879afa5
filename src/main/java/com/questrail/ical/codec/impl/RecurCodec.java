package com.questrail.ical.codec.impl;

import com.questrail.ical.api.CaselessMap;
import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.model.PropertyValue;
import com.questrail.ical.model.RecurPart;
import com.questrail.ical.model.RecurValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * RecurCodec
 * -----------------------------------------------------------------------------
 * RECUR: {@code KEY=VALUE[,VALUE...][;KEY=VALUE...]}.
 *
 * <h2>Decode</h2>
 * <p>Each part's values are decoded with the codec bound to the part name:</p>
 * <ul>
 *   <li>{@code FREQ} → frequency literal</li>
 *   <li>{@code UNTIL} → temporal dispatcher</li>
 *   <li>{@code BYDAY}, {@code WKST} → weekday selector</li>
 *   <li>the remaining RFC parts → INTEGER</li>
 *   <li>anything else (extension parts) → TEXT</li>
 * </ul>
 * <p>A malformed part, a repeated part or a failing value rejects the whole
 * rule.</p>
 *
 * <h2>Encode</h2>
 * <p>Parts are written in the canonical order of {@link RecurPart}, followed
 * by extension parts in name order, regardless of insertion order.</p>
 */
public final class RecurCodec implements ValueCodec<RecurValue>
{
    private final FrequencyCodec frequencyCodec = new FrequencyCodec();
    private final TemporalCodec temporalCodec = new TemporalCodec();
    private final WeekdayCodec weekdayCodec = new WeekdayCodec();
    private final IntegerCodec integerCodec = new IntegerCodec();
    private final TextCodec textCodec = new TextCodec();

    @Override
    public String typeName() {
        return "RECUR";
    }

    @Override
    public Class<RecurValue> valueClass() {
        return RecurValue.class;
    }

    @Override
    public String encode(RecurValue value) {
        StringJoiner rule = new StringJoiner(";");
        for (String key : value.canonicalKeys()) {
            ValueCodec<? extends PropertyValue> codec = codecFor(key);
            StringJoiner values = new StringJoiner(",");
            for (PropertyValue v : value.get(key)) {
                values.add(codec.encodeValue(v));
            }
            rule.add(key + "=" + values);
        }
        return rule.toString();
    }

    @Override
    public RecurValue decode(String text) {
        Objects.requireNonNull(text, "text");
        RecurValue.Builder builder = RecurValue.builder();

        for (String pair : text.split(";", -1)) {
            String[] kv = pair.split("=", -1);
            if (kv.length != 2 || kv[0].isBlank() || kv[1].isEmpty()) {
                throw new InvalidValueException(text, typeName(), "malformed rule part '" + pair + "'");
            }

            String key = CaselessMap.normalize(kv[0].trim());
            if (builder.has(key)) {
                throw new InvalidValueException(text, typeName(), "rule part " + key + " appears more than once");
            }

            ValueCodec<? extends PropertyValue> codec = codecFor(key);
            List<PropertyValue> values = new ArrayList<>();
            try {
                for (String token : kv[1].split(",", -1)) {
                    values.add(codec.decode(token));
                }
            } catch (InvalidValueException e) {
                throw new InvalidValueException(text, typeName(),
                        "rule part " + key + ": " + e.getMessage(), e);
            }
            builder.part(key, values);
        }
        return builder.build();
    }

    /**
     * Returns the codec bound to a rule-part name (case-insensitive).
     */
    public ValueCodec<? extends PropertyValue> codecFor(String key) {
        return RecurPart.lookup(key)
                .<ValueCodec<? extends PropertyValue>>map(this::codecForPart)
                .orElse(textCodec);
    }

    private ValueCodec<? extends PropertyValue> codecForPart(RecurPart part) {
        return switch (part) {
            case FREQ -> frequencyCodec;
            case UNTIL -> temporalCodec;
            case BYDAY, WKST -> weekdayCodec;
            case COUNT, INTERVAL, BYSECOND, BYMINUTE, BYHOUR, BYMONTHDAY,
                 BYYEARDAY, BYWEEKNO, BYMONTH, BYSETPOS -> integerCodec;
        };
    }
}
