package com.questrail.ical.registry;

import com.questrail.ical.api.CaselessMap;
import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.codec.ValueCodec;
import com.questrail.ical.codec.impl.IcalText;
import com.questrail.ical.model.PropertyValue;
import com.questrail.ical.model.Timezones;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * ValueTypeRegistry
 * ============================================================================
 * Maps property and parameter names to their default value type and codec.
 *
 * <h2>Architectural Role</h2>
 * Callers that only know a property's name (the usual case when parsing a
 * content line) encode and decode through this registry instead of choosing a
 * codec themselves. Property and parameter names do not overlap in RFC 5545,
 * so one table serves both.
 *
 * <h2>Lookup</h2>
 * <ul>
 *   <li>names are case-insensitive</li>
 *   <li>configured overrides win over the built-in table</li>
 *   <li>unlisted names map to the configured default type ({@code text})</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * The table is populated in the constructor and never mutated afterwards; a
 * registry may be shared freely between threads.
 */
public final class ValueTypeRegistry
{
    private static final Logger log = LoggerFactory.getLogger(ValueTypeRegistry.class);

    private static final ValueTypeRegistry DEFAULTS = new ValueTypeRegistry(RegistryConfig.defaults());

    private final CaselessMap<ValueType> types = new CaselessMap<>();
    private final RegistryConfig config;

    public ValueTypeRegistry(RegistryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        registerDefaults(types);
        config.typeOverrides().forEach(types::put);
    }

    /**
     * @return the shared registry built from {@link RegistryConfig#defaults()}
     */
    public static ValueTypeRegistry defaults() {
        return DEFAULTS;
    }

    public RegistryConfig config() {
        return config;
    }

    /**
     * Returns the value type registered for a property or parameter name.
     */
    public ValueType typeFor(String name) {
        ValueType type = types.get(name);
        if (type == null) {
            log.debug("No value type registered for '{}', using {}", name, config.defaultType().key());
            return config.defaultType();
        }
        return type;
    }

    public ValueCodec<? extends PropertyValue> codecFor(String name) {
        return typeFor(name).codec();
    }

    /**
     * Encodes a value for the named property.
     *
     * @throws InvalidValueException if the value's variant is not handled by
     *         the property's codec
     */
    public String encode(String name, PropertyValue value) {
        Objects.requireNonNull(value, "value");
        return codecFor(name).encodeValue(value);
    }

    public PropertyValue decode(String name, String text) {
        return decode(name, text, null);
    }

    /**
     * Decodes a value for the named property.
     *
     * @param tzid the property's {@code TZID} parameter, if any
     * @throws InvalidValueException if the text does not match the property's
     *         value grammar, or (strict mode) the timezone is unknown
     */
    public PropertyValue decode(String name, String text, @Nullable String tzid) {
        Objects.requireNonNull(text, "text");
        if (tzid != null && config.strictTimezones() && Timezones.resolve(tzid).isEmpty()) {
            throw new InvalidValueException(tzid, "TZID", "unknown timezone identifier");
        }
        return codecFor(name).decode(text, tzid);
    }

    /**
     * Decodes raw bytes for the named property, converting them to text
     * tolerantly first.
     *
     * @param charset declared charset of the bytes, or {@code null} for the
     *                configured fallback
     */
    public PropertyValue decode(String name, byte[] raw, @Nullable Charset charset, @Nullable String tzid) {
        return decode(name, IcalText.normalize(raw, charset, config.fallbackCharset()), tzid);
    }

    private static void registerDefaults(CaselessMap<ValueType> t) {
        // Calendar properties
        t.put("calscale", ValueType.TEXT);
        t.put("method", ValueType.TEXT);
        t.put("prodid", ValueType.TEXT);
        t.put("version", ValueType.TEXT);
        // Descriptive component properties
        t.put("attach", ValueType.URI);
        t.put("categories", ValueType.TEXT);
        t.put("class", ValueType.TEXT);
        t.put("comment", ValueType.TEXT);
        t.put("description", ValueType.TEXT);
        t.put("geo", ValueType.GEO);
        t.put("location", ValueType.TEXT);
        t.put("percent-complete", ValueType.INTEGER);
        t.put("priority", ValueType.INTEGER);
        t.put("resources", ValueType.TEXT);
        t.put("status", ValueType.TEXT);
        t.put("summary", ValueType.TEXT);
        // Date and time component properties
        t.put("completed", ValueType.DATE_TIME);
        t.put("dtend", ValueType.DATE_TIME);
        t.put("due", ValueType.DATE_TIME);
        t.put("dtstart", ValueType.DATE_TIME);
        t.put("duration", ValueType.DURATION);
        t.put("freebusy", ValueType.PERIOD);
        t.put("transp", ValueType.TEXT);
        // Time zone component properties
        t.put("tzid", ValueType.TEXT);
        t.put("tzname", ValueType.TEXT);
        t.put("tzoffsetfrom", ValueType.UTC_OFFSET);
        t.put("tzoffsetto", ValueType.UTC_OFFSET);
        t.put("tzurl", ValueType.URI);
        // Relationship component properties
        t.put("attendee", ValueType.CAL_ADDRESS);
        t.put("contact", ValueType.TEXT);
        t.put("organizer", ValueType.CAL_ADDRESS);
        t.put("recurrence-id", ValueType.DATE_TIME);
        t.put("related-to", ValueType.TEXT);
        t.put("url", ValueType.URI);
        t.put("uid", ValueType.TEXT);
        // Recurrence component properties
        t.put("exdate", ValueType.DATE_TIME_LIST);
        t.put("exrule", ValueType.RECUR);
        t.put("rdate", ValueType.DATE_TIME_LIST);
        t.put("rrule", ValueType.RECUR);
        // Alarm component properties
        t.put("action", ValueType.TEXT);
        t.put("repeat", ValueType.INTEGER);
        t.put("trigger", ValueType.DURATION);
        // Change management component properties
        t.put("created", ValueType.DATE_TIME);
        t.put("dtstamp", ValueType.DATE_TIME);
        t.put("last-modified", ValueType.DATE_TIME);
        t.put("sequence", ValueType.INTEGER);
        // Miscellaneous component properties
        t.put("request-status", ValueType.TEXT);

        // Parameters
        t.put("altrep", ValueType.URI);
        t.put("cn", ValueType.TEXT);
        t.put("cutype", ValueType.TEXT);
        t.put("delegated-from", ValueType.CAL_ADDRESS);
        t.put("delegated-to", ValueType.CAL_ADDRESS);
        t.put("dir", ValueType.URI);
        t.put("encoding", ValueType.TEXT);
        t.put("fmttype", ValueType.TEXT);
        t.put("fbtype", ValueType.TEXT);
        t.put("language", ValueType.TEXT);
        t.put("member", ValueType.CAL_ADDRESS);
        t.put("partstat", ValueType.TEXT);
        t.put("range", ValueType.TEXT);
        t.put("related", ValueType.TEXT);
        t.put("reltype", ValueType.TEXT);
        t.put("role", ValueType.TEXT);
        t.put("rsvp", ValueType.BOOLEAN);
        t.put("sent-by", ValueType.CAL_ADDRESS);
        t.put("value", ValueType.TEXT);
    }
}
