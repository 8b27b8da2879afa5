package com.questrail.ical.codec;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.model.PropertyValue;
import org.jspecify.annotations.Nullable;

/**
 * ValueCodec
 * -----------------------------------------------------------------------------
 * Text-level codec for one RFC 5545 value type.
 *
 * <p>This interface defines the boundary between the textual right-hand side
 * of a {@code NAME;PARAM=...:VALUE} line and a typed {@link PropertyValue}.</p>
 *
 * <p>A codec is responsible only for:</p>
 * <ul>
 *   <li>Validating the value grammar of its type</li>
 *   <li>Constructing the typed value on success</li>
 *   <li>Producing canonical text for a typed value</li>
 * </ul>
 *
 * <p>A codec is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Line folding or unfolding</li>
 *   <li>Splitting names, parameters and values</li>
 *   <li>Cross-property or cross-component validation</li>
 * </ul>
 *
 * <p>Codecs are stateless and may be shared freely between threads.</p>
 *
 * @param <V> the value variant this codec produces and consumes
 */
public interface ValueCodec<V extends PropertyValue>
{
    /**
     * @return the RFC 5545 value-type name handled by this codec
     */
    String typeName();

    /**
     * @return the value variant this codec accepts on encode
     */
    Class<V> valueClass();

    /**
     * Encodes a typed value as property-value text. Only the TEXT codec
     * escapes; the returned text is never escaped twice.
     */
    String encode(V value);

    /**
     * Decodes property-value text.
     *
     * @param text raw value text, already unfolded
     * @return the decoded value
     * @throws InvalidValueException if the text does not match the value grammar
     */
    V decode(String text);

    /**
     * Decodes property-value text using a caller-supplied timezone identifier,
     * normally the value of the property's {@code TZID} parameter.
     * Codecs without timezone semantics ignore the hint.
     *
     * @throws InvalidValueException if the text does not match the value grammar
     */
    default V decode(String text, @Nullable String tzid) {
        return decode(text);
    }

    /**
     * Encodes a value whose static type is only known to be a
     * {@link PropertyValue}.
     *
     * @throws InvalidValueException if the value is not of this codec's variant
     */
    default String encodeValue(PropertyValue value) {
        if (!valueClass().isInstance(value)) {
            throw new InvalidValueException(String.valueOf(value), typeName(),
                    "cannot encode " + (value == null ? "null" : value.typeName()) + " as " + typeName());
        }
        return encode(valueClass().cast(value));
    }
}
