package com.questrail.ical.api;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Indicates that a property value could not be decoded, encoded or
 * constructed.
 *
 * <p>This is the single failure kind of the value-type layer. It always
 * names:</p>
 * <ul>
 *   <li>the offending raw text (or the rendered native value when a
 *       construction invariant was violated)</li>
 *   <li>the value type that was attempted (e.g. {@code DATE-TIME})</li>
 *   <li>where available, the specific constraint that was violated</li>
 * </ul>
 *
 * <p>Decoders never substitute defaults; a value either fully decodes or
 * this exception is thrown.</p>
 */
public final class InvalidValueException extends RuntimeException
{
    private final String rawText;
    private final String typeName;
    private final @Nullable String reason;

    public InvalidValueException(String rawText, String typeName, @Nullable String reason) {
        super(format(rawText, typeName, reason));
        this.rawText = Objects.requireNonNull(rawText, "rawText");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.reason = reason;
    }

    public InvalidValueException(String rawText, String typeName, @Nullable String reason, Throwable cause) {
        super(format(rawText, typeName, reason), cause);
        this.rawText = Objects.requireNonNull(rawText, "rawText");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.reason = reason;
    }

    /**
     * @return the text (or rendered native value) that was rejected
     */
    public String rawText() {
        return rawText;
    }

    /**
     * @return the RFC 5545 name of the attempted value type
     */
    public String typeName() {
        return typeName;
    }

    /**
     * @return the violated constraint, or {@code null} when none was recorded
     */
    public @Nullable String reason() {
        return reason;
    }

    private static String format(String rawText, String typeName, @Nullable String reason) {
        String base = "Invalid " + typeName + " value '" + rawText + "'";
        return reason == null ? base : base + ": " + reason;
    }
}
