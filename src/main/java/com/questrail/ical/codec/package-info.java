/**
 * iCalendar Value Codecs
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for RFC 5545
 * property values. The codec layer implements the value grammars of
 * RFC 5545 section 3.3, including:</p>
 *
 * <ul>
 *   <li>Fixed-width date and time fields with UTC detection</li>
 *   <li>Signed durations and UTC offsets</li>
 *   <li>Composite values (periods, date lists)</li>
 *   <li>The structured {@code RECUR} grammar and its canonical part order</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> component assembly and
 * <strong>above</strong> content-line tokenizing:</p>
 *
 * <pre>
 *   content line
 *        → tokenizer              (name, parameters, value text)
 *            → ValueTypeRegistry  (name → value type)
 *                → ValueCodec     (value grammar applied here)
 *                    → PropertyValue
 * </pre>
 *
 * <h2>Round-trip law</h2>
 * <p>For every codec and every valid value {@code v}:
 * {@code decode(encode(v)).equals(v)}, with parameters excluded from the
 * comparison. Zoned non-UTC values round-trip when the caller passes the
 * value's {@code TZID} back to {@code decode}.</p>
 */
package com.questrail.ical.codec;
