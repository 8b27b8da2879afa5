package com.questrail.ical.api;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * CaselessMap
 * -----------------------------------------------------------------------------
 * An insertion-ordered map whose keys are compared without regard to case.
 *
 * <p>Keys are normalized to upper case for lookup. The normalized form is
 * also the form returned by {@link #keys()}, so serialization sees the
 * canonical RFC 5545 spelling (e.g. {@code TZID}).</p>
 *
 * <ul>
 *   <li>Insertion order is retained for deterministic iteration</li>
 *   <li>Re-putting an existing key replaces the value in place</li>
 *   <li>{@link #equals(Object)} ignores order</li>
 * </ul>
 *
 * <p>Instances are not thread-safe. Shared lookup tables built from this
 * type must be fully populated before publication and never mutated
 * afterwards.</p>
 *
 * @param <V> value type
 */
public class CaselessMap<V>
{
    private final Map<String, V> entries = new HashMap<>();
    private final List<String> order = new ArrayList<>();

    public CaselessMap() {
    }

    public CaselessMap(CaselessMap<? extends V> other) {
        Objects.requireNonNull(other, "other");
        other.forEach(this::put);
    }

    /**
     * Normalizes a key to its canonical (upper-case, locale-independent) form.
     */
    public static String normalize(String key) {
        return Objects.requireNonNull(key, "key").toUpperCase(Locale.ROOT);
    }

    public @Nullable V get(String key) {
        return entries.get(normalize(key));
    }

    /**
     * Associates {@code value} with {@code key}.
     *
     * @return the previous value, or {@code null}
     */
    public @Nullable V put(String key, V value) {
        Objects.requireNonNull(value, "value");
        String k = normalize(key);
        V previous = entries.put(k, value);
        if (previous == null) {
            order.add(k);
        }
        return previous;
    }

    public @Nullable V remove(String key) {
        String k = normalize(key);
        V previous = entries.remove(k);
        if (previous != null) {
            order.remove(k);
        }
        return previous;
    }

    public boolean containsKey(String key) {
        return entries.containsKey(normalize(key));
    }

    public int size() {
        return order.size();
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    /**
     * @return normalized keys in insertion order (read-only view)
     */
    public List<String> keys() {
        return Collections.unmodifiableList(order);
    }

    public void forEach(BiConsumer<String, ? super V> action) {
        for (String k : order) {
            action.accept(k, entries.get(k));
        }
    }

    /**
     * @return an insertion-ordered copy keyed by normalized names
     */
    public Map<String, V> toMap() {
        Map<String, V> copy = new LinkedHashMap<>();
        forEach(copy::put);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaselessMap<?> that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
