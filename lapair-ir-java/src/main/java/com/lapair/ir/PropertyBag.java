package com.lapair.ir;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * String-keyed attribute store attached to a node or an edge.
 *
 * {@link #get(String)} keeps the empty-string sentinel for absent keys; use
 * {@link #find(String)} when "never set" must be told apart from "set to empty".
 */
public final class PropertyBag {

    private final Map<String, String> values = new HashMap<>();

    public void set(String key, String value) {
        values.put(key, value);
    }

    /** Returns the value for {@code key}, or {@code ""} when the key was never set. */
    public String get(String key) {
        String value = values.get(key);
        return value != null ? value : "";
    }

    public Optional<String> find(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
