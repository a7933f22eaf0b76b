package com.botwire.dispatch;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-update scratch space shared by the middlewares and handlers of one dispatch.
 * A new context is created for every update; it is never shared across updates.
 */
public class DispatchContext {

    private final Map<String, Object> values = new HashMap<>();

    public void put(String key, Object value) {
        values.put(key, value);
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * @return the value cast to {@code type}, or null when absent or of another type
     */
    public <T> T get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object remove(String key) {
        return values.remove(key);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "DispatchContext" + values.keySet();
    }
}
