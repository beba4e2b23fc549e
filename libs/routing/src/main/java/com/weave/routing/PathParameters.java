package com.weave.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Typed values extracted from a request path by a {@link PathTemplate}.
 * <p>
 * Values are already converted to the type declared in the template, so the typed getters only
 * cast. Asking for a parameter under the wrong type is a programming error in the route table.
 */
public final class PathParameters {

    private final Map<String, Object> values;

    PathParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int getInt(String name) {
        return get(name, Integer.class);
    }

    public long getLong(String name) {
        return get(name, Long.class);
    }

    public double getDouble(String name) {
        return get(name, Double.class);
    }

    public boolean getBool(String name) {
        return get(name, Boolean.class);
    }

    public String getString(String name) {
        return get(name, String.class);
    }

    public UUID getUuid(String name) {
        return get(name, UUID.class);
    }

    /**
     * @throws NoSuchElementException if the template declares no such parameter
     * @throws ClassCastException     if the parameter has another type
     */
    public <T> T get(String name, Class<T> type) {
        Object value = values.get(name);
        if (value == null) {
            throw new NoSuchElementException("No path parameter named '" + name + "'");
        }
        return type.cast(value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "PathParameters" + values;
    }
}
