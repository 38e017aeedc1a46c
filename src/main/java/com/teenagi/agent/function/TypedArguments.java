package com.teenagi.agent.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments after validation. Every declared parameter is either present with a
 * value of its declared type, or absent because it is optional with no default.
 */
public final class TypedArguments {

    private static final TypedArguments EMPTY = new TypedArguments(Map.of());

    private final Map<String, Object> values;

    TypedArguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static TypedArguments empty() {
        return EMPTY;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        return (String) values.get(name);
    }

    public Long getLong(String name) {
        Number value = (Number) values.get(name);
        return value == null ? null : value.longValue();
    }

    public Double getDouble(String name) {
        Number value = (Number) values.get(name);
        return value == null ? null : value.doubleValue();
    }

    public Boolean getBoolean(String name) {
        return (Boolean) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String name) {
        return (Map<String, Object>) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String name) {
        return (List<Object>) values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
