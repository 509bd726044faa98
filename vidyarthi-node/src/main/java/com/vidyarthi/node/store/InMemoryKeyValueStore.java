package com.vidyarthi.node.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of KeyValueStore for testing and development.
 * Production hosts plug in the platform preference store or {@link JsonFileKeyValueStore}.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, Object> values;

    public InMemoryKeyValueStore() {
        this.values = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<String> getString(String key) {
        return typed(key, String.class);
    }

    @Override
    public Optional<Boolean> getBoolean(String key) {
        return typed(key, Boolean.class);
    }

    @Override
    public Optional<Long> getLong(String key) {
        return typed(key, Long.class);
    }

    @Override
    public Optional<Double> getDouble(String key) {
        return typed(key, Double.class);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<List<String>> getStringList(String key) {
        Object value = values.get(requireKey(key));
        return value instanceof List<?> ? Optional.of((List<String>) value) : Optional.empty();
    }

    @Override
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(requireKey(key)));
    }

    @Override
    public void setString(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        values.put(requireKey(key), value);
    }

    @Override
    public void setBoolean(String key, boolean value) {
        values.put(requireKey(key), value);
    }

    @Override
    public void setLong(String key, long value) {
        values.put(requireKey(key), value);
    }

    @Override
    public void setDouble(String key, double value) {
        values.put(requireKey(key), value);
    }

    @Override
    public void setStringList(String key, List<String> value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        values.put(requireKey(key), List.copyOf(value));
    }

    @Override
    public boolean contains(String key) {
        return values.containsKey(requireKey(key));
    }

    @Override
    public void remove(String key) {
        values.remove(requireKey(key));
    }

    @Override
    public void clear() {
        values.clear();
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(values.keySet());
    }

    /**
     * Gets the number of stored keys (for testing).
     */
    public int size() {
        return values.size();
    }

    private <T> Optional<T> typed(String key, Class<T> type) {
        Object value = values.get(requireKey(key));
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or blank");
        }
        return key;
    }
}
