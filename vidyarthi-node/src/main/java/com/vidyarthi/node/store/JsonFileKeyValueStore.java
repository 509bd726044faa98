package com.vidyarthi.node.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * File-backed KeyValueStore holding all entries in a single JSON document.
 *
 * Every mutation rewrites the document through a temporary sibling file that is then
 * moved over the original, so a crash leaves either the old or the new document.
 */
public class JsonFileKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileKeyValueStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> values;

    /**
     * Opens the store, loading the document if it exists.
     *
     * @param file location of the JSON document
     * @throws StoreException if an existing document cannot be read
     */
    public JsonFileKeyValueStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        this.file = file;
        this.objectMapper = new ObjectMapper();
        this.values = new LinkedHashMap<>();
        load();
    }

    @Override
    public synchronized Optional<String> getString(String key) {
        Object value = values.get(InMemoryKeyValueStore.requireKey(key));
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    @Override
    public synchronized Optional<Boolean> getBoolean(String key) {
        Object value = values.get(InMemoryKeyValueStore.requireKey(key));
        return value instanceof Boolean b ? Optional.of(b) : Optional.empty();
    }

    @Override
    public synchronized Optional<Long> getLong(String key) {
        Object value = values.get(InMemoryKeyValueStore.requireKey(key));
        return value instanceof Long l ? Optional.of(l) : Optional.empty();
    }

    @Override
    public synchronized Optional<Double> getDouble(String key) {
        Object value = values.get(InMemoryKeyValueStore.requireKey(key));
        return value instanceof Double d ? Optional.of(d) : Optional.empty();
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized Optional<List<String>> getStringList(String key) {
        Object value = values.get(InMemoryKeyValueStore.requireKey(key));
        return value instanceof List<?> ? Optional.of(List.copyOf((List<String>) value)) : Optional.empty();
    }

    @Override
    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(InMemoryKeyValueStore.requireKey(key)));
    }

    @Override
    public void setString(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        put(key, value);
    }

    @Override
    public void setBoolean(String key, boolean value) {
        put(key, value);
    }

    @Override
    public void setLong(String key, long value) {
        put(key, value);
    }

    @Override
    public void setDouble(String key, double value) {
        put(key, value);
    }

    @Override
    public void setStringList(String key, List<String> value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        put(key, List.copyOf(value));
    }

    @Override
    public synchronized boolean contains(String key) {
        return values.containsKey(InMemoryKeyValueStore.requireKey(key));
    }

    @Override
    public synchronized void remove(String key) {
        Object previous = values.remove(InMemoryKeyValueStore.requireKey(key));
        if (previous != null) {
            try {
                flush();
            } catch (StoreException e) {
                values.put(key, previous);
                throw e;
            }
        }
    }

    @Override
    public synchronized void clear() {
        Map<String, Object> snapshot = new LinkedHashMap<>(values);
        values.clear();
        try {
            flush();
        } catch (StoreException e) {
            values.putAll(snapshot);
            throw e;
        }
    }

    @Override
    public synchronized Set<String> keys() {
        return Set.copyOf(values.keySet());
    }

    public Path file() {
        return file;
    }

    // ==================== Private Methods ====================

    private synchronized void put(String key, Object value) {
        Object previous = values.put(InMemoryKeyValueStore.requireKey(key), value);
        try {
            flush();
        } catch (StoreException e) {
            if (previous == null) {
                values.remove(key);
            } else {
                values.put(key, previous);
            }
            throw e;
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, Object> document = objectMapper.readValue(file.toFile(), DOCUMENT_TYPE);
            for (Map.Entry<String, Object> entry : document.entrySet()) {
                values.put(entry.getKey(), normalize(entry.getValue()));
            }
            log.debug("Loaded {} entries from {}", values.size(), file);
        } catch (IOException e) {
            throw new StoreException("Failed to read store document " + file, e);
        }
    }

    private void flush() {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(temp.toFile(), values);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to write store document " + file, e);
        }
    }

    // JSON has no long/int distinction; widen integral numbers so getLong works after reload
    private static Object normalize(Object value) {
        if (value instanceof Integer i) {
            return i.longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof List<?> list) {
            List<String> strings = new ArrayList<>(list.size());
            for (Object item : list) {
                strings.add(String.valueOf(item));
            }
            return List.copyOf(strings);
        }
        return value;
    }
}
