package com.vidyarthi.node.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent string-keyed store shared by the key vault and the consent ledger.
 * Mirrors the platform preference store of the host app: each key holds one typed value.
 *
 * Implementations are crash-consistent per key but not transactional across keys,
 * so callers order their writes (key before timestamp, marker before wipe).
 * Every operation may throw {@link StoreException} when the backing medium is unavailable.
 */
public interface KeyValueStore {

    Optional<String> getString(String key);

    Optional<Boolean> getBoolean(String key);

    Optional<Long> getLong(String key);

    Optional<Double> getDouble(String key);

    Optional<List<String>> getStringList(String key);

    /**
     * Raw value of any supported type, for export.
     *
     * @return the stored value, or empty if absent
     */
    Optional<Object> get(String key);

    void setString(String key, String value);

    void setBoolean(String key, boolean value);

    void setLong(String key, long value);

    void setDouble(String key, double value);

    void setStringList(String key, List<String> value);

    boolean contains(String key);

    void remove(String key);

    /**
     * Removes every key, reserved ones included.
     */
    void clear();

    Set<String> keys();

    /**
     * Thrown when the backing medium cannot be read or written.
     */
    class StoreException extends RuntimeException {
        public StoreException(String message) {
            super(message);
        }

        public StoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
