package com.vidyarthi.node.key;

import com.vidyarthi.node.common.Outcome;
import com.vidyarthi.node.store.KeyValueStore;
import com.vidyarthi.node.store.KeyValueStore.StoreException;
import com.vidyarthi.node.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Key Vault for the single on-device obfuscation secret.
 * Manages creation, caching, the rotation schedule and secure erasure of the key.
 *
 * Exactly one active secret exists per installation. Rotation replaces it outright,
 * which leaves every ciphertext produced under the previous secret unreadable;
 * callers re-encode whatever they still need.
 *
 * Store failures never escape: creation and rotation degrade to a logged no-op, and
 * {@link #currentKey()} falls back to a throwaway in-memory key.
 */
public class KeyVault {

    private static final Logger log = LoggerFactory.getLogger(KeyVault.class);

    private final KeyValueStore store;
    private final KeyRotationPolicy rotationPolicy;
    private final SecretGenerator secretGenerator;
    private final Clock clock;

    private String cachedKey;

    public KeyVault(KeyValueStore store, KeyRotationPolicy rotationPolicy, SecretGenerator secretGenerator, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        this.store = store;
        this.rotationPolicy = rotationPolicy != null ? rotationPolicy : KeyRotationPolicy.defaults();
        this.secretGenerator = secretGenerator != null ? secretGenerator : new SecretGenerator();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public KeyVault(KeyValueStore store) {
        this(store, KeyRotationPolicy.defaults(), new SecretGenerator(), Clock.systemUTC());
    }

    /**
     * Creates and persists a secret if the store holds none. Idempotent.
     *
     * @return {@code Ok} when a key exists afterwards, {@code Failed} if the store is unavailable
     */
    public synchronized Outcome<Void> ensureKey() {
        try {
            Optional<String> stored = store.getString(StoreKeys.ENCRYPTION_KEY).filter(k -> !k.isEmpty());
            if (stored.isPresent()) {
                cachedKey = stored.get();
                return Outcome.done();
            }
            // keep a throwaway key that is already in use instead of minting another
            String key = cachedKey != null ? cachedKey : secretGenerator.generate(rotationPolicy.keyLength());
            persist(key);
            log.info("Encryption key created");
            return Outcome.done();
        } catch (StoreException e) {
            log.warn("Could not ensure encryption key: {}", e.getMessage());
            return Outcome.failed("Key store unavailable", e);
        }
    }

    /**
     * Gets the active secret. Never empty.
     *
     * @return the cached key, else the stored key, else a newly persisted one;
     *         a throwaway in-memory key if the store cannot be used
     */
    public synchronized String currentKey() {
        if (cachedKey != null) {
            return cachedKey;
        }
        try {
            Optional<String> stored = store.getString(StoreKeys.ENCRYPTION_KEY).filter(k -> !k.isEmpty());
            if (stored.isPresent()) {
                cachedKey = stored.get();
                return cachedKey;
            }
            String key = secretGenerator.generate(rotationPolicy.keyLength());
            persist(key);
            log.info("Encryption key created on first use");
            return key;
        } catch (StoreException e) {
            log.warn("Key store unavailable, using a throwaway in-memory key: {}", e.getMessage());
            cachedKey = secretGenerator.generate(rotationPolicy.keyLength());
            return cachedKey;
        }
    }

    /**
     * Checks whether the secret is due for rotation.
     *
     * @return true if no creation timestamp is stored, it cannot be parsed, or the
     *         rotation interval has elapsed; false if the store cannot be read
     */
    public boolean needsRotation() {
        Optional<String> createdAtText;
        try {
            createdAtText = store.getString(StoreKeys.ENCRYPTION_KEY_CREATED_AT);
        } catch (StoreException e) {
            log.warn("Could not read key creation time: {}", e.getMessage());
            return false;
        }
        if (createdAtText.isEmpty()) {
            return true;
        }
        try {
            Instant createdAt = Instant.parse(createdAtText.get());
            Duration age = Duration.between(createdAt, clock.instant());
            return age.compareTo(rotationPolicy.rotationInterval()) >= 0;
        } catch (DateTimeParseException e) {
            log.warn("Unparsable key creation time, scheduling rotation");
            return true;
        }
    }

    /**
     * Replaces the secret with a fresh one. All earlier ciphertexts become undecodable.
     *
     * @return {@code Ok} once the new key is persisted, {@code Failed} if the store is unavailable
     */
    public synchronized Outcome<Void> rotate() {
        String key = secretGenerator.generate(rotationPolicy.keyLength());
        try {
            persist(key);
            log.info("Encryption key rotated");
            return Outcome.done();
        } catch (StoreException e) {
            log.warn("Key rotation failed: {}", e.getMessage());
            return Outcome.failed("Key store unavailable", e);
        }
    }

    /**
     * Removes the secret and its timestamp and clears the cache.
     */
    public synchronized Outcome<Void> wipe() {
        cachedKey = null;
        try {
            store.remove(StoreKeys.ENCRYPTION_KEY);
            store.remove(StoreKeys.ENCRYPTION_KEY_CREATED_AT);
            log.info("Encryption key wiped");
            return Outcome.done();
        } catch (StoreException e) {
            log.warn("Secure wipe failed: {}", e.getMessage());
            return Outcome.failed("Key store unavailable", e);
        }
    }

    /**
     * Gets the stored creation time of the secret.
     */
    public Optional<Instant> keyCreatedAt() {
        try {
            return store.getString(StoreKeys.ENCRYPTION_KEY_CREATED_AT).map(Instant::parse);
        } catch (StoreException | DateTimeParseException e) {
            log.warn("Could not read key creation time: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public KeyRotationPolicy rotationPolicy() {
        return rotationPolicy;
    }

    // ==================== Private Methods ====================

    // key before timestamp: a crash in between leaves a usable key that is simply due for rotation
    private void persist(String key) {
        store.setString(StoreKeys.ENCRYPTION_KEY, key);
        cachedKey = key;
        store.setString(StoreKeys.ENCRYPTION_KEY_CREATED_AT, clock.instant().toString());
    }

    // ==================== Inner Types ====================

    /**
     * Key rotation policy configuration.
     */
    public record KeyRotationPolicy(
            Duration rotationInterval,
            int keyLength
    ) {
        public KeyRotationPolicy {
            if (rotationInterval == null || rotationInterval.isNegative() || rotationInterval.isZero()) {
                throw new IllegalArgumentException("Rotation interval must be positive");
            }
            if (keyLength < 1) {
                throw new IllegalArgumentException("Key length must be positive");
            }
        }

        public static KeyRotationPolicy defaults() {
            return new KeyRotationPolicy(
                    Duration.ofDays(90),     // rotate quarterly
                    32
            );
        }

        public static KeyRotationPolicy strict() {
            return new KeyRotationPolicy(
                    Duration.ofDays(30),
                    64
            );
        }
    }
}
