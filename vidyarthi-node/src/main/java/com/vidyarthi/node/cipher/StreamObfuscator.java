package com.vidyarthi.node.cipher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidyarthi.node.common.Outcome;
import com.vidyarthi.node.key.KeyVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reversible stream obfuscation of stored fields.
 *
 * The UTF-8 bytes of the plaintext are XOR-ed with the key cycled to the same length
 * and the result is carried as Base64. The transform is its own inverse.
 *
 * <p><b>This is obfuscation, not encryption.</b> There is no nonce and no integrity tag:
 * identical plaintexts produce identical ciphertexts, tampering goes unnoticed, and
 * decoding under the wrong key silently yields garbage. Anyone with device access and
 * the store can recover the key. A deployment that needs confidentiality must replace
 * this class with an authenticated cipher behind the same methods and re-encode the
 * stored data once.
 */
public class StreamObfuscator {

    private static final Logger log = LoggerFactory.getLogger(StreamObfuscator.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final KeyVault keyVault;
    private final ObjectMapper objectMapper;

    /**
     * @param keyVault source of the active key for the single-argument overloads; may be null
     *                 when callers always pass keys explicitly
     */
    public StreamObfuscator(KeyVault keyVault) {
        this.keyVault = keyVault;
        this.objectMapper = new ObjectMapper();
    }

    public StreamObfuscator() {
        this(null);
    }

    /**
     * Obfuscates text with the given key.
     *
     * @return {@code Ok} with the Base64 ciphertext (empty for empty input), or
     *         {@code Degraded} carrying the unchanged plaintext if encoding failed
     */
    public Outcome<String> encode(String plaintext, String key) {
        if (plaintext == null || plaintext.isEmpty()) {
            return Outcome.ok("");
        }
        try {
            byte[] keyBytes = requireKey(key);
            byte[] combined = xor(plaintext.getBytes(StandardCharsets.UTF_8), keyBytes);
            return Outcome.ok(Base64.getEncoder().encodeToString(combined));
        } catch (RuntimeException e) {
            log.warn("Encoding failed, leaving value in plaintext: {}", e.getMessage());
            return Outcome.degraded(plaintext, "Encoding failed", e);
        }
    }

    /**
     * Reverses {@link #encode(String, String)}. A different key yields garbage, not an error.
     *
     * @return {@code Ok} with the decoded text, or {@code Degraded} carrying the unchanged
     *         input if it is not a ciphertext (for example, a value stored before encoding)
     */
    public Outcome<String> decode(String ciphertext, String key) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            return Outcome.ok("");
        }
        try {
            byte[] keyBytes = requireKey(key);
            byte[] combined = Base64.getDecoder().decode(ciphertext);
            return Outcome.ok(new String(xor(combined, keyBytes), StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            log.warn("Decoding failed, returning input unchanged: {}", e.getMessage());
            return Outcome.degraded(ciphertext, "Decoding failed", e);
        }
    }

    /**
     * Serializes a map to JSON and obfuscates it.
     */
    public Outcome<String> encodeStructured(Map<String, ?> value, String key) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Structured value could not be serialized: {}", e.getOriginalMessage());
            return Outcome.failed("Serialization failed", e);
        }
        return encode(json, key);
    }

    /**
     * Decodes and parses a structured value.
     *
     * @return {@code Ok} with the map, or {@code Degraded} with an empty map when the text
     *         is not a structured ciphertext under this key
     */
    public Outcome<Map<String, Object>> decodeStructured(String text, String key) {
        Outcome<String> decoded = decode(text, key);
        if (!decoded.isOk()) {
            return Outcome.degraded(Map.of(), "Decoding failed", null);
        }
        String json = decoded.orElse("");
        if (json.isEmpty()) {
            return Outcome.degraded(Map.of(), "No structured data", null);
        }
        try {
            Map<String, Object> map = objectMapper.readValue(json, MAP_TYPE);
            return Outcome.ok(map);
        } catch (JsonProcessingException e) {
            log.warn("Structured value could not be parsed");
            return Outcome.degraded(Map.of(), "Not a structured value", e);
        }
    }

    /**
     * Obfuscates with the vault's active key.
     */
    public Outcome<String> encode(String plaintext) {
        return encode(plaintext, activeKey());
    }

    /**
     * Reverses with the vault's active key.
     */
    public Outcome<String> decode(String ciphertext) {
        return decode(ciphertext, activeKey());
    }

    public Outcome<String> encodeStructured(Map<String, ?> value) {
        return encodeStructured(value, activeKey());
    }

    public Outcome<Map<String, Object>> decodeStructured(String text) {
        return decodeStructured(text, activeKey());
    }

    // ==================== Private Methods ====================

    private String activeKey() {
        if (keyVault == null) {
            throw new IllegalStateException("No key vault configured, pass the key explicitly");
        }
        return keyVault.currentKey();
    }

    private static byte[] requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] xor(byte[] data, byte[] key) {
        byte[] out = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = (byte) (data[i] ^ key[i % key.length]);
        }
        return out;
    }
}
