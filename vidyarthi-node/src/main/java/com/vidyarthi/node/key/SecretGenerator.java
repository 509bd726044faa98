package com.vidyarthi.node.key;

import java.security.SecureRandom;

/**
 * Generates random secrets and tokens from a fixed alphanumeric alphabet.
 */
public class SecretGenerator {

    static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final SecureRandom secureRandom;

    public SecretGenerator() {
        this(new SecureRandom());
    }

    public SecretGenerator(SecureRandom secureRandom) {
        if (secureRandom == null) {
            throw new IllegalArgumentException("SecureRandom cannot be null");
        }
        this.secureRandom = secureRandom;
    }

    /**
     * Generates a secret of the given length.
     *
     * @param length number of characters, at least 1
     * @return random alphanumeric string
     */
    public String generate(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
