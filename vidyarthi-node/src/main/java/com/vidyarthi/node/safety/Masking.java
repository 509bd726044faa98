package com.vidyarthi.node.safety;

/**
 * Display transforms for sensitive values shown in logs and UI.
 * All transforms are deterministic and keep only a short visible part of the input.
 */
public final class Masking {

    public static final int DEFAULT_VISIBLE_CHARS = 4;
    public static final int URL_VISIBLE_CHARS = 20;

    private Masking() {
    }

    /**
     * Masks the local part of an email, keeping its first and last character.
     * {@code john.doe@example.com} becomes {@code j******e@example.com}.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isEmpty()) {
            return email;
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return email;
        }
        String name = email.substring(0, at);
        String domain = email.substring(at + 1);
        if (name.isEmpty()) {
            return "***@" + domain;
        }
        if (name.length() <= 2) {
            return name.charAt(0) + "***@" + domain;
        }
        return name.charAt(0) + "*".repeat(name.length() - 2) + name.charAt(name.length() - 1) + "@" + domain;
    }

    /**
     * Masks all but the last four digits of a phone number.
     */
    public static String maskPhone(String phone) {
        if (phone == null || phone.length() < 4) {
            return phone;
        }
        return "*".repeat(phone.length() - 4) + phone.substring(phone.length() - 4);
    }

    /**
     * Keeps the first {@code visibleChars} characters and masks the rest.
     * Values no longer than {@code visibleChars} are masked entirely.
     */
    public static String maskToken(String data, int visibleChars) {
        if (data == null) {
            return null;
        }
        if (visibleChars < 0) {
            throw new IllegalArgumentException("Visible chars cannot be negative");
        }
        if (data.length() <= visibleChars) {
            return "*".repeat(data.length());
        }
        return data.substring(0, visibleChars) + "*".repeat(data.length() - visibleChars);
    }

    public static String maskToken(String data) {
        return maskToken(data, DEFAULT_VISIBLE_CHARS);
    }

    /**
     * Masks a URL for security events, keeping scheme and host prefix readable.
     */
    public static String maskUrl(String url) {
        return maskToken(url, URL_VISIBLE_CHARS);
    }

    /**
     * Short non-cryptographic fingerprint for correlating log lines without the value.
     *
     * @return 8 lowercase hex characters, empty for empty input
     */
    public static String fingerprint(String data) {
        if (data == null || data.isEmpty()) {
            return "";
        }
        int hash = 0;
        for (int i = 0; i < data.length(); i++) {
            hash = (hash << 5) - hash + data.charAt(i);
        }
        return String.format("%08x", hash);
    }
}
