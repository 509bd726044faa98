package com.vidyarthi.node.consent;

import java.time.Duration;
import java.time.Instant;

/**
 * Classification of sensitive data with its retention period and sharing rules.
 */
public enum SensitiveDataType {
    PERSONAL_IDENTIFIABLE(Duration.ofDays(365 * 3), true),
    FINANCIAL(Duration.ofDays(365 * 7), true),
    HEALTH(Duration.ofDays(365 * 5), false),
    LOCATION(Duration.ofDays(90), true),
    BIOMETRIC(Duration.ofDays(365), false),
    EDUCATIONAL(Duration.ofDays(365 * 10), true);

    private final Duration retention;
    private final boolean shareableWithThirdParty;

    SensitiveDataType(Duration retention, boolean shareableWithThirdParty) {
        this.retention = retention;
        this.shareableWithThirdParty = shareableWithThirdParty;
    }

    public Duration retention() {
        return retention;
    }

    public boolean shareableWithThirdParty() {
        return shareableWithThirdParty;
    }

    /**
     * Every category is stored obfuscated.
     */
    public boolean requiresEncryption() {
        return true;
    }

    /**
     * True if data collected at {@code collectedAt} has outlived its retention period.
     */
    public boolean isPastRetention(Instant collectedAt, Instant now) {
        return !collectedAt.plus(retention).isAfter(now);
    }
}
