package com.vidyarthi.node.consent;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The privacy policy consent is recorded against.
 *
 * Consent lapses after {@code validityMonths}, where a month is counted as 30 days.
 * Bumping {@code version} invalidates every consent recorded under an older one.
 */
public record PrivacyPolicy(
        String version,
        LocalDate lastUpdated,
        int validityMonths
) {

    public static final int DAYS_PER_MONTH = 30;

    public PrivacyPolicy {
        Objects.requireNonNull(version, "Version cannot be null");
        Objects.requireNonNull(lastUpdated, "Last updated cannot be null");
        if (version.isBlank()) {
            throw new IllegalArgumentException("Version cannot be blank");
        }
        if (validityMonths <= 0) {
            throw new IllegalArgumentException("Validity must be positive");
        }
    }

    public static PrivacyPolicy defaults() {
        return new PrivacyPolicy("1.0.0", LocalDate.of(2025, 1, 1), 12);
    }

    /**
     * True once whole elapsed months since {@code consentedAt} reach the validity period.
     */
    public boolean isExpired(Instant consentedAt, Instant now) {
        long days = Duration.between(consentedAt, now).toDays();
        return days / DAYS_PER_MONTH >= validityMonths;
    }
}
