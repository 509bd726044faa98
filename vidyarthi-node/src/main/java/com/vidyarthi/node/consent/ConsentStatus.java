package com.vidyarthi.node.consent;

import java.time.Instant;
import java.util.Optional;

/**
 * Snapshot of the stored consent record.
 *
 * @param hasConsent      master consent flag
 * @param grants          the individual grants
 * @param policyVersion   policy version the consent was given under, null if never recorded
 * @param consentedAt     when consent was recorded, null if never recorded
 * @param ageVerified     whether age verification has been done
 * @param parentalConsent whether a parent consented on behalf of a minor
 * @param needsRenewal    no consent date, or the validity period has elapsed
 * @param current         master flag set, current policy version, not expired
 */
public record ConsentStatus(
        boolean hasConsent,
        ConsentGrants grants,
        String policyVersion,
        Instant consentedAt,
        boolean ageVerified,
        boolean parentalConsent,
        boolean needsRenewal,
        boolean current
) {

    public static ConsentStatus empty() {
        return new ConsentStatus(false, ConsentGrants.none(), null, null, false, false, true, false);
    }

    /**
     * Consent was given and covers data processing.
     */
    public boolean isValid() {
        return hasConsent && grants.dataProcessing();
    }

    public Optional<Instant> consentDate() {
        return Optional.ofNullable(consentedAt);
    }
}
