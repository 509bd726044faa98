package com.vidyarthi.node.store;

import java.util.Set;

/**
 * Reserved store keys owned by the node layer. UI code must not write these.
 */
public final class StoreKeys {

    public static final String ENCRYPTION_KEY = "app_encryption_key";
    public static final String ENCRYPTION_KEY_CREATED_AT = "encryption_key_created_at";

    public static final String CONSENT = "user_privacy_consent";
    public static final String CONSENT_TIMESTAMP = "consent_timestamp";
    public static final String CONSENT_VERSION = "consent_version";
    public static final String DATA_PROCESSING_CONSENT = "data_processing_consent";
    public static final String ANALYTICS_CONSENT = "analytics_consent";
    public static final String MARKETING_CONSENT = "marketing_consent";
    public static final String THIRD_PARTY_CONSENT = "third_party_consent";
    public static final String DATA_RETENTION_ACKNOWLEDGED = "data_retention_acknowledged";
    public static final String AGE_VERIFIED = "age_verified";
    public static final String PARENTAL_CONSENT = "parental_consent";

    public static final String DATA_ACCESS_LOG = "data_access_log";
    public static final String ERASURE_PENDING = "erasure_pending";

    /**
     * Keys that rectification may never overwrite. Consent state changes only through the ledger.
     */
    public static final Set<String> PROTECTED = Set.of(
            ENCRYPTION_KEY,
            ENCRYPTION_KEY_CREATED_AT,
            CONSENT,
            CONSENT_TIMESTAMP,
            CONSENT_VERSION,
            DATA_PROCESSING_CONSENT,
            ANALYTICS_CONSENT,
            MARKETING_CONSENT,
            THIRD_PARTY_CONSENT,
            DATA_RETENTION_ACKNOWLEDGED,
            AGE_VERIFIED,
            PARENTAL_CONSENT,
            DATA_ACCESS_LOG,
            ERASURE_PENDING
    );

    private StoreKeys() {
    }
}
