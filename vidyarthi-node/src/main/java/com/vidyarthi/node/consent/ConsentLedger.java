package com.vidyarthi.node.consent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidyarthi.node.audit.AccessLog;
import com.vidyarthi.node.audit.AccessLog.AccessLogEntry;
import com.vidyarthi.node.common.Outcome;
import com.vidyarthi.node.store.KeyValueStore;
import com.vidyarthi.node.store.KeyValueStore.StoreException;
import com.vidyarthi.node.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Persisted consent state for the installation, plus the data-subject rights
 * (access log, export, erasure, rectification) that operate on the same store.
 *
 * <p>States: no consent, granted, stale (policy changed or validity elapsed), withdrawn.
 * One record governs all categories.
 *
 * <p>No method throws on store failure: the failure is logged and returned as a
 * {@link Outcome.Failed} or {@link Outcome.Degraded}, and boolean queries answer false.
 */
public class ConsentLedger {

    private static final Logger log = LoggerFactory.getLogger(ConsentLedger.class);

    public static final int ADULT_AGE = 18;

    private static final List<String> CONSENT_HISTORY_MARKERS = List.of("consent", "privacy", "parental", "age_verified");
    private static final List<String> PREFERENCE_MARKERS = List.of("pref", "setting");

    private final KeyValueStore store;
    private final AccessLog accessLog;
    private final PrivacyPolicy policy;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public ConsentLedger(KeyValueStore store, AccessLog accessLog, PrivacyPolicy policy, Clock clock) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.accessLog = accessLog != null ? accessLog : new AccessLog(store, this.clock);
        this.policy = policy != null ? policy : PrivacyPolicy.defaults();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ConsentLedger(KeyValueStore store) {
        this(store, null, PrivacyPolicy.defaults(), Clock.systemUTC());
    }

    // ==================== Consent ====================

    /**
     * Records consent under the current policy version.
     *
     * @param grants             the categories the user agreed to
     * @param isMinor            whether the user is under {@value #ADULT_AGE}
     * @param hasParentalConsent stored only for minors
     */
    public Outcome<Void> recordConsent(ConsentGrants grants, boolean isMinor, boolean hasParentalConsent) {
        Objects.requireNonNull(grants, "Grants cannot be null");
        try {
            for (ConsentCategory category : ConsentCategory.values()) {
                store.setBoolean(category.storeKey(), grants.isGranted(category));
            }
            store.setString(StoreKeys.CONSENT_VERSION, policy.version());
            store.setString(StoreKeys.CONSENT_TIMESTAMP, clock.instant().toString());
            if (isMinor) {
                store.setBoolean(StoreKeys.PARENTAL_CONSENT, hasParentalConsent);
            }
            // master flag last: a partially written record never reads as consent
            store.setBoolean(StoreKeys.CONSENT, true);
            log.info("Consent recorded: version={}, granted={}", policy.version(), grants.granted());
            return Outcome.done();
        } catch (StoreException e) {
            log.error("Failed to record consent: {}", e.getMessage());
            return Outcome.failed("Consent could not be recorded", e);
        }
    }

    /**
     * Reads the stored consent record.
     *
     * @return {@code Ok} with the status, or {@code Degraded} with {@link ConsentStatus#empty()}
     */
    public Outcome<ConsentStatus> status() {
        try {
            boolean hasConsent = flag(StoreKeys.CONSENT);
            ConsentGrants grants = new ConsentGrants(
                    flag(StoreKeys.DATA_PROCESSING_CONSENT),
                    flag(StoreKeys.ANALYTICS_CONSENT),
                    flag(StoreKeys.MARKETING_CONSENT),
                    flag(StoreKeys.THIRD_PARTY_CONSENT)
            );
            String version = store.getString(StoreKeys.CONSENT_VERSION).orElse(null);
            Instant consentedAt = consentDate().orElse(null);
            boolean needsRenewal = consentedAt == null || policy.isExpired(consentedAt, clock.instant());
            boolean current = hasConsent && policy.version().equals(version) && !needsRenewal;

            return Outcome.ok(new ConsentStatus(
                    hasConsent,
                    grants,
                    version,
                    consentedAt,
                    flag(StoreKeys.AGE_VERIFIED),
                    flag(StoreKeys.PARENTAL_CONSENT),
                    needsRenewal,
                    current
            ));
        } catch (StoreException e) {
            log.error("Failed to read consent status: {}", e.getMessage());
            return Outcome.degraded(ConsentStatus.empty(), "Consent status unavailable", e);
        }
    }

    /**
     * True if consent was given under the current policy version and has not lapsed.
     */
    public boolean hasValidConsent() {
        return status().orElse(ConsentStatus.empty()).current();
    }

    /**
     * Clears the given grants. The master flag and the access log are untouched.
     */
    public Outcome<Void> withdraw(Set<ConsentCategory> categories) {
        Objects.requireNonNull(categories, "Categories cannot be null");
        try {
            for (ConsentCategory category : categories) {
                store.setBoolean(category.storeKey(), false);
            }
            log.info("Consent withdrawn for {}", categories);
            return Outcome.done();
        } catch (StoreException e) {
            log.error("Failed to withdraw consent: {}", e.getMessage());
            return Outcome.failed("Consent could not be withdrawn", e);
        }
    }

    /**
     * Clears the master flag and every grant.
     */
    public Outcome<Void> withdrawAll() {
        try {
            store.setBoolean(StoreKeys.CONSENT, false);
            for (ConsentCategory category : ConsentCategory.values()) {
                store.setBoolean(category.storeKey(), false);
            }
            log.info("All consent withdrawn");
            return Outcome.done();
        } catch (StoreException e) {
            log.error("Failed to withdraw all consent: {}", e.getMessage());
            return Outcome.failed("Consent could not be withdrawn", e);
        }
    }

    /**
     * Marks the user's age as verified. Users under {@value #ADULT_AGE} also need
     * the parental-consent flag recorded.
     */
    public Outcome<Void> verifyAge(int age, boolean hasParentalConsent) {
        if (age < 0) {
            throw new IllegalArgumentException("Age cannot be negative");
        }
        try {
            store.setBoolean(StoreKeys.AGE_VERIFIED, true);
            if (age < ADULT_AGE) {
                store.setBoolean(StoreKeys.PARENTAL_CONSENT, hasParentalConsent);
            }
            log.info("Age verification recorded (minor={})", age < ADULT_AGE);
            return Outcome.done();
        } catch (StoreException e) {
            log.error("Failed to record age verification: {}", e.getMessage());
            return Outcome.failed("Age verification could not be recorded", e);
        }
    }

    public boolean canUseAnalytics() {
        return safeFlag(StoreKeys.ANALYTICS_CONSENT);
    }

    public boolean canSendMarketing() {
        return safeFlag(StoreKeys.MARKETING_CONSENT);
    }

    public boolean canShareWithThirdParty() {
        return safeFlag(StoreKeys.THIRD_PARTY_CONSENT);
    }

    /**
     * Third-party sharing of one kind of data: the user must have allowed sharing
     * and the data type must be shareable at all.
     */
    public boolean canShareWithThirdParty(SensitiveDataType type) {
        Objects.requireNonNull(type, "Data type cannot be null");
        return type.shareableWithThirdParty() && canShareWithThirdParty();
    }

    public Outcome<Void> acknowledgeDataRetention() {
        try {
            store.setBoolean(StoreKeys.DATA_RETENTION_ACKNOWLEDGED, true);
            return Outcome.done();
        } catch (StoreException e) {
            log.error("Failed to record retention acknowledgement: {}", e.getMessage());
            return Outcome.failed("Acknowledgement could not be recorded", e);
        }
    }

    public boolean hasAcknowledgedDataRetention() {
        return safeFlag(StoreKeys.DATA_RETENTION_ACKNOWLEDGED);
    }

    // ==================== Data Subject Rights ====================

    /**
     * Snapshot of every user-visible stored value for data portability.
     * Internal keys (platform-prefixed or holding key material) are left out.
     */
    public Outcome<DataExport> exportAll() {
        try {
            Map<String, Object> userData = new LinkedHashMap<>();
            Map<String, Object> consentHistory = new LinkedHashMap<>();
            Map<String, Object> preferences = new LinkedHashMap<>();

            for (String key : new TreeSet<>(store.keys())) {
                if (isInternal(key)) {
                    continue;
                }
                Optional<Object> value = store.get(key);
                if (value.isEmpty()) {
                    continue;
                }
                if (containsAny(key, CONSENT_HISTORY_MARKERS)) {
                    consentHistory.put(key, value.get());
                } else if (containsAny(key, PREFERENCE_MARKERS)) {
                    preferences.put(key, value.get());
                } else {
                    userData.put(key, value.get());
                }
            }

            DataExport export = new DataExport(
                    clock.instant(),
                    DataExport.APP_NAME,
                    DataExport.FORMAT_VERSION,
                    userData,
                    consentHistory,
                    preferences
            );
            log.info("User data exported ({} entries)", export.totalEntries());
            return Outcome.ok(export);
        } catch (StoreException e) {
            log.error("Failed to export user data: {}", e.getMessage());
            return Outcome.failed("Data export failed", e);
        }
    }

    /**
     * {@link #exportAll()} rendered as a JSON document.
     */
    public Outcome<String> exportAllAsJson() {
        Outcome<DataExport> export = exportAll();
        if (!(export instanceof Outcome.Ok<DataExport> ok)) {
            return Outcome.failed(export.reason().orElse("Data export failed"));
        }
        try {
            return Outcome.ok(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(ok.value()));
        } catch (JsonProcessingException e) {
            log.error("Failed to render data export", e);
            return Outcome.failed("Data export could not be rendered", e);
        }
    }

    /**
     * Clears the whole store, consent and access log included.
     * The secret key is only gone if the store held it; use
     * {@link DataErasureService} to erase both together.
     */
    public Outcome<Void> eraseAll() {
        try {
            store.clear();
            log.info("All user data erased");
            return Outcome.done();
        } catch (StoreException e) {
            log.error("Failed to erase user data: {}", e.getMessage());
            return Outcome.failed("Data erasure failed", e);
        }
    }

    /**
     * Overwrites one stored field. Accepts String, Integer, Long, Boolean, Float and Double;
     * the keys in {@link StoreKeys#PROTECTED} (key material, consent state, audit trail) cannot be rectified.
     */
    public Outcome<Void> rectify(String key, Object value) {
        if (key == null || key.isBlank()) {
            return Outcome.failed("Key is required");
        }
        if (StoreKeys.PROTECTED.contains(key)) {
            log.warn("Refused to rectify reserved key {}", key);
            return Outcome.failed("Key is reserved: " + key);
        }
        try {
            if (value instanceof String s) {
                store.setString(key, s);
            } else if (value instanceof Integer i) {
                store.setLong(key, i);
            } else if (value instanceof Long l) {
                store.setLong(key, l);
            } else if (value instanceof Boolean b) {
                store.setBoolean(key, b);
            } else if (value instanceof Float f) {
                store.setDouble(key, f);
            } else if (value instanceof Double d) {
                store.setDouble(key, d);
            } else {
                return Outcome.failed("Unsupported value type: "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }
            log.info("User data rectified: {}", key);
            return Outcome.done();
        } catch (StoreException e) {
            log.error("Failed to rectify {}: {}", key, e.getMessage());
            return Outcome.failed("Data rectification failed", e);
        }
    }

    // ==================== Access Log ====================

    public Outcome<AccessLogEntry> logAccess(String dataType, String purpose, String actor) {
        return accessLog.append(dataType, purpose, actor);
    }

    public Outcome<AccessLogEntry> logAccess(String dataType, String purpose) {
        return accessLog.append(dataType, purpose, null);
    }

    public Outcome<List<AccessLogEntry>> accessLog() {
        return accessLog.entries();
    }

    public PrivacyPolicy policy() {
        return policy;
    }

    // ==================== Private Methods ====================

    private boolean flag(String key) {
        return store.getBoolean(key).orElse(false);
    }

    private boolean safeFlag(String key) {
        try {
            return flag(key);
        } catch (StoreException e) {
            log.error("Failed to read {}: {}", key, e.getMessage());
            return false;
        }
    }

    private Optional<Instant> consentDate() {
        Optional<String> stored = store.getString(StoreKeys.CONSENT_TIMESTAMP);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(stored.get()));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unreadable consent timestamp");
            return Optional.empty();
        }
    }

    private static boolean isInternal(String key) {
        return key.startsWith("flutter.") || key.contains("encryption");
    }

    private static boolean containsAny(String key, List<String> markers) {
        for (String marker : markers) {
            if (key.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
