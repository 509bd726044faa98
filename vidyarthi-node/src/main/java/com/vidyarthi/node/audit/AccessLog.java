package com.vidyarthi.node.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidyarthi.node.common.Outcome;
import com.vidyarthi.node.store.KeyValueStore;
import com.vidyarthi.node.store.KeyValueStore.StoreException;
import com.vidyarthi.node.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded audit trail of sensitive-data reads made on the user's behalf.
 *
 * Entries are stored oldest first as a list of JSON strings under
 * {@link StoreKeys#DATA_ACCESS_LOG}. Once the log holds {@link #MAX_ENTRIES}
 * entries, each append evicts the oldest one. Entries are never edited.
 */
public class AccessLog {

    private static final Logger log = LoggerFactory.getLogger(AccessLog.class);

    public static final int MAX_ENTRIES = 100;
    public static final String DEFAULT_ACTOR = "system";

    private final KeyValueStore store;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public AccessLog(KeyValueStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public AccessLog(KeyValueStore store) {
        this(store, Clock.systemUTC());
    }

    /**
     * Appends an entry, evicting the oldest beyond {@link #MAX_ENTRIES}.
     *
     * @param dataType kind of data read, e.g. "profile"
     * @param purpose  why it was read
     * @param actor    who read it; {@value #DEFAULT_ACTOR} when null or blank
     */
    public synchronized Outcome<AccessLogEntry> append(String dataType, String purpose, String actor) {
        if (dataType == null || dataType.isBlank()) {
            throw new IllegalArgumentException("Data type cannot be null or blank");
        }
        if (purpose == null || purpose.isBlank()) {
            throw new IllegalArgumentException("Purpose cannot be null or blank");
        }
        AccessLogEntry entry = new AccessLogEntry(
                clock.instant(),
                dataType,
                purpose,
                actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor
        );

        try {
            List<String> lines = new ArrayList<>(store.getStringList(StoreKeys.DATA_ACCESS_LOG).orElse(List.of()));
            lines.add(objectMapper.writeValueAsString(entry));
            if (lines.size() > MAX_ENTRIES) {
                lines.subList(0, lines.size() - MAX_ENTRIES).clear();
            }
            store.setStringList(StoreKeys.DATA_ACCESS_LOG, lines);
            return Outcome.ok(entry);
        } catch (JsonProcessingException e) {
            log.error("Access log entry could not be serialized", e);
            return Outcome.failed("Access log entry could not be serialized", e);
        } catch (StoreException e) {
            log.error("Failed to append access log entry for {}: {}", dataType, e.getMessage());
            return Outcome.failed("Access log unavailable", e);
        }
    }

    /**
     * Gets the entries, oldest first. Lines that are not valid entries, including JSON {@code null}, are skipped.
     *
     * @return {@code Ok} with the entries, or {@code Degraded} with an empty list if the store failed
     */
    public Outcome<List<AccessLogEntry>> entries() {
        List<String> lines;
        try {
            lines = store.getStringList(StoreKeys.DATA_ACCESS_LOG).orElse(List.of());
        } catch (StoreException e) {
            log.error("Failed to read access log: {}", e.getMessage());
            return Outcome.degraded(List.of(), "Access log unavailable", e);
        }

        List<AccessLogEntry> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            try {
                AccessLogEntry entry = objectMapper.readValue(line, AccessLogEntry.class);
                if (entry == null) {
                    log.warn("Skipping empty access log line");
                    continue;
                }
                entries.add(entry);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable access log line: {}", e.getOriginalMessage());
            }
        }
        return Outcome.ok(List.copyOf(entries));
    }

    /**
     * Gets the number of stored entries, 0 if the store failed.
     */
    public int size() {
        return entries().orElse(List.of()).size();
    }

    /**
     * One data-access event.
     */
    public record AccessLogEntry(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("data_type") String dataType,
            @JsonProperty("purpose") String purpose,
            @JsonProperty("accessed_by") String actor
    ) {
        public AccessLogEntry {
            Objects.requireNonNull(timestamp, "Timestamp cannot be null");
            Objects.requireNonNull(dataType, "Data type cannot be null");
            Objects.requireNonNull(purpose, "Purpose cannot be null");
            Objects.requireNonNull(actor, "Actor cannot be null");
        }
    }
}
