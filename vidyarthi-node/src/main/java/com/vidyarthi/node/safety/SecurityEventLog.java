package com.vidyarthi.node.safety;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records structured security events: blocked domains, injection attempts, error responses.
 *
 * Events go to the {@code vidyarthi.security} logger and are also kept in a bounded
 * in-memory ring so the host app can show or upload them. Details must name the offending
 * pattern, field or host, never the raw payload.
 */
public class SecurityEventLog {

    public static final String LOGGER_NAME = "vidyarthi.security";
    public static final int DEFAULT_CAPACITY = 200;

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    private final Deque<SecurityEvent> events;
    private final int capacity;
    private final Clock clock;

    public SecurityEventLog(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.events = new ArrayDeque<>(capacity);
    }

    public SecurityEventLog() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    /**
     * Records a routine event, such as an outbound call.
     */
    public SecurityEvent info(String event, Map<String, ?> details) {
        SecurityEvent recorded = append(Severity.INFO, event, details);
        log.info("Security event: {} {}", event, recorded.details());
        return recorded;
    }

    /**
     * Records a violation or anomaly.
     */
    public SecurityEvent warn(String event, Map<String, ?> details) {
        SecurityEvent recorded = append(Severity.WARNING, event, details);
        log.warn("Security event: {} {}", event, recorded.details());
        return recorded;
    }

    /**
     * Gets all retained events, oldest first.
     */
    public synchronized List<SecurityEvent> recent() {
        return new ArrayList<>(events);
    }

    /**
     * Gets retained events with the given name.
     */
    public synchronized List<SecurityEvent> recent(String event) {
        return events.stream()
                .filter(e -> e.event().equals(event))
                .toList();
    }

    public synchronized void clear() {
        events.clear();
    }

    public synchronized int size() {
        return events.size();
    }

    private synchronized SecurityEvent append(Severity severity, String event, Map<String, ?> details) {
        Objects.requireNonNull(event, "Event cannot be null");
        SecurityEvent recorded = new SecurityEvent(event, severity, stringify(details), clock.instant());
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(recorded);
        return recorded;
    }

    private static Map<String, String> stringify(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        details.forEach((k, v) -> copy.put(k, String.valueOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    // ==================== Inner Types ====================

    public enum Severity {
        INFO,
        WARNING
    }

    /**
     * A recorded security event.
     */
    public record SecurityEvent(
            String event,
            Severity severity,
            Map<String, String> details,
            Instant timestamp
    ) {}
}
