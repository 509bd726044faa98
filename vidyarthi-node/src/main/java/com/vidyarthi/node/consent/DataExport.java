package com.vidyarthi.node.consent;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Machine-readable snapshot of the user's stored data, grouped by kind.
 * Each group keeps the order it was built in.
 */
public record DataExport(
        @JsonProperty("export_date") Instant exportDate,
        @JsonProperty("app_name") String appName,
        @JsonProperty("data_format_version") String formatVersion,
        @JsonProperty("user_data") Map<String, Object> userData,
        @JsonProperty("consent_history") Map<String, Object> consentHistory,
        @JsonProperty("preferences") Map<String, Object> preferences
) {

    public static final String APP_NAME = "Vidyarthi - Rural Education";
    public static final String FORMAT_VERSION = "1.0";

    public DataExport {
        Objects.requireNonNull(exportDate, "Export date cannot be null");
        userData = Collections.unmodifiableMap(new LinkedHashMap<>(userData));
        consentHistory = Collections.unmodifiableMap(new LinkedHashMap<>(consentHistory));
        preferences = Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
    }

    public int totalEntries() {
        return userData.size() + consentHistory.size() + preferences.size();
    }
}
