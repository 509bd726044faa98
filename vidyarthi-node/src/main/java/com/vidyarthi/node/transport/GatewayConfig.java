package com.vidyarthi.node.transport;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Outbound call policy.
 *
 * @param allowedHosts     host substrings a URL's host must contain
 * @param requestTimeout   default per-request timeout
 * @param maxRetries       retries after a transient network failure
 * @param retryDelay       pause before each retry
 * @param developmentMode  when set, any http/https host is allowed
 * @param userAgent        value of the default User-Agent header
 */
public record GatewayConfig(
        List<String> allowedHosts,
        Duration requestTimeout,
        int maxRetries,
        Duration retryDelay,
        boolean developmentMode,
        String userAgent
) {

    public static final List<String> DEFAULT_ALLOWED_HOSTS = List.of(
            "localhost",
            "127.0.0.1",
            "192.168.",
            "172.17.",
            "10.",
            "api.gemini.google.com",
            "generativelanguage.googleapis.com",
            "firebase.googleapis.com",
            "firebaseapp.com",
            "openrouter.ai"
    );

    public GatewayConfig {
        Objects.requireNonNull(allowedHosts, "Allowed hosts cannot be null");
        Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
        Objects.requireNonNull(retryDelay, "Retry delay cannot be null");
        Objects.requireNonNull(userAgent, "User agent cannot be null");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delay cannot be negative");
        }
        allowedHosts = allowedHosts.stream().map(host -> host.toLowerCase(Locale.ROOT)).toList();
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig(
                DEFAULT_ALLOWED_HOSTS,
                Duration.ofSeconds(30),
                3,
                Duration.ofSeconds(2),
                false,
                "VidyarthiApp/1.0"
        );
    }

    public GatewayConfig withDevelopmentMode(boolean enabled) {
        return new GatewayConfig(allowedHosts, requestTimeout, maxRetries, retryDelay, enabled, userAgent);
    }

    public GatewayConfig withRetryDelay(Duration delay) {
        return new GatewayConfig(allowedHosts, requestTimeout, maxRetries, delay, developmentMode, userAgent);
    }

    public GatewayConfig withAllowedHosts(List<String> hosts) {
        return new GatewayConfig(hosts, requestTimeout, maxRetries, retryDelay, developmentMode, userAgent);
    }
}
