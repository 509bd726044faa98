package com.vidyarthi.node.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidyarthi.node.safety.InputGuard;
import com.vidyarthi.node.safety.Masking;
import com.vidyarthi.node.safety.SecurityEventLog;
import com.vidyarthi.node.transport.GatewayException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Single exit point for outbound HTTP calls.
 *
 * <p>Every call is checked against the host allowlist before anything is sent.
 * POST bodies are threat-scanned field by field: a string field matching an injection
 * heuristic is dropped, the remaining strings are sanitized. Transient network failures
 * are retried a bounded number of times; everything else surfaces as a
 * {@link GatewayException} straight away.
 */
public class SecureGateway {

    private static final Logger log = LoggerFactory.getLogger(SecureGateway.class);

    public static final int LARGE_RESPONSE_BYTES = 10 * 1024 * 1024;
    private static final int BODY_PREVIEW_CHARS = 100;
    private static final int LOGGED_URL_CHARS = 30;
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final HttpTransport transport;
    private final InputGuard inputGuard;
    private final SecurityEventLog securityEvents;
    private final GatewayConfig config;
    private final ObjectMapper objectMapper;

    public SecureGateway(HttpTransport transport, InputGuard inputGuard, SecurityEventLog securityEvents, GatewayConfig config) {
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.inputGuard = Objects.requireNonNull(inputGuard, "InputGuard cannot be null");
        this.securityEvents = Objects.requireNonNull(securityEvents, "SecurityEventLog cannot be null");
        this.config = config != null ? config : GatewayConfig.defaults();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Checks a URL against the scheme rule and the host allowlist.
     * In development mode any http/https host passes.
     */
    public boolean isAllowed(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            log.debug("Rejecting unparsable URL: {}", e.getReason());
            return false;
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            securityEvents.warn("Blocked non-HTTP scheme", Map.of(
                    "scheme", scheme,
                    "url_host", uri.getHost() == null ? "" : uri.getHost()
            ));
            return false;
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            return false;
        }
        if (config.developmentMode()) {
            return true;
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        for (String allowed : config.allowedHosts()) {
            if (host.contains(allowed)) {
                return true;
            }
        }
        securityEvents.warn("Blocked unauthorized domain", Map.of(
                "host", host,
                "url", Masking.maskUrl(url)
        ));
        return false;
    }

    public GatewayResponse post(String url, Map<String, String> headers, Map<String, ?> body) throws GatewayException {
        return post(url, headers, body, config.requestTimeout(), true);
    }

    /**
     * Sends a JSON POST.
     *
     * @param body         fields to send, null for an empty body
     * @param sanitizeBody false to send string fields untouched
     * @throws GatewayException if the URL is refused, or the call failed after retries
     */
    public GatewayResponse post(String url, Map<String, String> headers, Map<String, ?> body,
                                Duration timeout, boolean sanitizeBody) throws GatewayException {
        URI uri = requireAllowed(url);
        Map<String, ?> outgoing = sanitizeBody && body != null ? sanitizeBody(body) : body;

        String payload = null;
        if (outgoing != null) {
            try {
                payload = objectMapper.writeValueAsString(outgoing);
            } catch (JsonProcessingException e) {
                throw new GatewayException(Reason.CLIENT, "Request body could not be serialized", e);
            }
        }

        securityEvents.info("HTTP POST", Map.of(
                "url", Masking.maskToken(url, LOGGED_URL_CHARS),
                "has_body", outgoing != null
        ));
        return send("POST", uri, mergeHeaders("POST", headers), payload, timeout, 0);
    }

    public GatewayResponse get(String url, Map<String, String> headers) throws GatewayException {
        return get(url, headers, config.requestTimeout());
    }

    /**
     * Sends a GET.
     *
     * @throws GatewayException if the URL is refused, or the call failed after retries
     */
    public GatewayResponse get(String url, Map<String, String> headers, Duration timeout) throws GatewayException {
        URI uri = requireAllowed(url);
        securityEvents.info("HTTP GET", Map.of("url", Masking.maskToken(url, LOGGED_URL_CHARS)));
        return send("GET", uri, mergeHeaders("GET", headers), null, timeout, 0);
    }

    /**
     * Drops string fields that look like injection attempts and sanitizes the rest.
     * Non-string values pass through unchanged.
     */
    public Map<String, Object> sanitizeBody(Map<String, ?> body) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : body.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String text) {
                if (inputGuard.containsInjectionPattern(text)) {
                    securityEvents.warn("SQL injection attempt blocked", Map.of("field", entry.getKey()));
                    continue;
                }
                sanitized.put(entry.getKey(), inputGuard.sanitize(text));
            } else {
                sanitized.put(entry.getKey(), value);
            }
        }
        return sanitized;
    }

    /**
     * Default headers overlaid by the caller's; names compare case-insensitively and the caller wins.
     */
    public Map<String, String> mergeHeaders(String method, Map<String, String> headers) {
        Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if ("POST".equalsIgnoreCase(method)) {
            merged.put("Content-Type", "application/json");
        }
        merged.put("Accept", "application/json");
        merged.put("User-Agent", config.userAgent());
        if (headers != null) {
            headers.forEach((name, value) -> {
                merged.remove(name);
                merged.put(name, value);
            });
        }
        return new LinkedHashMap<>(merged);
    }

    /**
     * Logs suspicious responses. Never rejects.
     */
    public void validateResponse(GatewayResponse response) {
        int sizeBytes = response.bodySizeBytes();
        if (sizeBytes > LARGE_RESPONSE_BYTES) {
            securityEvents.warn("Unusually large response", Map.of(
                    "size_bytes", sizeBytes,
                    "status", response.statusCode()
            ));
        }
        if (response.statusCode() >= 400) {
            securityEvents.warn("HTTP error response", Map.of(
                    "status", response.statusCode(),
                    "body_preview", response.bodyPreview(BODY_PREVIEW_CHARS)
            ));
        }
    }

    /**
     * Parses a response body that must be a JSON object.
     *
     * @throws GatewayException with {@link Reason#MALFORMED_RESPONSE} otherwise
     */
    public Map<String, Object> parseJson(GatewayResponse response) throws GatewayException {
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            securityEvents.warn("JSON parse error", Map.of(
                    "error", String.valueOf(e.getOriginalMessage()),
                    "body_preview", response.bodyPreview(BODY_PREVIEW_CHARS)
            ));
            throw new GatewayException(Reason.MALFORMED_RESPONSE, "Response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            securityEvents.warn("JSON parse error", Map.of(
                    "error", "Response is not a JSON object",
                    "body_preview", response.bodyPreview(BODY_PREVIEW_CHARS)
            ));
            throw new GatewayException(Reason.MALFORMED_RESPONSE, "Response is not a JSON object");
        }
        return objectMapper.convertValue(root, MAP_TYPE);
    }

    public GatewayConfig config() {
        return config;
    }

    // ==================== Private Methods ====================

    private URI requireAllowed(String url) throws GatewayException {
        if (!isAllowed(url)) {
            throw new GatewayException(Reason.DISALLOWED_URL, "URL not allowed: " + Masking.maskUrl(url));
        }
        return URI.create(url.trim());
    }

    private GatewayResponse send(String method, URI uri, Map<String, String> headers, String body,
                                 Duration timeout, int attempt) throws GatewayException {
        try {
            GatewayResponse response = transport.execute(method, uri, headers, body, timeout);
            validateResponse(response);
            return response;
        } catch (HttpConnectTimeoutException | SocketException | UnknownHostException e) {
            if (attempt < config.maxRetries()) {
                log.warn("Network error on {} {}, retrying ({}/{})", method, uri.getHost(), attempt + 1, config.maxRetries());
                pause();
                return send(method, uri, headers, body, timeout, attempt + 1);
            }
            securityEvents.warn("Network error after retries", Map.of("error", String.valueOf(e.getMessage())));
            throw new GatewayException(Reason.NETWORK, "Network error after " + attempt + " retries", e);
        } catch (HttpTimeoutException e) {
            securityEvents.warn("Request timed out", Map.of("timeout_ms", timeout.toMillis()));
            throw new GatewayException(Reason.TIMEOUT, "Request timed out after " + timeout, e);
        } catch (IOException e) {
            securityEvents.warn("HTTP client error", Map.of("error", String.valueOf(e.getMessage())));
            throw new GatewayException(Reason.CLIENT, "Request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(Reason.INTERRUPTED, "Interrupted while waiting for response", e);
        }
    }

    private void pause() throws GatewayException {
        long millis = config.retryDelay().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(Reason.INTERRUPTED, "Interrupted while waiting to retry", e);
        }
    }
}
