package com.vidyarthi.node.transport;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Status, body and headers of an HTTP response.
 */
public record GatewayResponse(
        int statusCode,
        String body,
        Map<String, List<String>> headers
) {

    public GatewayResponse {
        body = body != null ? body : "";
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public GatewayResponse(int statusCode, String body) {
        this(statusCode, body, Map.of());
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Size of the body once encoded as UTF-8.
     */
    public int bodySizeBytes() {
        return body.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * At most the first {@code length} characters of the body.
     */
    public String bodyPreview(int length) {
        return body.length() > length ? body.substring(0, length) : body;
    }
}
