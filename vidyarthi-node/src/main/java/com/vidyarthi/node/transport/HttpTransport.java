package com.vidyarthi.node.transport;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Blocking HTTP exchange used by {@link SecureGateway}.
 *
 * Implementations must enforce {@code timeout} and report connection-level failures
 * with the standard exception types ({@link java.net.SocketException},
 * {@link java.net.UnknownHostException}, {@link java.net.http.HttpConnectTimeoutException},
 * {@link java.net.http.HttpTimeoutException}) so the gateway can tell transient ones apart.
 */
public interface HttpTransport {

    /**
     * @param method  HTTP method, upper case
     * @param uri     absolute target
     * @param headers request headers
     * @param body    request body, null for none
     * @param timeout overall request timeout
     */
    GatewayResponse execute(String method, URI uri, Map<String, String> headers, String body, Duration timeout)
            throws IOException, InterruptedException;
}
