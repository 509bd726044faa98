package com.vidyarthi.node.transport;

import java.util.Objects;

/**
 * A call refused by the gateway or failed on the way out.
 */
public class GatewayException extends Exception {

    private final Reason reason;

    public GatewayException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public GatewayException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        /** Scheme or host not allowed. Nothing was sent. */
        DISALLOWED_URL,
        /** Connection-level failure that survived every retry. */
        NETWORK,
        /** The request did not complete within its timeout. */
        TIMEOUT,
        /** Any other I/O or request-building failure. */
        CLIENT,
        /** The calling thread was interrupted while waiting. */
        INTERRUPTED,
        /** The response body was not the expected JSON object. */
        MALFORMED_RESPONSE
    }
}
