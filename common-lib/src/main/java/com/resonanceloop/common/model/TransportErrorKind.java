package com.resonanceloop.common.model;

/**
 * Failure classes reported by the transport layer.
 *
 * <p>Only {@link #MALFORMED_REQUEST} is terminal: re-sending the same payload cannot succeed.
 * {@link #RATE_LIMITED} backs off exponentially, every other retryable kind linearly.
 */
public enum TransportErrorKind {
    RATE_LIMITED(true),
    TIMEOUT(true),
    CONNECTION_ERROR(true),
    MALFORMED_REQUEST(false),
    EMPTY_CONTENT(true),
    UPSTREAM_ERROR(true);

    private final boolean retryable;

    TransportErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
