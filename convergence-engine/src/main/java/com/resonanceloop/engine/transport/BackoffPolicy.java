package com.resonanceloop.engine.transport;

import com.resonanceloop.common.model.TransportErrorKind;

import java.time.Duration;

/**
 * Wait before the next exchange, after exchange number {@code attempt} (1-based) failed.
 *
 * <pre>
 *   RATE_LIMITED  → base · 2^attempt
 *   other kinds   → base · attempt
 * </pre>
 */
public final class BackoffPolicy {

    private static final int MAX_SHIFT = 16;

    private BackoffPolicy() {}

    public static Duration delayFor(TransportErrorKind kind, Duration base, int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        if (kind == TransportErrorKind.RATE_LIMITED) {
            return base.multipliedBy(1L << Math.min(attempt, MAX_SHIFT));
        }
        return base.multipliedBy(attempt);
    }
}
