package com.resonanceloop.engine.transport;

import java.time.Duration;

/**
 * @param maxRetries     total exchanges allowed per {@code send}, first try included
 * @param baseDelay      backoff unit
 * @param requestTimeout hard timeout of each single exchange
 */
public record TransportSettings(
    int maxRetries,
    Duration baseDelay,
    Duration requestTimeout
) {
    public TransportSettings {
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1, got " + maxRetries);
        if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must not be negative");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }
}
