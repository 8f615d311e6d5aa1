package com.resonanceloop.engine.convergence;

import java.time.Duration;

/**
 * Engine-wide defaults; a {@code ConvergencePair} may override attempts and threshold.
 */
public record ConvergenceSettings(
    int maxAttempts,
    double threshold,
    Duration interAttemptDelay
) {
    public ConvergenceSettings {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0,1], got " + threshold);
        }
        if (interAttemptDelay.isNegative()) throw new IllegalArgumentException("interAttemptDelay must not be negative");
    }
}
