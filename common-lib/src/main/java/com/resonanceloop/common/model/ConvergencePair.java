package com.resonanceloop.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One (profile, scenario) unit of work. A null {@code maxAttempts} or {@code threshold}
 * falls back to the engine defaults.
 */
public record ConvergencePair(
    @JsonProperty("profileId") String profileId,
    @JsonProperty("scenario") String scenario,
    @JsonProperty("maxAttempts") Integer maxAttempts,
    @JsonProperty("threshold") Double threshold
) {
    public ConvergencePair {
        if (profileId == null || profileId.isBlank()) {
            throw new IllegalArgumentException("profileId must not be blank");
        }
        if (scenario == null || scenario.isBlank()) {
            throw new IllegalArgumentException("scenario must not be blank");
        }
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (threshold != null && (threshold < 0.0 || threshold > 1.0 || threshold.isNaN())) {
            throw new IllegalArgumentException("threshold must be within [0,1], got " + threshold);
        }
    }

    public static ConvergencePair of(String profileId, String scenario) {
        return new ConvergencePair(profileId, scenario, null, null);
    }

    public int maxAttemptsOr(int fallback) {
        return maxAttempts != null ? maxAttempts : fallback;
    }

    public double thresholdOr(double fallback) {
        return threshold != null ? threshold : fallback;
    }
}
