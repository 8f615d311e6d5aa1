package com.resonanceloop.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Terminal record of one convergence run.
 *
 * <p>Built exactly once when the run terminates and owns its attempt list, which is
 * copied on construction. {@code reason} is always non-blank.
 */
public record ConvergenceResult(
    @JsonProperty("runId") String runId,
    @JsonProperty("profileId") String profileId,
    @JsonProperty("scenario") String scenario,
    @JsonProperty("status") ConvergenceStatus status,
    @JsonProperty("cause") FailureCause cause,
    @JsonProperty("bestAttempt") AttemptRecord bestAttempt,       // null when no attempt was scored
    @JsonProperty("attempts") List<AttemptRecord> attempts,
    @JsonProperty("totalAttempts") int totalAttempts,
    @JsonProperty("successfulAttempt") Integer successfulAttempt, // null unless SUCCESS
    @JsonProperty("bestOverall") double bestOverall,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("elapsedMs") long elapsedMs,
    @JsonProperty("reason") String reason,
    @JsonProperty("completedAt") Instant completedAt
) {
    public ConvergenceResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(cause, "cause");
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("a terminal result must carry a reason");
        }
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public boolean succeeded() {
        return status == ConvergenceStatus.SUCCESS;
    }

    /** Result for a run that terminated before any attempt was made. */
    public static ConvergenceResult aborted(String runId, String profileId, String scenario,
                                            FailureCause cause, double threshold,
                                            long elapsedMs, String reason) {
        return new ConvergenceResult(runId, profileId, scenario, ConvergenceStatus.ERROR, cause,
                                     null, List.of(), 0, null, 0.0, threshold,
                                     elapsedMs, reason, Instant.now());
    }
}
