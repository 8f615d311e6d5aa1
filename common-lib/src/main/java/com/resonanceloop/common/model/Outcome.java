package com.resonanceloop.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one transport-layer {@code send}, produced once and never mutated.
 *
 * <p>{@code exchanges} counts the raw Oracle exchanges the transport performed to reach
 * this outcome (1 when the first exchange succeeded).
 */
public record Outcome(
    @JsonProperty("success") boolean success,
    @JsonProperty("content") String content,
    @JsonProperty("errorKind") TransportErrorKind errorKind,     // null on success
    @JsonProperty("errorDetail") String errorDetail,
    @JsonProperty("latencyMs") long latencyMs,
    @JsonProperty("exchanges") int exchanges,
    @JsonProperty("usage") UsageMetadata usage
) {
    public static Outcome success(String content, long latencyMs, int exchanges, UsageMetadata usage) {
        return new Outcome(true, content, null, null, latencyMs, exchanges,
                           usage != null ? usage : UsageMetadata.none());
    }

    public static Outcome failure(TransportErrorKind kind, String detail, long latencyMs, int exchanges) {
        return new Outcome(false, "", kind, detail, latencyMs, exchanges, UsageMetadata.none());
    }
}
