package com.resonanceloop.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry in a run's attempt history.
 *
 * <p>{@code breakdown} is null when the transport outcome failed; such an attempt counts
 * as zero. {@code strategyTag} names the mutation that produced {@code request}, and is
 * null for the first attempt and for re-sends after a transport failure.
 */
public record AttemptRecord(
    @JsonProperty("index") int index,
    @JsonProperty("request") Request request,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("breakdown") ScoreBreakdown breakdown,
    @JsonProperty("strategyTag") String strategyTag,
    @JsonProperty("timestamp") Instant timestamp
) {
    @JsonIgnore
    public boolean scored() {
        return breakdown != null;
    }

    @JsonIgnore
    public double overall() {
        return breakdown != null ? breakdown.overall() : 0.0;
    }
}
