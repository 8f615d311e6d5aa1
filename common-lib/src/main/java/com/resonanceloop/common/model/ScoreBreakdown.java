package com.resonanceloop.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-dimension resonance scores for one response.
 *
 * <p>{@code overall} is the weighted sum of {@code dimensions} under the profile's weights;
 * {@code weakestDimension} is the argmin, ties resolved by {@link ScoreDimension} order.
 */
public record ScoreBreakdown(
    @JsonProperty("dimensions") Map<ScoreDimension, Double> dimensions,
    @JsonProperty("overall") double overall,
    @JsonProperty("weakestDimension") ScoreDimension weakestDimension,
    @JsonProperty("evidence") List<String> evidence,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("wordCount") int wordCount
) {
    public ScoreBreakdown {
        Map<ScoreDimension, Double> copy = new EnumMap<>(ScoreDimension.class);
        if (dimensions != null) copy.putAll(dimensions);
        dimensions = Collections.unmodifiableMap(copy);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public double score(ScoreDimension dimension) {
        return dimensions.getOrDefault(dimension, 0.0);
    }
}
