package com.resonanceloop.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One immutable snapshot of the outgoing request.
 *
 * <p>Mutation never edits a request in place: {@link #revise(String, String)} returns the
 * next snapshot in the lineage with {@code revision + 1} and the strategy tag appended.
 */
public record Request(
    @JsonProperty("prompt") String prompt,
    @JsonProperty("directive") String directive,       // system directive, may be null
    @JsonProperty("revision") int revision,
    @JsonProperty("appliedStrategies") List<String> appliedStrategies
) {
    public Request {
        Objects.requireNonNull(prompt, "prompt");
        appliedStrategies = appliedStrategies == null ? List.of() : List.copyOf(appliedStrategies);
    }

    public static Request initial(String prompt, String directive) {
        return new Request(prompt, directive, 0, List.of());
    }

    public Request revise(String nextPrompt, String strategyTag) {
        List<String> lineage = new ArrayList<>(appliedStrategies);
        lineage.add(strategyTag);
        return new Request(nextPrompt, directive, revision + 1, lineage);
    }
}
