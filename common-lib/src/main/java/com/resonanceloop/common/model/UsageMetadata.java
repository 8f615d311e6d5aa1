package com.resonanceloop.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UsageMetadata(
    @JsonProperty("model") String model,
    @JsonProperty("inputTokens") int inputTokens,
    @JsonProperty("outputTokens") int outputTokens
) {
    public static UsageMetadata none() {
        return new UsageMetadata(null, 0, 0);
    }
}
