package com.resonanceloop.engine.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CompareRequest(
    @JsonProperty("scenario") String scenario,
    @JsonProperty("profileIds") List<String> profileIds,
    @JsonProperty("maxAttempts") Integer maxAttempts,
    @JsonProperty("threshold") Double threshold,
    @JsonProperty("maxConcurrent") Integer maxConcurrent
) {}
