package com.resonanceloop.engine.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.resonanceloop.common.model.ConvergencePair;

import java.util.List;

public record BatchRequest(
    @JsonProperty("pairs") List<ConvergencePair> pairs,
    @JsonProperty("maxConcurrent") Integer maxConcurrent   // null → batch.max-concurrent
) {}
