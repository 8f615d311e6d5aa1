package com.resonanceloop.common.mutation;

import com.resonanceloop.common.model.Request;

public record MutationResult(
    Request request,
    MutationStrategy strategy,
    String strategyTag
) {}
