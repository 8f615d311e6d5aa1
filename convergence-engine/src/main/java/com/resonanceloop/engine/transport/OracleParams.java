package com.resonanceloop.engine.transport;

/**
 * Generation parameters forwarded unchanged with every Oracle exchange.
 */
public record OracleParams(
    String model,
    int maxTokens,
    double temperature,
    double topP
) {}
