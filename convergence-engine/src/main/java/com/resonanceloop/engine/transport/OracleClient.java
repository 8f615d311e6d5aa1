package com.resonanceloop.engine.transport;

import reactor.core.publisher.Mono;

/**
 * The single contract the engine depends on from the generative text service.
 *
 * <p>Non-2xx responses are emitted as a {@link RawExchange} carrying the status code.
 * Timeouts and connection failures are emitted as error signals. Classification and
 * retries belong to {@link ReliableTransport}.
 */
public interface OracleClient {

    Mono<RawExchange> sendRaw(String prompt, String directive, OracleParams params);
}
