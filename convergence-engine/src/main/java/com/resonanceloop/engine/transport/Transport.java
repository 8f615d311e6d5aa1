package com.resonanceloop.engine.transport;

import com.resonanceloop.common.model.Outcome;
import com.resonanceloop.common.model.Request;
import reactor.core.publisher.Mono;

/**
 * Sends one request to the Oracle with reliability retries.
 */
public interface Transport {

    /**
     * Emits exactly one {@link Outcome} and completes. Never emits an error signal:
     * every failure resolves to {@code Outcome.success() == false} with an error kind.
     */
    Mono<Outcome> send(Request request);
}
