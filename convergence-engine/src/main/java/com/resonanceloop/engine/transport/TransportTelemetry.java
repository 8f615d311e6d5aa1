package com.resonanceloop.engine.transport;

import com.resonanceloop.common.model.TransportErrorKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Monotonic counters of raw Oracle exchanges. Safe for concurrent update.
 */
public class TransportTelemetry {

    private final LongAdder exchanges = new LongAdder();
    private final LongAdder successes = new LongAdder();
    private final Map<TransportErrorKind, LongAdder> failures = new EnumMap<>(TransportErrorKind.class);

    public TransportTelemetry() {
        for (TransportErrorKind kind : TransportErrorKind.values()) {
            failures.put(kind, new LongAdder());
        }
    }

    void recordExchange() {
        exchanges.increment();
    }

    void recordSuccess() {
        successes.increment();
    }

    void recordFailure(TransportErrorKind kind) {
        failures.get(kind).increment();
    }

    public Snapshot snapshot() {
        Map<TransportErrorKind, Long> counts = new EnumMap<>(TransportErrorKind.class);
        failures.forEach((kind, adder) -> counts.put(kind, adder.sum()));
        return new Snapshot(exchanges.sum(), successes.sum(), counts);
    }

    public record Snapshot(long exchanges, long successes, Map<TransportErrorKind, Long> failures) {}
}
