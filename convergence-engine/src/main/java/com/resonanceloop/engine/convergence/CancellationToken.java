package com.resonanceloop.engine.convergence;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, polled by the controller between attempts.
 * Cancelling never interrupts an exchange already in flight.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
