package com.resonanceloop.common.provenance;

import com.resonanceloop.common.model.ConvergenceResult;

/**
 * Destination for terminal results of successful runs, consumed for audit and replay.
 *
 * <p>Implementations in the engine: {@code FileProvenanceSink} (JSON lines on local disk),
 * {@code RestProvenanceSink} (HTTP POST) and {@code LoggingProvenanceSink}.
 */
public interface ProvenanceSink {

    /**
     * Hands a terminal result over for persistence.
     * Implementations MUST be non-blocking and fire-and-forget: a persistence failure is
     * reported through logs only and never surfaces to the caller.
     *
     * @param result the completed run
     */
    void persist(ConvergenceResult result);
}
