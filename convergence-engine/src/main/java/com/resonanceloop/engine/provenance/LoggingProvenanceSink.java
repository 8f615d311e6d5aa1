package com.resonanceloop.engine.provenance;

import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.provenance.ProvenanceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Selected by {@code provenance.sink=none}: nothing is stored, the run is only logged. */
public class LoggingProvenanceSink implements ProvenanceSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingProvenanceSink.class);

    @Override
    public void persist(ConvergenceResult result) {
        log.info("[Provenance] Persistence disabled. runId={} profile={} bestOverall={}",
                 result.runId(), result.profileId(), result.bestOverall());
    }
}
