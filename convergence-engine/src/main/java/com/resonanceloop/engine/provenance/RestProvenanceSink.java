package com.resonanceloop.engine.provenance;

import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.provenance.ProvenanceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sends each result to an external provenance service via HTTP POST (fire-and-forget).
 */
public class RestProvenanceSink implements ProvenanceSink {

    private static final Logger log = LoggerFactory.getLogger(RestProvenanceSink.class);

    static final String RUNS_PATH = "/api/v1/provenance/runs";

    private final WebClient provenanceClient;

    public RestProvenanceSink(WebClient provenanceClient) {
        this.provenanceClient = provenanceClient;
    }

    @Override
    public void persist(ConvergenceResult result) {
        provenanceClient.post()
            .uri(RUNS_PATH)
            .header("X-Run-Id", result.runId())
            .bodyValue(result)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("[Provenance] Run published. runId={} status={}",
                                result.runId(), r.getStatusCode()),
                err -> log.warn("[Provenance] Run publish failed (non-critical). runId={}",
                                result.runId(), err)
            );
    }
}
