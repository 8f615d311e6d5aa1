package com.resonanceloop.engine.provenance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.provenance.ProvenanceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends each result as one JSON line to {@code convergence-runs.jsonl} in the configured
 * directory. Writes run on {@code boundedElastic} and are serialized on this instance.
 */
public class FileProvenanceSink implements ProvenanceSink {

    private static final Logger log = LoggerFactory.getLogger(FileProvenanceSink.class);

    static final String FILE_NAME = "convergence-runs.jsonl";

    private final ObjectMapper objectMapper;
    private final Path file;

    public FileProvenanceSink(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.file = directory.resolve(FILE_NAME);
    }

    public Path file() {
        return file;
    }

    @Override
    public void persist(ConvergenceResult result) {
        Mono.fromCallable(() -> append(result))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                path -> log.info("[Provenance] Run persisted. runId={} file={}", result.runId(), path),
                err  -> log.warn("[Provenance] Run persist failed (non-critical). runId={}", result.runId(), err)
            );
    }

    synchronized Path append(ConvergenceResult result) throws IOException {
        String line = objectMapper.writeValueAsString(result) + System.lineSeparator();
        Files.createDirectories(file.getParent());
        Files.writeString(file, line, StandardCharsets.UTF_8,
                          StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        return file;
    }
}
