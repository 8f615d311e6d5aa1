package com.resonanceloop.engine.provenance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.model.FailureCause;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileProvenanceSinkTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static ConvergenceResult result(String runId) {
        return ConvergenceResult.aborted(runId, "aurora", "scenario", FailureCause.CANCELLED, 0.85, 3L, "cancelled");
    }

    @Test
    @DisplayName("each result is appended as one JSON line")
    void appendsJsonLines() throws Exception {
        FileProvenanceSink sink = new FileProvenanceSink(objectMapper, dir.resolve("nested"));

        sink.append(result("run-1"));
        sink.append(result("run-2"));

        List<String> lines = Files.readAllLines(sink.file(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.path("runId").asText()).isEqualTo("run-1");
        assertThat(first.path("cause").asText()).isEqualTo("CANCELLED");
        assertThat(first.path("completedAt").isTextual()).isTrue();
        assertThat(sink.file().getFileName().toString()).isEqualTo(FileProvenanceSink.FILE_NAME);
    }

    @Test
    @DisplayName("persist writes asynchronously without blocking the caller")
    void persistIsAsynchronous() throws Exception {
        FileProvenanceSink sink = new FileProvenanceSink(objectMapper, dir);

        sink.persist(result("run-async"));

        long deadline = System.currentTimeMillis() + 5_000;
        while (!Files.exists(sink.file()) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(Files.readString(sink.file(), StandardCharsets.UTF_8)).contains("run-async");
    }
}
