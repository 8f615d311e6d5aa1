package com.resonanceloop.engine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.resonanceloop.common.model.ConvergencePair;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.model.ConvergenceStatus;
import com.resonanceloop.common.model.FailureCause;
import com.resonanceloop.engine.convergence.ConvergenceController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConvergenceCommandLineRunnerTest {

    @Mock ConvergenceController controller;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private ConvergenceCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        runner = new ConvergenceCommandLineRunner(controller, objectMapper,
                                                  new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private static ConvergenceResult result(ConvergenceStatus status) {
        FailureCause cause = status == ConvergenceStatus.SUCCESS ? FailureCause.NONE : FailureCause.CONVERGENCE_EXHAUSTED;
        return new ConvergenceResult("run-cli", "aurora", "hard day", status, cause, null, List.of(), 2,
                                     status == ConvergenceStatus.SUCCESS ? 2 : null, 0.9, 0.85, 4L,
                                     "finished", Instant.now());
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("converged run prints the result and exits 0")
    void success() throws Exception {
        when(controller.converge(any())).thenReturn(Mono.just(result(ConvergenceStatus.SUCCESS)));

        runner.run(new DefaultApplicationArguments("--profile=aurora", "--scenario=hard day",
                                                   "--attempts=4", "--threshold=0.8"));

        ArgumentCaptor<ConvergencePair> pair = ArgumentCaptor.forClass(ConvergencePair.class);
        verify(controller).converge(pair.capture());
        assertThat(pair.getValue()).isEqualTo(new ConvergencePair("aurora", "hard day", 4, 0.8));
        assertThat(runner.getExitCode()).isZero();
        assertThat(output()).contains("\"runId\" : \"run-cli\"");
    }

    @Test
    @DisplayName("run that does not converge exits 1")
    void notConverged() throws Exception {
        when(controller.converge(any())).thenReturn(Mono.just(result(ConvergenceStatus.FAILURE)));

        runner.run(new DefaultApplicationArguments("--profile=aurora", "--scenario=hard day"));

        assertThat(runner.getExitCode()).isEqualTo(ConvergenceCommandLineRunner.EXIT_NOT_CONVERGED);
    }

    @Test
    @DisplayName("missing scenario or malformed number prints usage and exits 2")
    void usageErrors() throws Exception {
        runner.run(new DefaultApplicationArguments("--profile=aurora"));
        assertThat(runner.getExitCode()).isEqualTo(ConvergenceCommandLineRunner.EXIT_USAGE);

        runner.run(new DefaultApplicationArguments("--profile=aurora", "--scenario=x", "--attempts=three"));
        assertThat(runner.getExitCode()).isEqualTo(ConvergenceCommandLineRunner.EXIT_USAGE);
        assertThat(output()).contains("usage:");
        verifyNoInteractions(controller);
    }
}
