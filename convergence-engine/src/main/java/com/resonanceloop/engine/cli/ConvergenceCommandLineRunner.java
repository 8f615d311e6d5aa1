package com.resonanceloop.engine.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonanceloop.common.model.ConvergencePair;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.engine.convergence.ConvergenceController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * One-shot command line mode, enabled with {@code --cli.enabled=true}.
 *
 * <pre>
 *   --profile=aurora --scenario="..." [--attempts=3] [--threshold=0.85]
 * </pre>
 * Prints the result as JSON. Exit code 0 on SUCCESS, 1 on FAILURE or ERROR, 2 on bad arguments.
 */
@Component
@ConditionalOnProperty(name = "cli.enabled", havingValue = "true")
public class ConvergenceCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceCommandLineRunner.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_NOT_CONVERGED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "usage: --cli.enabled=true --profile=<id> --scenario=<text> [--attempts=<n>] [--threshold=<0..1>]";

    private final ConvergenceController convergenceController;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private volatile int exitCode = EXIT_NOT_CONVERGED;

    public ConvergenceCommandLineRunner(ConvergenceController convergenceController, ObjectMapper objectMapper) {
        this(convergenceController, objectMapper, System.out);
    }

    ConvergenceCommandLineRunner(ConvergenceController convergenceController, ObjectMapper objectMapper,
                                 PrintStream out) {
        this.convergenceController = convergenceController;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        ConvergencePair pair;
        try {
            pair = new ConvergencePair(
                option(args, "profile"),
                option(args, "scenario"),
                args.containsOption("attempts") ? Integer.valueOf(option(args, "attempts")) : null,
                args.containsOption("threshold") ? Double.valueOf(option(args, "threshold")) : null);
        } catch (IllegalArgumentException e) {
            log.error("[CLI] Invalid arguments. reason={}", e.getMessage());
            out.println(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        // Command line boundary: the only place a run is awaited synchronously.
        ConvergenceResult result = convergenceController.converge(pair).block();
        if (result == null) {
            log.error("[CLI] Run completed without a result. profile={}", pair.profileId());
            exitCode = EXIT_NOT_CONVERGED;
            return;
        }
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        exitCode = result.succeeded() ? EXIT_SUCCESS : EXIT_NOT_CONVERGED;
        log.info("[CLI] Run finished. status={} exitCode={}", result.status(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
