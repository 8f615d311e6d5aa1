package com.resonanceloop.engine.controller;

import com.resonanceloop.common.model.ConvergencePair;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.engine.batch.BatchCoordinator;
import com.resonanceloop.engine.batch.BatchReport;
import com.resonanceloop.engine.batch.ComparisonReport;
import com.resonanceloop.engine.batch.ProfileComparisonService;
import com.resonanceloop.engine.convergence.ConvergenceController;
import com.resonanceloop.engine.stats.ConvergenceStatistics;
import com.resonanceloop.engine.transport.TransportTelemetry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/converge")
public class ConvergenceApiController {

    private final ConvergenceController convergenceController;
    private final BatchCoordinator batchCoordinator;
    private final ProfileComparisonService comparisonService;
    private final ConvergenceStatistics statistics;
    private final TransportTelemetry telemetry;

    public ConvergenceApiController(ConvergenceController convergenceController,
                                    BatchCoordinator batchCoordinator,
                                    ProfileComparisonService comparisonService,
                                    ConvergenceStatistics statistics,
                                    TransportTelemetry telemetry) {
        this.convergenceController = convergenceController;
        this.batchCoordinator = batchCoordinator;
        this.comparisonService = comparisonService;
        this.statistics = statistics;
        this.telemetry = telemetry;
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<ConvergenceResult>> run(@RequestBody ConvergencePair pair) {
        return convergenceController.converge(pair).map(ResponseEntity::ok);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchReport>> batch(@RequestBody BatchRequest request) {
        if (request.pairs() == null || request.pairs().isEmpty()) {
            return Mono.error(new IllegalArgumentException("pairs must not be empty"));
        }
        int maxConcurrent = request.maxConcurrent() != null
            ? request.maxConcurrent()
            : batchCoordinator.defaultMaxConcurrent();
        return batchCoordinator.runBatch(request.pairs(), maxConcurrent)
            .map(BatchReport::of)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/compare")
    public Mono<ResponseEntity<ComparisonReport>> compare(@RequestBody CompareRequest request) {
        int maxConcurrent = request.maxConcurrent() != null
            ? request.maxConcurrent()
            : batchCoordinator.defaultMaxConcurrent();
        return comparisonService.compare(request.scenario(), request.profileIds(),
                                         request.maxAttempts(), request.threshold(), maxConcurrent)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runs", statistics.snapshot());
        body.put("transport", telemetry.snapshot());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
