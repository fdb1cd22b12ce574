package com.firesim.dispatch.api;

import com.firesim.core.engine.GenerationOrchestrator;
import com.firesim.core.model.GenerationRequest;
import com.firesim.core.model.GenerationResult;
import com.firesim.core.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for generation run lifecycle.
 */
@RestController
@RequestMapping("/api/v1/generations")
public class GenerationController {

    private static final Logger log = LoggerFactory.getLogger(GenerationController.class);

    private final GenerationOrchestrator orchestrator;

    public GenerationController(GenerationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * POST /api/v1/generations: Start a run. Returns 202 with the run id; work continues asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startGeneration(@RequestBody GenerationRequest request) {
        if (request.perimeter() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Fire perimeter is required"));
        }
        if (request.inputs() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Scenario inputs are required"));
        }
        if (request.requestedViews().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one viewpoint must be requested"));
        }

        String runId;
        try {
            runId = orchestrator.start(request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        log.info("Accepted generation run {}", runId);
        return ResponseEntity.accepted().body(Map.of(
                "run_id", runId,
                "status", RunStatus.PENDING.wireValue()
        ));
    }

    /**
     * GET /api/v1/generations/{runId}/status: Live progress, including after a restart.
     */
    @GetMapping("/{runId}/status")
    public ResponseEntity<GenerationStatusResponse> getStatus(@PathVariable String runId) {
        return orchestrator.getStatus(runId)
                .map(GenerationStatusResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/generations/{runId}/results: Final result shape; non-terminal status means not ready yet.
     */
    @GetMapping("/{runId}/results")
    public ResponseEntity<GenerationResult> getResults(@PathVariable String runId) {
        return orchestrator.getResults(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
