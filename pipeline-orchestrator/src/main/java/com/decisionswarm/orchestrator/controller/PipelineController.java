package com.decisionswarm.orchestrator.controller;

import com.decisionswarm.common.model.PipelineResult;
import com.decisionswarm.orchestrator.service.OrchestratorService;
import com.decisionswarm.orchestrator.service.SwarmStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final OrchestratorService orchestratorService;

    public PipelineController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/pipeline/run")
    public Mono<ResponseEntity<PipelineResult>> run(@RequestBody PipelineRunRequest request) {
        return orchestratorService.run(request.query(), request.agentTimeoutMs(),
                request.stageTimeoutMs(), request.minQuorum())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/swarms")
    public ResponseEntity<List<SwarmStatus>> swarms() {
        return ResponseEntity.ok(orchestratorService.swarmStatus());
    }

    @GetMapping("/pipeline/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("[Pipeline] rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_request", "detail", String.valueOf(e.getMessage())));
    }
}
