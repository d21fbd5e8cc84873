package org.pulse.etl.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.models.dto.OrchestratorIntervalRequest;
import org.pulse.etl.models.dto.OrchestratorStatusDTO;
import org.pulse.etl.service.orchestration.OrchestratorScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

/**
 * Runtime switches for the periodic orchestrator. Jobs already running are not affected.
 */
@Slf4j
@RestController
@RequestMapping("/api/orchestrator")
@RequiredArgsConstructor
public class OrchestratorController {

    private final OrchestratorScheduler orchestratorScheduler;

    @GetMapping
    public ResponseEntity<OrchestratorStatusDTO> status() {
        return ResponseEntity.ok(orchestratorScheduler.status());
    }

    @PostMapping("/enable")
    public ResponseEntity<OrchestratorStatusDTO> enable() {
        log.info("Orchestrator enable requested");
        return ResponseEntity.ok(orchestratorScheduler.enable());
    }

    @PostMapping("/disable")
    public ResponseEntity<OrchestratorStatusDTO> disable() {
        log.info("Orchestrator disable requested");
        return ResponseEntity.ok(orchestratorScheduler.disable());
    }

    @PutMapping("/interval")
    public ResponseEntity<OrchestratorStatusDTO> updateInterval(@Valid @RequestBody OrchestratorIntervalRequest request) {
        return ResponseEntity.ok(orchestratorScheduler.updateInterval(Duration.ofMinutes(request.intervalMinutes())));
    }
}
