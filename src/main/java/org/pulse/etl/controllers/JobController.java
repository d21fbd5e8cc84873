package org.pulse.etl.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.InvalidJobStateException;
import org.pulse.etl.exceptions.JobNotFoundException;
import org.pulse.etl.models.dto.JobStatusDTO;
import org.pulse.etl.models.dto.ScheduleUpdateRequest;
import org.pulse.etl.service.events.SseJobEventBroadcaster;
import org.pulse.etl.service.orchestration.OrchestratorService;
import org.pulse.etl.service.registry.JobRegistryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.function.Supplier;

/**
 * Operator controls. None of these endpoints read or write checkpoint data.
 */
@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobRegistryService jobRegistryService;
    private final OrchestratorService orchestratorService;
    private final SseJobEventBroadcaster eventBroadcaster;

    @GetMapping
    public ResponseEntity<List<JobStatusDTO>> listJobs() {
        return ResponseEntity.ok(jobRegistryService.listJobs());
    }

    @GetMapping("/{id}")
    public ResponseEntity<JobStatusDTO> getJob(@PathVariable Long id) {
        return ResponseEntity.ok(handle(() -> jobRegistryService.describe(id)));
    }

    @PostMapping("/{id}/trigger")
    public ResponseEntity<JobStatusDTO> triggerNow(@PathVariable Long id) {
        log.info("Manual trigger requested for job {}", id);
        return ResponseEntity.accepted().body(handle(() -> orchestratorService.triggerNow(id)));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<JobStatusDTO> pause(@PathVariable Long id) {
        return ResponseEntity.ok(handle(() -> jobRegistryService.toDto(jobRegistryService.pause(id))));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<JobStatusDTO> resume(@PathVariable Long id) {
        return ResponseEntity.ok(handle(() -> jobRegistryService.toDto(jobRegistryService.resume(id))));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<JobStatusDTO> stop(@PathVariable Long id) {
        log.info("Stop requested for job {}", id);
        return ResponseEntity.accepted().body(handle(() -> orchestratorService.stop(id)));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<JobStatusDTO> deactivate(@PathVariable Long id) {
        return ResponseEntity.ok(handle(() -> jobRegistryService.toDto(jobRegistryService.deactivate(id))));
    }

    @PutMapping("/{id}/schedule")
    public ResponseEntity<JobStatusDTO> updateSchedule(@PathVariable Long id,
                                                       @Valid @RequestBody ScheduleUpdateRequest request) {
        return ResponseEntity.ok(handle(() -> jobRegistryService.toDto(jobRegistryService.updateSchedule(id,
                request.scheduleIntervalMinutes(), request.retryIntervalMinutes()))));
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return eventBroadcaster.subscribe();
    }

    private static <T> T handle(Supplier<T> action) {
        try {
            return action.get();
        } catch (JobNotFoundException exception) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, exception.getMessage(), exception);
        } catch (InvalidJobStateException exception) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, exception.getMessage(), exception);
        } catch (IllegalArgumentException | IllegalStateException exception) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, exception.getMessage(), exception);
        }
    }
}
