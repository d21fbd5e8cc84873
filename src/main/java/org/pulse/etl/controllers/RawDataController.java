package org.pulse.etl.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.RawDataNotFoundException;
import org.pulse.etl.models.dto.RawDataPage;
import org.pulse.etl.models.dto.RawDataRecordDTO;
import org.pulse.etl.models.dto.RawDataStatusUpdateRequest;
import org.pulse.etl.models.enums.ProcessingStatus;
import org.pulse.etl.service.rawdata.RawDataService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/raw-data")
@RequiredArgsConstructor
public class RawDataController {

    private final RawDataService rawDataService;

    @GetMapping
    public ResponseEntity<RawDataPage> list(@RequestParam(required = false) Long tenantId,
                                            @RequestParam(required = false) String status,
                                            @RequestParam(defaultValue = "0") int page,
                                            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(rawDataService.list(tenantId, status == null ? null : parseStatus(status), page, size));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<ProcessingStatus, Long>> stats() {
        return ResponseEntity.ok(rawDataService.countsByStatus());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RawDataRecordDTO> get(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(rawDataService.getRecord(id));
        } catch (RawDataNotFoundException exception) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, exception.getMessage(), exception);
        }
    }

    @PostMapping("/{id}/reprocess")
    public ResponseEntity<RawDataRecordDTO> reprocess(@PathVariable Long id) {
        log.info("Reprocess requested for raw data {}", id);
        try {
            return ResponseEntity.accepted().body(rawDataService.reprocess(id));
        } catch (RawDataNotFoundException exception) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, exception.getMessage(), exception);
        } catch (IllegalStateException exception) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, exception.getMessage(), exception);
        }
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<RawDataRecordDTO> updateStatus(@PathVariable Long id,
                                                         @Valid @RequestBody RawDataStatusUpdateRequest request) {
        ProcessingStatus status = parseStatus(request.status());
        try {
            return ResponseEntity.ok(rawDataService.updateStatus(id, status, request.errorDetails()));
        } catch (RawDataNotFoundException exception) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, exception.getMessage(), exception);
        }
    }

    private static ProcessingStatus parseStatus(String status) {
        try {
            return ProcessingStatus.fromValue(status);
        } catch (IllegalArgumentException exception) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, exception.getMessage(), exception);
        }
    }
}
