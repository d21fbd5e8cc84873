package org.pulse.etl.service.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.CheckpointCorruptedException;
import org.pulse.etl.exceptions.JobNotFoundException;
import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobType;
import org.pulse.etl.repository.EtlJobRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes {@code etl_jobs.checkpoint_data}. Writes run in their own
 * transaction so that a checkpoint saved from an exception handler survives the
 * rollback of whatever the caller was doing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckpointService {

    public static final String TIMESTAMP_FIELD = "checkpoint_timestamp";
    public static final String PHASE_FIELD = "checkpoint_phase";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final EtlJobRepository etlJobRepository;
    private final List<CheckpointSchema> schemas;
    private final ObjectMapper objectMapper;

    /**
     * Merges {@code partial} into the stored document. A {@code null} value removes the key.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Map<String, Object> save(Long jobId, Map<String, Object> partial, String phase) {
        EtlJob job = etlJobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        Map<String, Object> merged = new LinkedHashMap<>(Optional.ofNullable(job.getCheckpointData()).orElse(Map.of()));
        partial.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        merged.put(TIMESTAMP_FIELD, Instant.now().toString());
        merged.put(PHASE_FIELD, phase);

        job.setCheckpointData(merged);
        etlJobRepository.save(job);
        log.info("Checkpoint saved for job {} at phase {}", job.getName(), phase);
        return merged;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Map<String, Object> save(Long jobId, CheckpointDocument document, String phase) {
        return save(jobId, objectMapper.convertValue(document, MAP_TYPE), phase);
    }

    @Transactional(readOnly = true)
    public Optional<CheckpointDocument> load(Long jobId) {
        EtlJob job = etlJobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return read(job.getJobType(), job.getCheckpointData());
    }

    public Optional<CheckpointDocument> read(JobType jobType, Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Optional.empty();
        }
        Class<? extends CheckpointDocument> documentType = schemaFor(jobType).documentType();
        try {
            return Optional.of(objectMapper.convertValue(data, documentType));
        } catch (IllegalArgumentException exception) {
            throw new CheckpointCorruptedException(
                    "Checkpoint for " + jobType + " job cannot be read as " + documentType.getSimpleName(), exception);
        }
    }

    public boolean validate(CheckpointDocument document, JobType jobType) {
        List<String> missing = schemaFor(jobType).missingFields(document);
        if (!missing.isEmpty()) {
            log.warn("Checkpoint for {} job is missing required fields {}", jobType, missing);
        }
        return missing.isEmpty();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void clear(Long jobId) {
        EtlJob job = etlJobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getCheckpointData() != null) {
            job.setCheckpointData(null);
            etlJobRepository.save(job);
            log.info("Checkpoint cleared for job {}", job.getName());
        }
    }

    private CheckpointSchema schemaFor(JobType jobType) {
        return schemas.stream()
                .filter(schema -> schema.supports(jobType.getCheckpointStyle()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No checkpoint schema for " + jobType.getCheckpointStyle()));
    }
}
