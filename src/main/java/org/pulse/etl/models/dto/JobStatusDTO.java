package org.pulse.etl.models.dto;

import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.models.enums.JobType;

import java.time.Instant;

public record JobStatusDTO(
        Long id,
        String name,
        JobType jobType,
        boolean active,
        JobStatus status,
        int scheduleIntervalMinutes,
        int retryIntervalMinutes,
        int retryCount,
        String errorMessage,
        Instant lastRunStartedAt,
        Instant lastRunFinishedAt,
        Instant lastSuccessAt,
        Instant nextRunAt,
        boolean hasCheckpoint
) {
}
