package org.pulse.etl.service.orchestration;

import org.pulse.etl.models.dto.ExtractionOutcome;
import org.pulse.etl.models.enums.JobStatus;

import java.time.Instant;

public record JobRunCompletedEvent(
        Long jobId,
        String jobName,
        ExtractionOutcome.Status outcome,
        JobStatus status,
        Instant nextRunAt
) {
}
