package org.pulse.etl.models.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.pulse.etl.models.enums.JobEventType;
import org.pulse.etl.models.enums.JobStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEvent(
        @JsonProperty("job_id") Long jobId,
        @JsonProperty("job_name") String jobName,
        @JsonProperty("type") JobEventType type,
        @JsonProperty("phase") String phase,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("progress_pct") Double progressPct,
        @JsonProperty("message") String message,
        @JsonProperty("error") String error,
        @JsonProperty("timestamp") Instant timestamp
) {
}
