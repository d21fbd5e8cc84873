package org.pulse.etl.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.pulse.etl.models.enums.JobType;

/**
 * Pointer message exchanged between pipeline stages. It references stored raw
 * data by id (or carries a cursor) and never the payload itself.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueueMessage(
        @JsonProperty("tenant_id") Long tenantId,
        @JsonProperty("integration_id") Long integrationId,
        @JsonProperty("job_id") Long jobId,
        @JsonProperty("job_type") JobType jobType,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("raw_data_id") Long rawDataId,
        @JsonProperty("cursor") String cursor,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("first_item") boolean firstItem,
        @JsonProperty("last_item") boolean lastItem,
        @JsonProperty("last_job_item") boolean lastJobItem,
        @JsonProperty("rate_limited") boolean rateLimited,
        @JsonProperty("token") String token
) {

    public static final int DEFAULT_PRIORITY = 5;

    public int effectivePriority() {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }
}
