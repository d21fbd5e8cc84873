package org.pulse.etl.models.dto;

import org.pulse.etl.models.enums.JobType;

import java.time.Instant;
import java.util.Map;

/**
 * One page fetch. {@code scope} names what is paginated: a project key, a
 * repository name, or a pull request node id for nested collections.
 */
public record ExtractionRequest(
        JobType jobType,
        String entityType,
        String scope,
        String cursor,
        Instant since,
        Map<String, Object> config
) {
}
