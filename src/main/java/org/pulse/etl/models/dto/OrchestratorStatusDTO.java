package org.pulse.etl.models.dto;

import java.time.Instant;

public record OrchestratorStatusDTO(
        boolean enabled,
        long intervalMinutes,
        boolean fastRetryEnabled,
        Instant lastCycleAt,
        Instant nextCycleAt
) {
}
