package org.pulse.etl.models.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record OrchestratorIntervalRequest(
        @NotNull @Min(1) @Max(1440) Integer intervalMinutes
) {
}
