package org.pulse.etl.models.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record RawDataStatusUpdateRequest(
        @NotBlank String status,
        Map<String, Object> errorDetails
) {
}
