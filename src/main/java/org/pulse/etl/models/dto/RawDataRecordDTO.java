package org.pulse.etl.models.dto;

import org.pulse.etl.models.enums.ProcessingStatus;

import java.time.Instant;
import java.util.Map;

public record RawDataRecordDTO(
        Long id,
        Long tenantId,
        Long integrationId,
        String entityType,
        String externalId,
        ProcessingStatus processingStatus,
        Map<String, Object> rawData,
        Map<String, Object> extractionMetadata,
        Map<String, Object> errorDetails,
        Instant createdAt,
        Instant processedAt
) {
}
