package org.pulse.etl.models.dto;

import java.util.Map;

public record TransformedRecord(
        String entityType,
        String recordKey,
        Map<String, Object> payload
) {
}
