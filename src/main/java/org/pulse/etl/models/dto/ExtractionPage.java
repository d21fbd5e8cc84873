package org.pulse.etl.models.dto;

import java.util.List;
import java.util.Map;

public record ExtractionPage(
        String entityType,
        List<Map<String, Object>> items,
        String nextCursor
) {

    public boolean hasNextPage() {
        return nextCursor != null;
    }
}
