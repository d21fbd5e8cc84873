package org.pulse.etl.models.dto;

import org.pulse.etl.models.enums.ProcessingStatus;

import java.util.List;

/**
 * One page of stored batches, echoing the tenant and status filters it was read with.
 */
public record RawDataPage(
        List<RawDataRecordDTO> content,
        Long tenantId,
        ProcessingStatus status,
        long totalElements,
        int totalPages,
        int page,
        int size
) {
}
