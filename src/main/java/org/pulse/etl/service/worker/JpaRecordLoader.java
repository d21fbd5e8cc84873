package org.pulse.etl.service.worker;

import lombok.RequiredArgsConstructor;
import org.pulse.etl.models.dto.TransformedRecord;
import org.pulse.etl.models.entity.ExtractedRecord;
import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.repository.ExtractedRecordRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaRecordLoader implements RecordLoader {

    private final ExtractedRecordRepository extractedRecordRepository;

    @Override
    @Transactional
    public int upsert(RawExtractionData source, List<TransformedRecord> records) {
        Instant now = Instant.now();
        for (TransformedRecord record : records) {
            ExtractedRecord row = extractedRecordRepository
                    .findByTenantIdAndIntegrationIdAndEntityTypeAndRecordKey(
                            source.getTenantId(), source.getIntegrationId(), record.entityType(), record.recordKey())
                    .orElseGet(() -> {
                        ExtractedRecord created = new ExtractedRecord();
                        created.setTenantId(source.getTenantId());
                        created.setIntegrationId(source.getIntegrationId());
                        created.setEntityType(record.entityType());
                        created.setRecordKey(record.recordKey());
                        created.setCreatedAt(now);
                        return created;
                    });
            row.setData(record.payload());
            row.setSourceRawDataId(source.getId());
            row.setUpdatedAt(now);
            extractedRecordRepository.save(row);
        }
        return records.size();
    }
}
