package org.pulse.etl.service.worker;

import org.junit.jupiter.api.Test;
import org.pulse.etl.models.dto.TransformedRecord;
import org.pulse.etl.models.entity.ExtractedRecord;
import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.repository.ExtractedRecordRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaRecordLoader.class)
class JpaRecordLoaderTest {

    @Autowired
    private JpaRecordLoader recordLoader;
    @Autowired
    private ExtractedRecordRepository extractedRecordRepository;

    @Test
    void upsert_shouldKeepOneRowPerRecordKey() {
        RawExtractionData first = source(100L);
        RawExtractionData second = source(101L);

        recordLoader.upsert(first, List.of(
                new TransformedRecord("issues", "A-1", Map.of("summary", "draft")),
                new TransformedRecord("issues", "A-2", Map.of("summary", "other"))));
        recordLoader.upsert(second, List.of(new TransformedRecord("issues", "A-1", Map.of("summary", "final"))));

        assertThat(extractedRecordRepository.countByTenantIdAndEntityType(1L, "issues")).isEqualTo(2);
        ExtractedRecord updated = extractedRecordRepository
                .findByTenantIdAndIntegrationIdAndEntityTypeAndRecordKey(1L, 10L, "issues", "A-1")
                .orElseThrow();
        assertThat(updated.getData()).containsEntry("summary", "final");
        assertThat(updated.getSourceRawDataId()).isEqualTo(101L);
    }

    private static RawExtractionData source(Long id) {
        RawExtractionData row = new RawExtractionData();
        row.setId(id);
        row.setTenantId(1L);
        row.setIntegrationId(10L);
        row.setEntityType("issues");
        return row;
    }
}
