package org.pulse.etl.service.worker;

import org.junit.jupiter.api.Test;
import org.pulse.etl.exceptions.RecordValidationException;
import org.pulse.etl.models.dto.TransformedRecord;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pulse.etl.TestObjects.item;

class PayloadRecordTransformerTest {

    private final PayloadRecordTransformer transformer = new PayloadRecordTransformer();

    @Test
    void transform_shouldPreferNodeIdAsRecordKey() {
        TransformedRecord record = transformer.transform("pull_requests", item("id", 5, "node_id", "PR_5"));

        assertThat(record.recordKey()).isEqualTo("PR_5");
        assertThat(record.entityType()).isEqualTo("pull_requests");
    }

    @Test
    void transform_shouldNormalizeTimestampsToUtc() {
        TransformedRecord record = transformer.transform("issues", item(
                "key", "A-1",
                "created", "2024-03-01T10:15:30.000+0200",
                "updatedAt", "2024-03-01T10:15:30+02:00",
                "fields", item("duedate", "2024-03-09", "resolutiondate", 1709288130000L),
                "comments", List.of(item("created_at", "2024-03-01T08:15:30Z")),
                "story_points", 1709288130000L));

        Map<String, Object> payload = record.payload();
        assertThat(payload)
                .containsEntry("created", "2024-03-01T08:15:30Z")
                .containsEntry("updatedAt", "2024-03-01T08:15:30Z")
                .containsEntry("story_points", 1709288130000L);
        assertThat(payload.get("fields")).isEqualTo(Map.of("duedate", "2024-03-09", "resolutiondate", "2024-03-01T10:15:30Z"));
        assertThat(payload.get("comments")).isEqualTo(List.of(Map.of("created_at", "2024-03-01T08:15:30Z")));
    }

    @Test
    void transform_shouldRejectItemWithoutIdentifier() {
        assertThatThrownBy(() -> transformer.transform("issues", item("summary", "orphan")))
                .isInstanceOf(RecordValidationException.class);
    }
}
