package org.pulse.etl.service.extraction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.models.enums.JobType;
import org.pulse.etl.models.enums.RecoveryMode;
import org.springframework.kafka.KafkaException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.pulse.etl.TestObjects.item;
import static org.pulse.etl.TestObjects.job;

class PageDispatcherTest {

    private ExtractionHarness harness;
    private ExtractionContext context;

    @BeforeEach
    void setUp() {
        harness = new ExtractionHarness(job(3L, "jira_sync", JobType.JIRA, JobStatus.RUNNING));
        context = harness.context(new ScriptedExtractionClient(JobType.JIRA), RecoveryMode.FRESH_START, null);
    }

    @Test
    void dispatch_shouldStoreRowThenQueueIt() {
        RawExtractionData row = harness.pageDispatcher.dispatch(context,
                new ExtractionPage("issues", List.of(item("key", "PROJ-1")), "n1"), "PROJ", null);

        assertThat(harness.batchMessages()).singleElement()
                .satisfies(message -> {
                    assertThat(message.rawDataId()).isEqualTo(row.getId());
                    assertThat(message.firstItem()).isTrue();
                    assertThat(message.lastItem()).isFalse();
                });
        verify(harness.rawDataService, never()).markFailed(anyLong(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void dispatch_shouldMarkRowFailedWhenQueueRejectsMessage() {
        doThrow(new KafkaException("broker unavailable")).when(harness.queueManager).publish(any(), any());

        assertThatThrownBy(() -> harness.pageDispatcher.dispatch(context,
                new ExtractionPage("issues", List.of(item("key", "PROJ-1")), null), "PROJ", null))
                .isInstanceOf(KafkaException.class);

        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(harness.rawDataService).markFailed(eq(1L), details.capture());
        assertThat((String) details.getValue().get("error")).contains("broker unavailable");
        assertThat(details.getValue()).containsEntry("exception", KafkaException.class.getName())
                .containsKey("failed_at");
        assertThat(harness.rows.get(1L)).isNotNull();
    }
}
