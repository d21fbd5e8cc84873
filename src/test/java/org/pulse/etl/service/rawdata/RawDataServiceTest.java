package org.pulse.etl.service.rawdata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pulse.etl.TestObjects;
import org.pulse.etl.exceptions.RawDataNotFoundException;
import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.dto.QueueMessage;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.models.enums.EtlStage;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.models.enums.JobType;
import org.pulse.etl.models.enums.ProcessingStatus;
import org.pulse.etl.repository.RawExtractionDataRepository;
import org.pulse.etl.service.queue.QueueManager;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.pulse.etl.TestObjects.item;

@ExtendWith(MockitoExtension.class)
class RawDataServiceTest {

    @Mock
    private RawExtractionDataRepository rawExtractionDataRepository;
    @Mock
    private QueueManager queueManager;

    private RawDataService rawDataService;

    @BeforeEach
    void setUp() {
        rawDataService = new RawDataService(rawExtractionDataRepository, queueManager);
    }

    @Test
    void store_shouldKeepPageItemsAndCursorAsPending() {
        EtlJob job = TestObjects.job(4L, "github_sync", JobType.GITHUB, JobStatus.RUNNING);
        when(rawExtractionDataRepository.save(any(RawExtractionData.class))).thenAnswer(invocation -> invocation.getArgument(0));
        ExtractionPage page = new ExtractionPage("pull_requests", List.of(item("node_id", "PR_1")), "c2");

        RawExtractionData row = rawDataService.store(job, page, "acme/api", Map.of("job_id", 4L));

        assertThat(row.getProcessingStatus()).isEqualTo(ProcessingStatus.PENDING);
        assertThat(row.getExternalId()).isEqualTo("acme/api");
        assertThat(row.getRawData())
                .containsEntry(RawDataService.ITEMS_FIELD, page.items())
                .containsEntry(RawDataService.NEXT_CURSOR_FIELD, "c2");
        assertThat(row.getCreatedAt()).isNotNull();
    }

    @Test
    void markProcessing_shouldRefuseCompletedRow() {
        when(rawExtractionDataRepository.transition(eq(7L), anyCollection(), eq(ProcessingStatus.PROCESSING))).thenReturn(0);

        assertThat(rawDataService.markProcessing(7L)).isFalse();
    }

    @Test
    void reprocess_shouldResetRowAndQueueItWithItsJob() {
        RawExtractionData row = new RawExtractionData();
        row.setId(8L);
        row.setTenantId(1L);
        row.setEntityType("issues");
        row.setProcessingStatus(ProcessingStatus.FAILED);
        row.setErrorDetails(Map.of("error", "boom"));
        row.setExtractionMetadata(Map.of(RawDataService.JOB_ID_FIELD, 3, RawDataService.JOB_TYPE_FIELD, "JIRA"));
        when(rawExtractionDataRepository.findById(8L)).thenReturn(Optional.of(row));
        when(rawExtractionDataRepository.save(row)).thenReturn(row);

        rawDataService.reprocess(8L);

        assertThat(row.getProcessingStatus()).isEqualTo(ProcessingStatus.PENDING);
        assertThat(row.getErrorDetails()).isNull();
        ArgumentCaptor<QueueMessage> message = ArgumentCaptor.forClass(QueueMessage.class);
        verify(queueManager).publish(eq(EtlStage.TRANSFORM), message.capture());
        assertThat(message.getValue().rawDataId()).isEqualTo(8L);
        assertThat(message.getValue().jobId()).isEqualTo(3L);
        assertThat(message.getValue().jobType()).isEqualTo(JobType.JIRA);
    }

    @Test
    void reprocess_shouldQueueRowWhoseJobTypeIsUnknown() {
        RawExtractionData row = new RawExtractionData();
        row.setId(11L);
        row.setTenantId(1L);
        row.setEntityType("issues");
        row.setProcessingStatus(ProcessingStatus.FAILED);
        row.setExtractionMetadata(Map.of(RawDataService.JOB_ID_FIELD, 3, RawDataService.JOB_TYPE_FIELD, "BITBUCKET"));
        when(rawExtractionDataRepository.findById(11L)).thenReturn(Optional.of(row));
        when(rawExtractionDataRepository.save(row)).thenReturn(row);

        rawDataService.reprocess(11L);

        assertThat(row.getProcessingStatus()).isEqualTo(ProcessingStatus.PENDING);
        ArgumentCaptor<QueueMessage> message = ArgumentCaptor.forClass(QueueMessage.class);
        verify(queueManager).publish(eq(EtlStage.TRANSFORM), message.capture());
        assertThat(message.getValue().rawDataId()).isEqualTo(11L);
        assertThat(message.getValue().jobId()).isEqualTo(3L);
        assertThat(message.getValue().jobType()).isNull();
    }

    @Test
    void reprocess_shouldRejectRowBeingProcessed() {
        RawExtractionData row = new RawExtractionData();
        row.setId(9L);
        row.setProcessingStatus(ProcessingStatus.PROCESSING);
        when(rawExtractionDataRepository.findById(9L)).thenReturn(Optional.of(row));

        assertThatThrownBy(() -> rawDataService.reprocess(9L)).isInstanceOf(IllegalStateException.class);
        verify(rawExtractionDataRepository, never()).save(any(RawExtractionData.class));
        verifyNoInteractions(queueManager);
    }

    @Test
    void get_shouldRaiseNotFound() {
        when(rawExtractionDataRepository.findById(10L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> rawDataService.get(10L)).isInstanceOf(RawDataNotFoundException.class);
    }
}
