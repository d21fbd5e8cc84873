package org.pulse.etl.service.orchestration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pulse.etl.TestObjects;
import org.pulse.etl.models.dto.ExtractionOutcome;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.models.enums.JobType;
import org.pulse.etl.service.events.JobEventPublisher;
import org.pulse.etl.service.extraction.CancellationRegistry;
import org.pulse.etl.service.extraction.CancellationToken;
import org.pulse.etl.service.recovery.RecoveryService;
import org.pulse.etl.service.registry.JobRegistryService;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionRunnerTest {

    @Mock
    private RecoveryService recoveryService;
    @Mock
    private JobRegistryService jobRegistryService;
    @Mock
    private JobEventPublisher jobEventPublisher;
    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private CancellationRegistry cancellationRegistry;
    private ExtractionRunner extractionRunner;
    private EtlJob job;
    private CancellationToken token;
    private Instant startedAt;

    @BeforeEach
    void setUp() {
        cancellationRegistry = new CancellationRegistry();
        extractionRunner = new ExtractionRunner(recoveryService, jobRegistryService, cancellationRegistry,
                jobEventPublisher, applicationEventPublisher);
        job = TestObjects.job(5L, "github_sync", JobType.GITHUB, JobStatus.RUNNING);
        startedAt = Instant.parse("2024-05-01T10:00:00Z");
        job.setLastRunStartedAt(startedAt);
        token = cancellationRegistry.register(5L);
    }

    @Test
    void run_shouldMarkFinishedOnCompletion() {
        EtlJob finished = TestObjects.job(5L, "github_sync", JobType.GITHUB, JobStatus.FINISHED);
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.completed(3, 42));
        when(jobRegistryService.markFinished(5L, startedAt, null)).thenReturn(Optional.of(finished));

        extractionRunner.run(job, token);

        verify(jobEventPublisher).completion(finished, JobStatus.FINISHED, "Extracted 42 items in 3 pages", null);
        ArgumentCaptor<JobRunCompletedEvent> event = ArgumentCaptor.forClass(JobRunCompletedEvent.class);
        verify(applicationEventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().outcome()).isEqualTo(ExtractionOutcome.Status.COMPLETED);
        assertThat(event.getValue().status()).isEqualTo(JobStatus.FINISHED);
        assertThat(cancellationRegistry.isRegistered(5L)).isFalse();
    }

    @Test
    void run_shouldReschedulePendingOnRateLimitWithoutCountingRetry() {
        Instant resetAt = Instant.now().plusSeconds(600);
        EtlJob pending = TestObjects.job(5L, "github_sync", JobType.GITHUB, JobStatus.PENDING);
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.rateLimited("quota", resetAt, 2, 20));
        when(jobRegistryService.markRateLimited(5L, startedAt, "quota", resetAt)).thenReturn(Optional.of(pending));

        extractionRunner.run(job, token);

        verify(jobRegistryService, never()).markFinished(any(), any(), any());
        verify(jobEventPublisher).status(eq(pending), eq(JobStatus.PENDING), eq("rate_limited"), any());
    }

    @Test
    void run_shouldReturnStoppedJobToReady() {
        EtlJob ready = TestObjects.job(5L, "github_sync", JobType.GITHUB, JobStatus.READY);
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.interrupted("stopped", 1, 1));
        when(jobRegistryService.markInterrupted(5L, startedAt, "stopped")).thenReturn(Optional.of(ready));

        Optional<EtlJob> result = extractionRunner.run(job, token);

        assertThat(result).map(EtlJob::getStatus).contains(JobStatus.READY);
    }

    @Test
    void run_shouldRecordFailureForRetry() {
        EtlJob pending = TestObjects.job(5L, "github_sync", JobType.GITHUB, JobStatus.PENDING);
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.failed("IOException: reset", 0, 0));
        when(jobRegistryService.markFinished(5L, startedAt, "IOException: reset")).thenReturn(Optional.of(pending));

        extractionRunner.run(job, token);

        verify(jobEventPublisher).exception(pending, "extraction", "IOException: reset");
        verify(jobEventPublisher).completion(pending, JobStatus.PENDING, null, "IOException: reset");
    }

    @Test
    void run_shouldFailJobPermanentlyOnCriticalOutcome() {
        EtlJob failed = TestObjects.job(5L, "github_sync", JobType.GITHUB, JobStatus.FAILED);
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.critical("corrupted"));
        when(jobRegistryService.markFailed(5L, startedAt, "corrupted")).thenReturn(Optional.of(failed));

        extractionRunner.run(job, token);

        verify(jobEventPublisher).completion(failed, JobStatus.FAILED, null, "corrupted");
    }

    @Test
    void run_shouldPropagateRegistryFailure() {
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.completed(0, 0));
        when(jobRegistryService.markFinished(5L, startedAt, null)).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> extractionRunner.run(job, token)).hasMessage("db down");
        verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
        assertThat(cancellationRegistry.isRegistered(5L)).isFalse();
    }

    @Test
    void run_shouldDropOutcomeOfRunThatWasReset() {
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.interrupted("cancelled", 1, 1));
        when(jobRegistryService.markInterrupted(5L, startedAt, "cancelled")).thenReturn(Optional.empty());

        assertThat(extractionRunner.run(job, token)).isEmpty();
        verify(jobEventPublisher, never()).status(any(), any(), any(), any());
        verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void run_shouldKeepTokenOfNewerRunRegistered() {
        CancellationToken newerRun = cancellationRegistry.register(5L);
        EtlJob finished = TestObjects.job(5L, "github_sync", JobType.GITHUB, JobStatus.FINISHED);
        when(recoveryService.run(job, token)).thenReturn(ExtractionOutcome.completed(1, 1));
        when(jobRegistryService.markFinished(5L, startedAt, null)).thenReturn(Optional.of(finished));

        extractionRunner.run(job, token);

        assertThat(cancellationRegistry.cancel(5L)).isTrue();
        assertThat(newerRun.isCancelled()).isTrue();
    }
}
