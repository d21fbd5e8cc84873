package org.pulse.etl.service.recovery;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pulse.etl.TestObjects;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.exceptions.CheckpointCorruptedException;
import org.pulse.etl.exceptions.ExtractionCancelledException;
import org.pulse.etl.exceptions.RateLimitedException;
import org.pulse.etl.models.checkpoint.CursorCheckpoint;
import org.pulse.etl.models.checkpoint.RestartCheckpoint;
import org.pulse.etl.models.dto.ExtractionOutcome;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.models.enums.JobType;
import org.pulse.etl.models.enums.RecoveryMode;
import org.pulse.etl.service.checkpoint.CheckpointService;
import org.pulse.etl.service.events.JobEventPublisher;
import org.pulse.etl.service.extraction.CancellationToken;
import org.pulse.etl.service.extraction.ExtractionClient;
import org.pulse.etl.service.extraction.ExtractionContext;
import org.pulse.etl.service.extraction.ExtractionStrategy;
import org.pulse.etl.service.extraction.ScriptedExtractionClient;
import org.pulse.etl.service.extraction.TransientRetryExecutor;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecoveryServiceTest {

    private static final Instant LAST_SUCCESS = Instant.parse("2024-06-01T00:00:00Z");

    @Mock
    private CheckpointService checkpointService;
    @Mock
    private ExtractionStrategy strategy;
    @Mock
    private ObjectProvider<ExtractionClient> clients;

    private RecoveryService recoveryService;
    private EtlJob githubJob;
    private EtlJob jiraJob;

    @BeforeEach
    void setUp() {
        recoveryService = new RecoveryService(checkpointService, List.of(strategy), clients,
                new TransientRetryExecutor(new EtlProperties()), new JobEventPublisher(List.of(), Runnable::run));
        githubJob = TestObjects.job(1L, "github_sync", JobType.GITHUB, JobStatus.RUNNING);
        githubJob.setLastSuccessAt(LAST_SUCCESS);
        jiraJob = TestObjects.job(2L, "jira_sync", JobType.JIRA, JobStatus.RUNNING);
        jiraJob.setLastSuccessAt(LAST_SUCCESS);
    }

    @Test
    void plan_shouldStartFreshWithoutCheckpoint() {
        when(checkpointService.read(JobType.GITHUB, null)).thenReturn(Optional.empty());

        RecoveryPlan plan = recoveryService.plan(githubJob);

        assertThat(plan.mode()).isEqualTo(RecoveryMode.FRESH_START);
        assertThat(plan.since()).isEqualTo(LAST_SUCCESS);
    }

    @Test
    void plan_shouldDiscardIncompleteCheckpoint() {
        CursorCheckpoint incomplete = new CursorCheckpoint();
        githubJob.setCheckpointData(Map.of("last_pr_cursor", "c1"));
        when(checkpointService.read(JobType.GITHUB, githubJob.getCheckpointData())).thenReturn(Optional.of(incomplete));
        when(checkpointService.validate(incomplete, JobType.GITHUB)).thenReturn(false);

        RecoveryPlan plan = recoveryService.plan(githubJob);

        assertThat(plan.mode()).isEqualTo(RecoveryMode.FRESH_START);
        assertThat(plan.checkpoint()).isNull();
        verify(checkpointService).clear(1L);
    }

    @Test
    void plan_shouldResumeCursorCheckpointFromItsSyncPoint() {
        CursorCheckpoint checkpoint = CursorCheckpoint.forRepositories(List.of("acme/api"));
        checkpoint.setLastRepoSyncCheckpoint(Instant.parse("2024-05-20T00:00:00Z"));
        githubJob.setCheckpointData(Map.of("repo_processing_queue", List.of()));
        when(checkpointService.read(JobType.GITHUB, githubJob.getCheckpointData())).thenReturn(Optional.of(checkpoint));
        when(checkpointService.validate(checkpoint, JobType.GITHUB)).thenReturn(true);

        RecoveryPlan plan = recoveryService.plan(githubJob);

        assertThat(plan.mode()).isEqualTo(RecoveryMode.CHECKPOINT_RESUME);
        assertThat(plan.checkpoint()).isSameAs(checkpoint);
        assertThat(plan.since()).isEqualTo(Instant.parse("2024-05-20T00:00:00Z"));
        verify(checkpointService, never()).clear(any());
    }

    @Test
    void plan_shouldClearRestartCheckpointAndRestart() {
        RestartCheckpoint checkpoint = new RestartCheckpoint();
        jiraJob.setCheckpointData(Map.of("total_processed", 40));
        when(checkpointService.read(JobType.JIRA, jiraJob.getCheckpointData())).thenReturn(Optional.of(checkpoint));
        when(checkpointService.validate(checkpoint, JobType.JIRA)).thenReturn(true);

        RecoveryPlan plan = recoveryService.plan(jiraJob);

        assertThat(plan.mode()).isEqualTo(RecoveryMode.RESTART);
        assertThat(plan.checkpoint()).isNull();
        assertThat(plan.since()).isEqualTo(LAST_SUCCESS);
        verify(checkpointService).clear(2L);
    }

    @Test
    void run_shouldReportCriticalForCorruptedCheckpoint() {
        when(checkpointService.read(any(), any())).thenThrow(new CheckpointCorruptedException("unreadable", null));

        ExtractionOutcome outcome = recoveryService.run(githubJob, new CancellationToken());

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.CRITICAL);
        verify(strategy, never()).extract(any());
    }

    @Test
    void run_shouldReportCriticalWithoutClient() {
        when(checkpointService.read(any(), any())).thenReturn(Optional.empty());
        when(clients.orderedStream()).thenReturn(Stream.empty());

        ExtractionOutcome outcome = recoveryService.run(githubJob, new CancellationToken());

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.CRITICAL);
        assertThat(outcome.message()).isEqualTo("No extraction client is registered for GITHUB jobs");
    }

    @Test
    void run_shouldClearCheckpointAfterSuccess() {
        givenFreshRun(githubJob);
        githubJob.getExtractionConfig().put("priority", 2);

        ExtractionOutcome outcome = recoveryService.run(githubJob, new CancellationToken());

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.COMPLETED);
        ArgumentCaptor<ExtractionContext> context = ArgumentCaptor.forClass(ExtractionContext.class);
        verify(strategy).extract(context.capture());
        assertThat(context.getValue().getPriority()).isEqualTo(2);
        assertThat(context.getValue().getMode()).isEqualTo(RecoveryMode.FRESH_START);
        verify(checkpointService).clear(1L);
    }

    @Test
    void run_shouldKeepCheckpointWhenRateLimited() {
        givenFreshRun(githubJob);
        Instant resetAt = Instant.now().plusSeconds(900);
        doThrow(new RateLimitedException("quota", resetAt, "pull_requests")).when(strategy).extract(any());

        ExtractionOutcome outcome = recoveryService.run(githubJob, new CancellationToken());

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.RATE_LIMITED);
        assertThat(outcome.resetAt()).isEqualTo(resetAt);
        verify(checkpointService, never()).clear(any());
    }

    @Test
    void run_shouldReportInterruptedWhenStopped() {
        givenFreshRun(githubJob);
        doThrow(new ExtractionCancelledException("github_sync")).when(strategy).extract(any());

        ExtractionOutcome outcome = recoveryService.run(githubJob, new CancellationToken());

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.INTERRUPTED);
        verify(checkpointService, never()).clear(any());
    }

    @Test
    void run_shouldDiscardRestartCheckpointAfterFailure() {
        givenFreshRun(jiraJob);
        doThrow(new IllegalStateException("boom")).when(strategy).extract(any());

        ExtractionOutcome outcome = recoveryService.run(jiraJob, new CancellationToken());

        assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.FAILED);
        assertThat(outcome.message()).isEqualTo("IllegalStateException: boom");
        verify(checkpointService).clear(2L);
    }

    private void givenFreshRun(EtlJob job) {
        when(checkpointService.read(any(), any())).thenReturn(Optional.empty());
        when(clients.orderedStream()).thenReturn(Stream.of(new ScriptedExtractionClient(job.getJobType())));
        when(strategy.supports(job.getJobType().getCheckpointStyle())).thenReturn(true);
    }
}
