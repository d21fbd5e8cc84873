package org.pulse.etl.service.recovery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.CheckpointCorruptedException;
import org.pulse.etl.exceptions.ExtractionCancelledException;
import org.pulse.etl.exceptions.RateLimitedException;
import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.checkpoint.CursorCheckpoint;
import org.pulse.etl.models.dto.ExtractionOutcome;
import org.pulse.etl.models.dto.QueueMessage;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.CheckpointStyle;
import org.pulse.etl.models.enums.RecoveryMode;
import org.pulse.etl.service.checkpoint.CheckpointService;
import org.pulse.etl.service.events.JobEventPublisher;
import org.pulse.etl.service.extraction.CancellationToken;
import org.pulse.etl.service.extraction.ExtractionClient;
import org.pulse.etl.service.extraction.ExtractionContext;
import org.pulse.etl.service.extraction.ExtractionStrategy;
import org.pulse.etl.service.extraction.TransientRetryExecutor;
import org.pulse.etl.service.progress.ProgressTracker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides where a run starts from and turns whatever the extraction does into an
 * {@link ExtractionOutcome}. No exception escapes {@link #run}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryService {

    private final CheckpointService checkpointService;
    private final List<ExtractionStrategy> strategies;
    private final ObjectProvider<ExtractionClient> clients;
    private final TransientRetryExecutor retryExecutor;
    private final JobEventPublisher eventPublisher;

    public RecoveryPlan plan(EtlJob job) {
        Optional<CheckpointDocument> stored = checkpointService.read(job.getJobType(), job.getCheckpointData());
        if (stored.isEmpty()) {
            log.info("Job {}: no checkpoint, fresh start", job.getName());
            return new RecoveryPlan(RecoveryMode.FRESH_START, null, job.getLastSuccessAt());
        }

        CheckpointDocument checkpoint = stored.get();
        if (!checkpointService.validate(checkpoint, job.getJobType())) {
            log.warn("Job {}: checkpoint is incomplete, discarding it and starting fresh", job.getName());
            checkpointService.clear(job.getId());
            return new RecoveryPlan(RecoveryMode.FRESH_START, null, job.getLastSuccessAt());
        }

        if (job.getJobType().getCheckpointStyle() == CheckpointStyle.RESTART) {
            log.info("Job {}: checkpoint from {} ({}) discarded, restarting full extraction",
                    job.getName(), checkpoint.getCheckpointTimestamp(), checkpoint.getInterruption());
            checkpointService.clear(job.getId());
            return new RecoveryPlan(RecoveryMode.RESTART, null, job.getLastSuccessAt());
        }

        Instant since = checkpoint instanceof CursorCheckpoint cursor && cursor.getLastRepoSyncCheckpoint() != null
                ? cursor.getLastRepoSyncCheckpoint()
                : job.getLastSuccessAt();
        log.info("Job {}: resuming from checkpoint saved at {} during {} ({})", job.getName(),
                checkpoint.getCheckpointTimestamp(), checkpoint.getCheckpointPhase(), checkpoint.getInterruption());
        return new RecoveryPlan(RecoveryMode.CHECKPOINT_RESUME, checkpoint, since);
    }

    public ExtractionOutcome run(EtlJob job, CancellationToken cancellationToken) {
        RecoveryPlan plan;
        try {
            plan = plan(job);
        } catch (CheckpointCorruptedException exception) {
            log.error("Job {}: checkpoint is corrupted", job.getName(), exception);
            return ExtractionOutcome.critical(exception.getMessage());
        }

        Optional<ExtractionClient> client = clients.orderedStream()
                .filter(candidate -> candidate.supports(job.getJobType()))
                .findFirst();
        if (client.isEmpty()) {
            return ExtractionOutcome.critical("No extraction client is registered for " + job.getJobType() + " jobs");
        }
        ExtractionStrategy strategy = strategies.stream()
                .filter(candidate -> candidate.supports(job.getJobType().getCheckpointStyle()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No extraction strategy for " + job.getJobType()));

        if (job.getRetryCount() > 0) {
            log.info("Job {}: retry attempt {} ({})", job.getName(), job.getRetryCount(), plan.mode());
        }

        ExtractionContext context = ExtractionContext.builder()
                .job(job)
                .mode(plan.mode())
                .resumeCheckpoint(plan.checkpoint())
                .since(plan.since())
                .runToken(UUID.randomUUID().toString())
                .priority(priorityOf(job))
                .client(client.get())
                .cancellationToken(cancellationToken)
                .retryExecutor(retryExecutor)
                .progressTracker(new ProgressTracker(job.getJobType().totalSteps()))
                .eventPublisher(eventPublisher)
                .build();

        try {
            strategy.extract(context);
            checkpointService.clear(job.getId());
            log.info("Job {} extracted {} items in {} pages", job.getName(), context.itemCount(), context.pageCount());
            return ExtractionOutcome.completed(context.pageCount(), context.itemCount());
        } catch (RateLimitedException exception) {
            log.warn("Job {} rate limited ({}), resets at {}", job.getName(), exception.getMessage(), exception.getResetAt());
            return ExtractionOutcome.rateLimited(exception.getMessage(), exception.getResetAt(),
                    context.pageCount(), context.itemCount());
        } catch (ExtractionCancelledException exception) {
            return ExtractionOutcome.interrupted(exception.getMessage(), context.pageCount(), context.itemCount());
        } catch (CheckpointCorruptedException exception) {
            log.error("Job {}: checkpoint is corrupted", job.getName(), exception);
            return ExtractionOutcome.critical(exception.getMessage());
        } catch (RuntimeException exception) {
            log.error("Job {} extraction failed", job.getName(), exception);
            discardRestartCheckpoint(job);
            return ExtractionOutcome.failed(summarize(exception), context.pageCount(), context.itemCount());
        }
    }

    private void discardRestartCheckpoint(EtlJob job) {
        if (job.getJobType().getCheckpointStyle() != CheckpointStyle.RESTART) {
            return;
        }
        try {
            checkpointService.clear(job.getId());
        } catch (RuntimeException exception) {
            log.warn("Job {}: could not clear checkpoint after failure: {}", job.getName(), exception.getMessage());
        }
    }

    private static int priorityOf(EtlJob job) {
        Object configured = job.getExtractionConfig() == null ? null : job.getExtractionConfig().get("priority");
        return configured instanceof Number number ? number.intValue() : QueueMessage.DEFAULT_PRIORITY;
    }

    private static String summarize(Throwable exception) {
        String message = exception.getMessage();
        return exception.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
