package org.pulse.etl.service.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.SchedulingConfig;
import org.pulse.etl.models.dto.ExtractionOutcome;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.service.events.JobEventPublisher;
import org.pulse.etl.service.extraction.CancellationRegistry;
import org.pulse.etl.service.extraction.CancellationToken;
import org.pulse.etl.service.recovery.RecoveryService;
import org.pulse.etl.service.registry.JobRegistryService;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Runs one extraction on the dedicated extraction thread and records its outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionRunner {

    private final RecoveryService recoveryService;
    private final JobRegistryService jobRegistryService;
    private final CancellationRegistry cancellationRegistry;
    private final JobEventPublisher jobEventPublisher;
    private final ApplicationEventPublisher applicationEventPublisher;

    @Async(SchedulingConfig.EXTRACTION_EXECUTOR)
    public void runAsync(EtlJob job, CancellationToken token) {
        run(job, token);
    }

    /**
     * @return the job as recorded, or empty when the run had been reset or superseded
     * and its outcome was dropped
     */
    public Optional<EtlJob> run(EtlJob job, CancellationToken token) {
        ExtractionOutcome outcome;
        try {
            outcome = recoveryService.run(job, token);
        } finally {
            cancellationRegistry.unregister(job.getId(), token);
        }

        Optional<EtlJob> recorded;
        try {
            recorded = apply(job, outcome);
        } catch (RuntimeException exception) {
            log.error("Job {} finished with {} but its state could not be recorded; it stays RUNNING until the watchdog "
                    + "recovers it", job.getName(), outcome.status(), exception);
            throw exception;
        }
        if (recorded.isEmpty()) {
            log.warn("Job {} run started at {} ended with {} after it was reset; outcome dropped",
                    job.getName(), job.getLastRunStartedAt(), outcome.status());
            return recorded;
        }
        EtlJob updated = recorded.get();
        applicationEventPublisher.publishEvent(new JobRunCompletedEvent(updated.getId(), updated.getName(),
                outcome.status(), updated.getStatus(), updated.getNextRunAt()));
        return recorded;
    }

    private Optional<EtlJob> apply(EtlJob job, ExtractionOutcome outcome) {
        Instant startedAt = job.getLastRunStartedAt();
        return switch (outcome.status()) {
            case COMPLETED -> jobRegistryService.markFinished(job.getId(), startedAt, null)
                    .map(updated -> {
                        jobEventPublisher.completion(updated, JobStatus.FINISHED,
                                "Extracted " + outcome.itemsProcessed() + " items in " + outcome.pagesProcessed() + " pages",
                                null);
                        return updated;
                    });
            case RATE_LIMITED -> jobRegistryService.markRateLimited(job.getId(), startedAt, outcome.message(),
                            outcome.resetAt())
                    .map(updated -> {
                        jobEventPublisher.status(updated, JobStatus.PENDING, "rate_limited",
                                "Rate limited, resuming at " + updated.getNextRunAt());
                        return updated;
                    });
            case INTERRUPTED -> jobRegistryService.markInterrupted(job.getId(), startedAt, outcome.message())
                    .map(updated -> {
                        jobEventPublisher.status(updated, JobStatus.READY, "stopped", outcome.message());
                        return updated;
                    });
            case FAILED -> jobRegistryService.markFinished(job.getId(), startedAt, outcome.message())
                    .map(updated -> {
                        jobEventPublisher.exception(updated, "extraction", outcome.message());
                        jobEventPublisher.completion(updated, updated.getStatus(), null, outcome.message());
                        return updated;
                    });
            case CRITICAL -> jobRegistryService.markFailed(job.getId(), startedAt, outcome.message())
                    .map(updated -> {
                        jobEventPublisher.completion(updated, JobStatus.FAILED, null, outcome.message());
                        return updated;
                    });
        };
    }
}
