package org.pulse.etl.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.ExtractionCancelledException;
import org.pulse.etl.exceptions.RateLimitedException;
import org.pulse.etl.exceptions.TransientExtractionException;
import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.enums.InterruptionReason;
import org.pulse.etl.service.checkpoint.CheckpointService;

/**
 * Runs an extraction and, whatever interrupts it, saves the in-memory checkpoint
 * tagged with the interruption reason before the exception leaves the strategy.
 */
@Slf4j
public abstract class CheckpointingExtractionStrategy<D extends CheckpointDocument> implements ExtractionStrategy {

    protected final CheckpointService checkpointService;
    protected final PageDispatcher pageDispatcher;

    protected CheckpointingExtractionStrategy(CheckpointService checkpointService, PageDispatcher pageDispatcher) {
        this.checkpointService = checkpointService;
        this.pageDispatcher = pageDispatcher;
    }

    protected abstract D initialCheckpoint(ExtractionContext context);

    protected abstract void run(ExtractionContext context, D checkpoint);

    @Override
    public final void extract(ExtractionContext context) {
        D checkpoint = initialCheckpoint(context);
        try {
            run(context, checkpoint);
        } catch (RateLimitedException exception) {
            saveInterrupted(context, checkpoint, InterruptionReason.RATE_LIMITED, exception);
            announceRateLimit(context, exception);
            throw exception;
        } catch (ExtractionCancelledException exception) {
            saveInterrupted(context, checkpoint, exception.getReason(), exception);
            throw exception;
        } catch (TransientExtractionException exception) {
            saveInterrupted(context, checkpoint, InterruptionReason.TRANSIENT_FAILURE, exception);
            throw exception;
        } catch (RuntimeException exception) {
            saveInterrupted(context, checkpoint, InterruptionReason.FAILURE, exception);
            throw exception;
        }
    }

    protected void save(ExtractionContext context, D checkpoint) {
        checkpointService.save(context.getJob().getId(), checkpoint, context.getPhase());
    }

    private void saveInterrupted(ExtractionContext context, D checkpoint, InterruptionReason reason,
                                 RuntimeException cause) {
        checkpoint.setInterruption(reason);
        try {
            save(context, checkpoint);
            log.info("Job {} interrupted ({}) during {}; checkpoint saved",
                    context.getJob().getName(), reason.value(), context.getPhase());
        } catch (RuntimeException saveFailure) {
            log.error("Job {} could not save its {} checkpoint", context.getJob().getName(), reason.value(), saveFailure);
            cause.addSuppressed(saveFailure);
        }
    }

    private void announceRateLimit(ExtractionContext context, RateLimitedException cause) {
        try {
            pageDispatcher.publishMarker(context, true);
        } catch (RuntimeException publishFailure) {
            log.warn("Job {} could not publish its rate-limit marker: {}",
                    context.getJob().getName(), publishFailure.getMessage());
            cause.addSuppressed(publishFailure);
        }
    }
}
