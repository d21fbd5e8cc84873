package org.pulse.etl.service.extraction;

import lombok.Builder;
import lombok.Getter;
import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.dto.ExtractionRequest;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.RecoveryMode;
import org.pulse.etl.service.events.JobEventPublisher;
import org.pulse.etl.service.progress.ProgressTracker;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of a single extraction run, shared by the strategy and the components it calls.
 */
@Getter
@Builder
public class ExtractionContext {

    private final EtlJob job;
    private final RecoveryMode mode;
    private final CheckpointDocument resumeCheckpoint;
    private final Instant since;
    private final String runToken;
    private final int priority;
    private final ExtractionClient client;
    private final CancellationToken cancellationToken;
    private final TransientRetryExecutor retryExecutor;
    private final ProgressTracker progressTracker;
    private final JobEventPublisher eventPublisher;

    private final AtomicLong pages = new AtomicLong();
    private final AtomicLong items = new AtomicLong();
    private final AtomicBoolean firstPublished = new AtomicBoolean();

    private volatile String phase;

    /**
     * Checks for a stop request, then fetches one page with transient retries.
     */
    public ExtractionPage fetch(String entityType, String scope, String cursor) {
        cancellationToken.throwIfCancelled(job.getName());
        ExtractionRequest request = new ExtractionRequest(job.getJobType(), entityType, scope, cursor, since, config());
        return retryExecutor.execute("Fetch of " + entityType + " for " + scope, () -> client.fetchPage(request));
    }

    public void enterPhase(String step) {
        this.phase = step;
        reportProgress(step, 0.0, "Started " + step);
    }

    public void reportProgress(String step, Double fraction, String message) {
        double percentage = progressTracker.update(job.getJobType().stepIndex(step), fraction);
        eventPublisher.progress(job, step, percentage, message);
    }

    public void recordPage(int itemCount) {
        pages.incrementAndGet();
        items.addAndGet(itemCount);
    }

    public boolean claimFirstItem() {
        return firstPublished.compareAndSet(false, true);
    }

    public long pageCount() {
        return pages.get();
    }

    public long itemCount() {
        return items.get();
    }

    public Map<String, Object> config() {
        return job.getExtractionConfig() == null ? Map.of() : job.getExtractionConfig();
    }

    public List<String> configList(String key) {
        Object value = config().get(key);
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.split("\\s*,\\s*"));
        }
        return List.of();
    }
}
