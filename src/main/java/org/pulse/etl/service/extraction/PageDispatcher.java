package org.pulse.etl.service.extraction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.dto.QueueMessage;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.models.enums.EtlStage;
import org.pulse.etl.service.queue.QueueManager;
import org.pulse.etl.service.rawdata.RawDataService;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a fetched page as one raw batch and queues it for transformation.
 * The row is committed before the message leaves, so a worker never sees an unknown id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageDispatcher {

    public static final String COMPLETION_MARKER = "job_completion";

    private final RawDataService rawDataService;
    private final QueueManager queueManager;

    public RawExtractionData dispatch(ExtractionContext context, ExtractionPage page, String scope, String cursor) {
        EtlJob job = context.getJob();
        RawExtractionData row = rawDataService.store(job, page, scope, metadata(context, scope, cursor, page));

        try {
            queueManager.publish(EtlStage.TRANSFORM, baseMessage(context)
                    .entityType(page.entityType())
                    .rawDataId(row.getId())
                    .cursor(page.nextCursor())
                    .firstItem(context.claimFirstItem())
                    .lastItem(!page.hasNextPage())
                    .build());
        } catch (RuntimeException exception) {
            // no PENDING row may be left without a transform message
            rawDataService.markFailed(row.getId(), publishFailure(exception));
            throw exception;
        }
        context.recordPage(page.items().size());
        log.debug("Job {} dispatched {} {} item(s) for {} as raw data {}",
                job.getName(), page.items().size(), page.entityType(), scope, row.getId());
        return row;
    }

    /**
     * Tells downstream consumers that the run ended, either completely or because of a rate limit.
     */
    public void publishMarker(ExtractionContext context, boolean rateLimited) {
        queueManager.publish(EtlStage.TRANSFORM, baseMessage(context)
                .entityType(COMPLETION_MARKER)
                .lastJobItem(!rateLimited)
                .rateLimited(rateLimited)
                .build());
    }

    private QueueMessage.QueueMessageBuilder baseMessage(ExtractionContext context) {
        EtlJob job = context.getJob();
        return QueueMessage.builder()
                .tenantId(job.getTenantId())
                .integrationId(job.getIntegrationId())
                .jobId(job.getId())
                .jobType(job.getJobType())
                .priority(context.getPriority())
                .token(context.getRunToken());
    }

    private Map<String, Object> metadata(ExtractionContext context, String scope, String cursor, ExtractionPage page) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(RawDataService.JOB_ID_FIELD, context.getJob().getId());
        metadata.put(RawDataService.JOB_TYPE_FIELD, context.getJob().getJobType().name());
        metadata.put("job_name", context.getJob().getName());
        metadata.put("scope", scope);
        metadata.put("cursor", cursor);
        metadata.put("next_cursor", page.nextCursor());
        metadata.put("item_count", page.items().size());
        metadata.put("run_token", context.getRunToken());
        metadata.put("extracted_at", Instant.now().toString());
        return metadata;
    }

    private static Map<String, Object> publishFailure(RuntimeException exception) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", "Publishing to the transform queue failed: " + exception.getMessage());
        details.put("exception", exception.getClass().getName());
        details.put("failed_at", Instant.now().toString());
        return details;
    }
}
