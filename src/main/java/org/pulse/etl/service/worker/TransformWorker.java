package org.pulse.etl.service.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.RecordValidationException;
import org.pulse.etl.models.dto.QueueMessage;
import org.pulse.etl.models.dto.TransformedRecord;
import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.models.enums.EtlStage;
import org.pulse.etl.service.queue.QueueManager;
import org.pulse.etl.service.rawdata.RawDataService;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumer of the transform topic. Each message points at one raw batch, which is
 * claimed, transformed record by record, upserted, and marked completed or failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransformWorker {

    public static final String LISTENER_ID = "etl-transform-worker";

    private final RawDataService rawDataService;
    private final RecordTransformer recordTransformer;
    private final RecordLoader recordLoader;
    private final QueueManager queueManager;
    private final ObjectMapper objectMapper;

    @KafkaListener(id = LISTENER_ID,
            topics = "${etl.queue.topic-prefix:etl}.transform",
            groupId = "${etl.queue.worker-group:etl-transform-workers}",
            concurrency = "${etl.queue.worker-concurrency:2}")
    public void listen(@Payload String payload) {
        QueueMessage message;
        try {
            message = objectMapper.readValue(payload, QueueMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable transform message: {}", e.getOriginalMessage());
            return;
        }
        process(message);
    }

    public void process(QueueMessage message) {
        if (message.rawDataId() == null) {
            if (message.lastJobItem()) {
                log.info("Transform stream of job {} complete", message.jobId());
            } else if (message.rateLimited()) {
                log.info("Job {} paused by a rate limit; more batches will follow on resume", message.jobId());
            }
            return;
        }

        Long rawDataId = message.rawDataId();
        if (!rawDataService.markProcessing(rawDataId)) {
            log.debug("Raw data {} already completed, skipping redelivery", rawDataId);
            return;
        }

        int loaded;
        try {
            RawExtractionData row = rawDataService.get(rawDataId);
            List<TransformedRecord> records = transformAll(row);
            loaded = recordLoader.upsert(row, records);
            rawDataService.markCompleted(rawDataId);
        } catch (RuntimeException exception) {
            log.error("Transform of raw data {} failed", rawDataId, exception);
            rawDataService.markFailed(rawDataId, errorDetails(exception));
            return;
        }
        log.debug("Raw data {} loaded {} record(s)", rawDataId, loaded);
        queueManager.publish(EtlStage.LOAD, message);
    }

    private List<TransformedRecord> transformAll(RawExtractionData row) {
        Object items = row.getRawData() == null ? null : row.getRawData().get(RawDataService.ITEMS_FIELD);
        if (!(items instanceof List<?> list)) {
            throw new IllegalStateException("Raw data " + row.getId() + " has no items list");
        }

        List<TransformedRecord> records = new ArrayList<>();
        int skipped = 0;
        for (Object item : list) {
            try {
                records.add(recordTransformer.transform(row.getEntityType(), asMap(item)));
            } catch (RecordValidationException invalid) {
                skipped++;
                log.warn("Skipping malformed {} record in raw data {}: {}",
                        row.getEntityType(), row.getId(), invalid.getMessage());
            }
        }
        if (skipped > 0) {
            log.warn("Raw data {}: {} of {} record(s) skipped", row.getId(), skipped, list.size());
        }
        return records;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object item) {
        if (item instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new RecordValidationException(null, "Item is not an object: " + item);
    }

    private static Map<String, Object> errorDetails(RuntimeException exception) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", exception.getMessage());
        details.put("exception", exception.getClass().getName());
        details.put("failed_at", Instant.now().toString());
        return details;
    }
}
