package org.pulse.etl.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.exceptions.TransientExtractionException;
import org.pulse.etl.models.dto.QueueMessage;
import org.pulse.etl.models.enums.EtlStage;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes pointer messages to the stage topics and waits for the broker to
 * acknowledge each one before returning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueManager {

    public static final String PRIORITY_HEADER = "priority";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final EtlProperties properties;

    public void publish(EtlStage stage, QueueMessage message) {
        String topic = topicFor(stage);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize queue message for job " + message.jobId(), e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, keyFor(message), payload);
        record.headers().add(PRIORITY_HEADER,
                Integer.toString(message.effectivePriority()).getBytes(StandardCharsets.UTF_8));

        long timeoutMillis = properties.getQueue().getPublishTimeout().toMillis();
        try {
            kafkaTemplate.send(record).get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExtractionException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TransientExtractionException("Broker did not acknowledge message on " + topic, e);
        }
        log.debug("Published {} message for job {} (raw data {})", stage.routingKey(), message.jobId(), message.rawDataId());
    }

    public String topicFor(EtlStage stage) {
        return properties.getQueue().topicFor(stage.routingKey());
    }

    public List<String> topics() {
        return Arrays.stream(EtlStage.values()).map(this::topicFor).toList();
    }

    private String keyFor(QueueMessage message) {
        return message.tenantId() + ":" + (message.jobType() == null ? "none" : message.jobType().name());
    }
}
