package org.pulse.etl.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.InvalidJobStateException;
import org.pulse.etl.exceptions.JobNotFoundException;
import org.pulse.etl.models.dto.QueueMessage;
import org.pulse.etl.service.orchestration.OrchestratorService;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Lets other services request a run by publishing {@code {"job_id": ...}} to the extract topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractRequestListener {

    public static final String LISTENER_ID = "etl-extract-requests";

    private final OrchestratorService orchestratorService;
    private final ObjectMapper objectMapper;

    @KafkaListener(id = LISTENER_ID,
            topics = "${etl.queue.topic-prefix:etl}.extract",
            groupId = "${etl.queue.orchestrator-group:etl-orchestrator}")
    public void listen(@Payload String payload) {
        QueueMessage message;
        try {
            message = objectMapper.readValue(payload, QueueMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable extract request: {}", e.getOriginalMessage());
            return;
        }
        if (message.jobId() == null) {
            log.warn("Extract request without job_id ignored");
            return;
        }
        try {
            orchestratorService.triggerNow(message.jobId());
            log.info("Extract request for job {} accepted", message.jobId());
        } catch (JobNotFoundException | InvalidJobStateException rejected) {
            log.warn("Extract request for job {} rejected: {}", message.jobId(), rejected.getMessage());
        }
    }
}
