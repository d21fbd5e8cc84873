package org.pulse.etl.service.events;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.models.dto.JobEvent;
import org.pulse.etl.models.enums.JobEventType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes job events to connected dashboards. New subscribers receive the
 * latest progress event of every job so a freshly opened page is not blank.
 */
@Slf4j
@Component
public class SseJobEventBroadcaster implements JobEventListener {

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final Map<Long, JobEvent> latestProgress = new ConcurrentHashMap<>();
    private final long emitterTimeoutMillis;

    public SseJobEventBroadcaster(EtlProperties properties) {
        this.emitterTimeoutMillis = properties.getEvents().getEmitterTimeout().toMillis();
    }

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(error -> emitters.remove(emitter));
        emitters.add(emitter);

        for (JobEvent event : latestProgress.values()) {
            if (!send(emitter, event)) {
                break;
            }
        }
        return emitter;
    }

    @Override
    public void onEvent(JobEvent event) {
        if (event.jobId() != null) {
            if (event.type() == JobEventType.PROGRESS) {
                latestProgress.put(event.jobId(), event);
            } else if (event.type() == JobEventType.COMPLETION) {
                latestProgress.remove(event.jobId());
            }
        }
        for (SseEmitter emitter : emitters) {
            send(emitter, event);
        }
    }

    public int subscriberCount() {
        return emitters.size();
    }

    private boolean send(SseEmitter emitter, JobEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.type().name().toLowerCase()).data(event));
            return true;
        } catch (IOException | IllegalStateException exception) {
            log.debug("Removing disconnected event subscriber: {}", exception.getMessage());
            emitters.remove(emitter);
            return false;
        }
    }
}
