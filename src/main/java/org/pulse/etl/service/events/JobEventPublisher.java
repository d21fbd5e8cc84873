package org.pulse.etl.service.events;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.SchedulingConfig;
import org.pulse.etl.models.dto.JobEvent;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobEventType;
import org.pulse.etl.models.enums.JobStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Outbound event channel. Events are handed to a bounded executor and never
 * block the caller; when the buffer is full the oldest pending event is dropped.
 */
@Slf4j
@Component
public class JobEventPublisher {

    private final List<JobEventListener> listeners;
    private final TaskExecutor executor;

    public JobEventPublisher(List<JobEventListener> listeners,
                             @Qualifier(SchedulingConfig.EVENT_EXECUTOR) TaskExecutor executor) {
        this.listeners = listeners;
        this.executor = executor;
    }

    public void publish(JobEvent event) {
        try {
            executor.execute(() -> dispatch(event));
        } catch (RuntimeException exception) {
            log.warn("Dropped {} event for job {}: {}", event.type(), event.jobName(), exception.getMessage());
        }
    }

    public void status(EtlJob job, JobStatus status, String phase, String message) {
        publish(new JobEvent(job.getId(), job.getName(), JobEventType.STATUS, phase, status, null, message, null, Instant.now()));
    }

    public void progress(EtlJob job, String phase, double percentage, String message) {
        publish(new JobEvent(job.getId(), job.getName(), JobEventType.PROGRESS, phase, JobStatus.RUNNING,
                percentage, message, null, Instant.now()));
    }

    public void exception(EtlJob job, String phase, String error) {
        publish(new JobEvent(job.getId(), job.getName(), JobEventType.EXCEPTION, phase, job.getStatus(), null, null, error,
                Instant.now()));
    }

    public void completion(EtlJob job, JobStatus status, String message, String error) {
        Double percentage = status == JobStatus.FINISHED ? 100.0 : null;
        publish(new JobEvent(job.getId(), job.getName(), JobEventType.COMPLETION, "finalize", status, percentage, message,
                error, Instant.now()));
    }

    private void dispatch(JobEvent event) {
        for (JobEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException exception) {
                log.warn("Event listener {} failed for job {}: {}", listener.getClass().getSimpleName(), event.jobName(),
                        exception.getMessage());
            }
        }
    }
}
