package org.pulse.etl.service.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.models.dto.OrchestratorStatusDTO;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.service.registry.JobRegistryService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives the orchestrator on a fixed interval and arms one-shot cycles for fast
 * retries and for jobs queued behind a run that just ended.
 * <p>
 * The enabled flag and the interval start from {@link EtlProperties} and can be changed
 * at runtime; changing the interval re-arms the periodic cycle. The stuck-job watchdog
 * runs whether or not the orchestrator is enabled, since manual triggers still start runs.
 */
@Slf4j
@Component
public class OrchestratorScheduler {

    private static final Duration FOLLOW_UP_DELAY = Duration.ofSeconds(5);

    private final OrchestratorService orchestratorService;
    private final StuckJobWatchdog stuckJobWatchdog;
    private final JobRegistryService jobRegistryService;
    private final TaskScheduler taskScheduler;
    private final EtlProperties properties;

    private volatile boolean enabled;
    private volatile Duration interval;
    private volatile Instant lastCycleAt;

    private ScheduledFuture<?> cycle;
    private Instant cycleStartAt;
    private ScheduledFuture<?> oneShot;
    private Instant oneShotAt;

    public OrchestratorScheduler(OrchestratorService orchestratorService,
                                 StuckJobWatchdog stuckJobWatchdog,
                                 JobRegistryService jobRegistryService,
                                 TaskScheduler taskScheduler,
                                 EtlProperties properties) {
        this.orchestratorService = orchestratorService;
        this.stuckJobWatchdog = stuckJobWatchdog;
        this.jobRegistryService = jobRegistryService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.enabled = properties.getOrchestrator().isEnabled();
        this.interval = properties.getOrchestrator().getInterval();
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        Instant now = Instant.now();
        Duration watchdogInterval = properties.getWatchdog().getInterval();
        taskScheduler.scheduleWithFixedDelay(stuckJobWatchdog::sweep, now.plus(watchdogInterval), watchdogInterval);
        if (!enabled) {
            log.info("Orchestrator disabled, jobs run only on manual trigger; watchdog every {}", watchdogInterval);
            return;
        }
        Duration initialDelay = properties.getOrchestrator().getInitialDelay();
        armCycle(now.plus(initialDelay));
        log.info("Orchestrator scheduled every {} (first cycle in {}), watchdog every {}",
                interval, initialDelay, watchdogInterval);
    }

    public synchronized OrchestratorStatusDTO enable() {
        if (!enabled) {
            enabled = true;
            armCycle(Instant.now().plus(FOLLOW_UP_DELAY));
            log.info("Orchestrator enabled, cycle every {}", interval);
        }
        return status();
    }

    public synchronized OrchestratorStatusDTO disable() {
        if (enabled) {
            enabled = false;
            cancelCycle();
            if (oneShot != null) {
                oneShot.cancel(false);
                oneShot = null;
                oneShotAt = null;
            }
            log.info("Orchestrator disabled, jobs run only on manual trigger");
        }
        return status();
    }

    /**
     * Sets the periodic cycle interval. When enabled, the next cycle moves to one full
     * interval from now.
     */
    public synchronized OrchestratorStatusDTO updateInterval(Duration newInterval) {
        if (newInterval == null || newInterval.isNegative() || newInterval.isZero()) {
            throw new IllegalArgumentException("Orchestrator interval must be positive");
        }
        Duration previous = interval;
        interval = newInterval;
        if (enabled) {
            armCycle(Instant.now().plus(newInterval));
        }
        log.info("Orchestrator interval changed from {} to {}", previous, newInterval);
        return status();
    }

    public synchronized OrchestratorStatusDTO status() {
        return new OrchestratorStatusDTO(enabled, interval.toMinutes(),
                properties.getOrchestrator().isFastRetryEnabled(), lastCycleAt, nextCycleAt());
    }

    @EventListener
    public void onRunCompleted(JobRunCompletedEvent event) {
        if (!enabled) {
            return;
        }
        Instant now = Instant.now();
        if (!jobRegistryService.getEligibleJobs().isEmpty()) {
            scheduleOneShot(now.plus(FOLLOW_UP_DELAY));
        }
        if (event.status() == JobStatus.PENDING && event.nextRunAt() != null
                && properties.getOrchestrator().isFastRetryEnabled()) {
            log.info("Fast retry for job {} armed at {}", event.jobName(), event.nextRunAt());
            scheduleOneShot(event.nextRunAt().isAfter(now) ? event.nextRunAt() : now.plus(FOLLOW_UP_DELAY));
        }
    }

    synchronized void scheduleOneShot(Instant at) {
        if (oneShot != null && !oneShot.isDone() && oneShotAt != null && !oneShotAt.isAfter(at)) {
            return;
        }
        if (oneShot != null) {
            oneShot.cancel(false);
        }
        oneShotAt = at;
        oneShot = taskScheduler.schedule(this::tick, at);
    }

    void tick() {
        if (!enabled) {
            return;
        }
        lastCycleAt = Instant.now();
        try {
            orchestratorService.runCycle()
                    .ifPresent(job -> log.info("Orchestrator started job {}", job.getName()));
        } catch (RuntimeException exception) {
            log.error("Orchestrator cycle failed", exception);
        }
    }

    private void armCycle(Instant firstAt) {
        cancelCycle();
        cycleStartAt = firstAt;
        cycle = taskScheduler.scheduleAtFixedRate(this::tick, firstAt, interval);
    }

    private void cancelCycle() {
        if (cycle != null) {
            cycle.cancel(false);
            cycle = null;
            cycleStartAt = null;
        }
    }

    private Instant nextCycleAt() {
        if (!enabled || cycleStartAt == null) {
            return null;
        }
        Instant now = Instant.now();
        if (cycleStartAt.isAfter(now)) {
            return cycleStartAt;
        }
        long elapsedCycles = Duration.between(cycleStartAt, now).toMillis() / interval.toMillis() + 1;
        Instant periodic = cycleStartAt.plus(interval.multipliedBy(elapsedCycles));
        return oneShotAt != null && oneShotAt.isAfter(now) && oneShotAt.isBefore(periodic) ? oneShotAt : periodic;
    }
}
