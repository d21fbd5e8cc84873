package org.pulse.etl.service.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.InterruptionReason;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.service.events.JobEventPublisher;
import org.pulse.etl.service.extraction.CancellationRegistry;
import org.pulse.etl.service.registry.JobRegistryService;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class StuckJobWatchdog {

    private final JobRegistryService jobRegistryService;
    private final CancellationRegistry cancellationRegistry;
    private final JobEventPublisher jobEventPublisher;
    private final EtlProperties properties;

    public void sweep() {
        try {
            List<EtlJob> losers = jobRegistryService.reconcileConcurrentRunning();
            for (EtlJob loser : losers) {
                cancellationRegistry.cancel(loser.getId(), InterruptionReason.WATCHDOG);
                jobEventPublisher.exception(loser, "watchdog", JobRegistryService.CONCURRENT_RUN_MESSAGE);
            }

            List<EtlJob> stuck = jobRegistryService.recoverStuckJobs(properties.getWatchdog().getStuckCeiling());
            for (EtlJob job : stuck) {
                cancellationRegistry.cancel(job.getId(), InterruptionReason.WATCHDOG);
                jobEventPublisher.status(job, JobStatus.PENDING, "watchdog", JobRegistryService.STUCK_RECOVERY_MESSAGE);
            }
            if (!stuck.isEmpty()) {
                log.warn("Watchdog recovered {} stuck job(s)", stuck.size());
            }
        } catch (RuntimeException exception) {
            log.error("Watchdog sweep failed", exception);
        }
    }
}
