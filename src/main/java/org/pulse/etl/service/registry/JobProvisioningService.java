package org.pulse.etl.service.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.models.entity.EngineLock;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.repository.EngineLockRepository;
import org.pulse.etl.repository.EtlJobRepository;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Startup housekeeping: creates the engine lock row and the configured jobs, then
 * returns jobs left RUNNING by a previous process to PENDING.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobProvisioningService implements ApplicationRunner {

    private final EtlProperties properties;
    private final EtlJobRepository etlJobRepository;
    private final EngineLockRepository engineLockRepository;
    private final JobRegistryService jobRegistryService;

    @Override
    public void run(ApplicationArguments args) {
        ensureEngineLock();
        properties.getJobs().forEach(this::provision);

        List<EtlJob> orphaned = jobRegistryService.recoverStuckJobs(Duration.ZERO);
        if (!orphaned.isEmpty()) {
            log.warn("Recovered {} job(s) left RUNNING by a previous process: {}",
                    orphaned.size(), orphaned.stream().map(EtlJob::getName).toList());
        }
        jobRegistryService.releaseOrphanedLock();
    }

    void ensureEngineLock() {
        if (!engineLockRepository.existsById(EngineLock.SINGLETON_ID)) {
            engineLockRepository.save(EngineLock.unheld());
            log.info("Created engine lock row");
        }
    }

    EtlJob provision(EtlProperties.JobDefinition definition) {
        if (definition.getName() == null || definition.getType() == null) {
            throw new IllegalStateException("Configured jobs need a name and a type: " + definition.getName());
        }
        return etlJobRepository.findByName(definition.getName()).orElseGet(() -> {
            EtlJob job = new EtlJob();
            job.setName(definition.getName());
            job.setJobType(definition.getType());
            job.setTenantId(definition.getTenantId());
            job.setIntegrationId(definition.getIntegrationId());
            job.setActive(definition.isActive());
            job.setStatus(JobStatus.READY);
            job.setScheduleIntervalMinutes(definition.getScheduleIntervalMinutes());
            job.setRetryIntervalMinutes(definition.getRetryIntervalMinutes());
            job.setExtractionConfig(new LinkedHashMap<>(definition.getConfig()));
            EtlJob saved = etlJobRepository.save(job);
            log.info("Provisioned {} job {} (every {} min)", saved.getJobType(), saved.getName(),
                    saved.getScheduleIntervalMinutes());
            return saved;
        });
    }
}
