package org.pulse.etl.service.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.InvalidJobStateException;
import org.pulse.etl.models.dto.JobStatusDTO;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.service.events.JobEventPublisher;
import org.pulse.etl.service.extraction.CancellationRegistry;
import org.pulse.etl.service.extraction.CancellationToken;
import org.pulse.etl.service.registry.JobRegistryService;
import org.pulse.etl.service.worker.WorkerStatusProbe;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One orchestration cycle: pick the most urgent eligible job, lock it, make sure
 * transform workers exist, and hand it to the extraction thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorService {

    public static final String NO_WORKERS_MESSAGE =
            "No transform workers are running; job was not started to avoid stranding queued messages";

    private final JobRegistryService jobRegistryService;
    private final WorkerStatusProbe workerStatusProbe;
    private final CancellationRegistry cancellationRegistry;
    private final ExtractionRunner extractionRunner;
    private final JobEventPublisher jobEventPublisher;

    private final ReentrantLock cycleGuard = new ReentrantLock();

    /**
     * @return the job handed to the extraction thread, if any
     */
    public Optional<EtlJob> runCycle() {
        if (!cycleGuard.tryLock()) {
            log.debug("Orchestrator cycle already in progress");
            return Optional.empty();
        }
        try {
            List<EtlJob> running = jobRegistryService.findRunning();
            if (!running.isEmpty()) {
                log.debug("Job {} is running, cycle skipped", running.get(0).getName());
                return Optional.empty();
            }

            List<EtlJob> eligible = jobRegistryService.getEligibleJobs();
            if (eligible.isEmpty()) {
                log.debug("No eligible jobs");
                return Optional.empty();
            }

            EtlJob candidate = eligible.get(0);
            if (!jobRegistryService.tryLock(candidate.getId())) {
                log.info("Job {} was claimed concurrently, cycle aborted", candidate.getName());
                return Optional.empty();
            }
            EtlJob job = jobRegistryService.getJob(candidate.getId());

            if (!workersAvailable(job)) {
                jobRegistryService.markFailed(job.getId(), job.getLastRunStartedAt(), NO_WORKERS_MESSAGE)
                        .ifPresent(failed -> jobEventPublisher.status(failed, JobStatus.FAILED, "worker_check",
                                NO_WORKERS_MESSAGE));
                return Optional.empty();
            }

            start(job);
            return Optional.of(job);
        } finally {
            cycleGuard.unlock();
        }
    }

    /**
     * Makes the job due immediately and runs a cycle. Another job may still win
     * the cycle; the triggered one then runs next.
     */
    public JobStatusDTO triggerNow(Long jobId) {
        jobRegistryService.triggerNow(jobId);
        runCycle();
        return jobRegistryService.describe(jobId);
    }

    public JobStatusDTO stop(Long jobId) {
        EtlJob job = jobRegistryService.getJob(jobId);
        if (!job.isRunning() || !cancellationRegistry.cancel(jobId)) {
            throw new InvalidJobStateException("Job " + job.getName() + " is not running in this engine");
        }
        jobEventPublisher.status(job, JobStatus.RUNNING, "stopping", "Stop requested");
        return jobRegistryService.toDto(job);
    }

    private boolean workersAvailable(EtlJob job) {
        try {
            return workerStatusProbe.isRunning();
        } catch (RuntimeException exception) {
            log.warn("Worker status probe failed for job {}, starting anyway: {}", job.getName(), exception.getMessage());
            return true;
        }
    }

    private void start(EtlJob job) {
        CancellationToken token = cancellationRegistry.register(job.getId());
        jobEventPublisher.status(job, JobStatus.RUNNING, "start", "Job started");
        try {
            extractionRunner.runAsync(job, token);
        } catch (TaskRejectedException exception) {
            cancellationRegistry.unregister(job.getId(), token);
            log.error("Extraction executor rejected job {}", job.getName(), exception);
            jobRegistryService.markFinished(job.getId(), job.getLastRunStartedAt(),
                    "Extraction executor rejected the job");
        }
    }
}
