package org.pulse.etl.service.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.exceptions.InvalidJobStateException;
import org.pulse.etl.exceptions.JobNotFoundException;
import org.pulse.etl.models.dto.JobStatusDTO;
import org.pulse.etl.models.entity.EngineLock;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.repository.EngineLockRepository;
import org.pulse.etl.repository.EtlJobRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Durable job state. Every transition out of RUNNING releases the engine lock
 * in the same transaction. Outcomes are scoped to one run, identified by its
 * {@code last_run_started_at}; an outcome for a run that was reset or superseded is dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRegistryService {

    public static final String STUCK_RECOVERY_MESSAGE = "Auto-recovered from stuck state";
    public static final String CONCURRENT_RUN_MESSAGE = "Forced back to PENDING: another job was RUNNING at the same time";
    private static final int ERROR_MESSAGE_LIMIT = 1000;

    private static final Comparator<EtlJob> ELIGIBILITY_ORDER = Comparator
            .comparing((EtlJob job) -> job.getStatus() != JobStatus.PENDING)
            .thenComparing(EtlJob::getLastRunFinishedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(EtlJob::getId);

    private final EtlJobRepository etlJobRepository;
    private final EngineLockRepository engineLockRepository;
    private final EtlProperties properties;

    @Transactional(readOnly = true)
    public List<EtlJob> getEligibleJobs() {
        List<EtlJob> due = new ArrayList<>(etlJobRepository.findDueJobs(JobStatus.LOCKABLE, Instant.now()));
        due.sort(ELIGIBILITY_ORDER);
        return due;
    }

    @Transactional(readOnly = true)
    public List<EtlJob> findRunning() {
        return etlJobRepository.findByStatus(JobStatus.RUNNING);
    }

    @Transactional(readOnly = true)
    public EtlJob getJob(Long jobId) {
        return etlJobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public List<JobStatusDTO> listJobs() {
        return etlJobRepository.findAllByOrderByIdAsc().stream().map(this::toDto).toList();
    }

    @Transactional(readOnly = true)
    public JobStatusDTO describe(Long jobId) {
        return toDto(getJob(jobId));
    }

    /**
     * Claims the engine lock and moves the job to RUNNING, both or neither.
     *
     * @return {@code false} when the lock is held, the job is not in a lockable state,
     * or the storage layer reported a concurrent modification
     */
    @Transactional
    public boolean tryLock(Long jobId) {
        // stored precision, so the start time read back identifies this run exactly
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        try {
            if (engineLockRepository.acquire(EngineLock.SINGLETON_ID, jobId, now) == 0) {
                log.debug("Engine lock is held, job {} not started", jobId);
                return false;
            }
            if (etlJobRepository.compareAndSetRunning(jobId, JobStatus.RUNNING, JobStatus.LOCKABLE, now) == 0) {
                log.debug("Job {} is not in a lockable state", jobId);
                TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
                return false;
            }
        } catch (DataAccessException exception) {
            log.warn("Lock attempt for job {} lost a concurrent update: {}", jobId, exception.getMessage());
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return false;
        }
        log.info("Engine lock acquired by job {}", jobId);
        return true;
    }

    /**
     * Records the outcome of the run that started at {@code runStartedAt}.
     *
     * @return the updated job, or empty when that run is no longer the job's current run
     */
    @Transactional
    public Optional<EtlJob> markFinished(Long jobId, Instant runStartedAt, String error) {
        return closeRun(jobId, runStartedAt).map(job -> {
            Instant now = job.getLastRunFinishedAt();
            if (error == null) {
                job.setStatus(JobStatus.FINISHED);
                job.setErrorMessage(null);
                job.setRetryCount(0);
                job.setLastSuccessAt(runStartedAt);
                job.setNextRunAt(now.plus(Duration.ofMinutes(job.getScheduleIntervalMinutes())));
                log.info("Job {} finished, next run at {}", job.getName(), job.getNextRunAt());
            } else {
                job.setRetryCount(job.getRetryCount() + 1);
                job.setErrorMessage(truncate(error));
                if (job.getRetryCount() > properties.getOrchestrator().getMaxRetries()) {
                    job.setStatus(JobStatus.FAILED);
                    job.setNextRunAt(null);
                    log.error("Job {} failed permanently after {} attempts: {}", job.getName(), job.getRetryCount(), error);
                } else {
                    job.setStatus(JobStatus.PENDING);
                    job.setNextRunAt(now.plus(Duration.ofMinutes(job.getRetryIntervalMinutes())));
                    log.warn("Job {} failed (attempt {}), retrying at {}: {}",
                            job.getName(), job.getRetryCount(), job.getNextRunAt(), error);
                }
            }
            return release(etlJobRepository.save(job));
        });
    }

    /**
     * A rate limit is not a failure: the retry counter is left alone.
     */
    @Transactional
    public Optional<EtlJob> markRateLimited(Long jobId, Instant runStartedAt, String message, Instant resetAt) {
        return closeRun(jobId, runStartedAt).map(job -> {
            Instant now = job.getLastRunFinishedAt();
            job.setStatus(JobStatus.PENDING);
            job.setErrorMessage(truncate(message));
            job.setNextRunAt(resetAt != null && resetAt.isAfter(now)
                    ? resetAt
                    : now.plus(Duration.ofMinutes(job.getRetryIntervalMinutes())));
            log.info("Job {} rate limited, resuming at {}", job.getName(), job.getNextRunAt());
            return release(etlJobRepository.save(job));
        });
    }

    @Transactional
    public Optional<EtlJob> markInterrupted(Long jobId, Instant runStartedAt, String message) {
        return closeRun(jobId, runStartedAt).map(job -> {
            job.setStatus(JobStatus.READY);
            job.setErrorMessage(truncate(message));
            job.setNextRunAt(null);
            log.info("Job {} stopped, checkpoint kept for the next cycle", job.getName());
            return release(etlJobRepository.save(job));
        });
    }

    @Transactional
    public Optional<EtlJob> markFailed(Long jobId, Instant runStartedAt, String message) {
        return closeRun(jobId, runStartedAt).map(job -> {
            job.setStatus(JobStatus.FAILED);
            job.setErrorMessage(truncate(message));
            job.setNextRunAt(null);
            log.error("Job {} marked FAILED: {}", job.getName(), message);
            return release(etlJobRepository.save(job));
        });
    }

    @Transactional
    public EtlJob pause(Long jobId) {
        EtlJob job = getJob(jobId);
        if (job.isRunning()) {
            throw new InvalidJobStateException("Job " + job.getName() + " is running; stop it before pausing");
        }
        job.setStatus(JobStatus.PAUSED);
        log.info("Job {} paused", job.getName());
        return etlJobRepository.save(job);
    }

    /**
     * Returns a paused (or failed) job to the schedule. When another job is already
     * queued or running it waits its turn as FINISHED instead of jumping the queue.
     */
    @Transactional
    public EtlJob resume(Long jobId) {
        EtlJob job = getJob(jobId);
        if (job.getStatus() != JobStatus.PAUSED && job.getStatus() != JobStatus.FAILED) {
            throw new InvalidJobStateException("Job " + job.getName() + " is " + job.getStatus() + ", not paused");
        }
        boolean othersWaiting = etlJobRepository.existsByIdNotAndActiveTrueAndStatusIn(jobId,
                EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING));
        if (job.getStatus() == JobStatus.FAILED) {
            job.setRetryCount(0);
        }
        job.setStatus(othersWaiting ? JobStatus.FINISHED : JobStatus.PENDING);
        job.setNextRunAt(null);
        log.info("Job {} resumed as {}", job.getName(), job.getStatus());
        return etlJobRepository.save(job);
    }

    @Transactional
    public EtlJob triggerNow(Long jobId) {
        EtlJob job = getJob(jobId);
        if (!job.isActive()) {
            throw new InvalidJobStateException("Job " + job.getName() + " is inactive");
        }
        if (job.isRunning()) {
            throw new InvalidJobStateException("Job " + job.getName() + " is already running");
        }
        if (job.getStatus() == JobStatus.PAUSED) {
            throw new InvalidJobStateException("Job " + job.getName() + " is paused; resume it first");
        }
        if (job.getStatus() == JobStatus.FAILED) {
            job.setRetryCount(0);
        }
        job.setStatus(JobStatus.PENDING);
        job.setNextRunAt(Instant.now());
        log.info("Job {} triggered manually", job.getName());
        return etlJobRepository.save(job);
    }

    @Transactional
    public EtlJob updateSchedule(Long jobId, int scheduleIntervalMinutes, int retryIntervalMinutes) {
        if (retryIntervalMinutes <= 0 || retryIntervalMinutes >= scheduleIntervalMinutes) {
            throw new IllegalArgumentException("Retry interval must be positive and shorter than the schedule interval");
        }
        EtlJob job = getJob(jobId);
        job.setScheduleIntervalMinutes(scheduleIntervalMinutes);
        job.setRetryIntervalMinutes(retryIntervalMinutes);
        if (job.getStatus() == JobStatus.FINISHED && job.getLastRunFinishedAt() != null) {
            job.setNextRunAt(job.getLastRunFinishedAt().plus(Duration.ofMinutes(scheduleIntervalMinutes)));
        }
        log.info("Job {} schedule set to every {} min, retry after {} min",
                job.getName(), scheduleIntervalMinutes, retryIntervalMinutes);
        return etlJobRepository.save(job);
    }

    @Transactional
    public EtlJob deactivate(Long jobId) {
        EtlJob job = getJob(jobId);
        if (job.isRunning()) {
            throw new InvalidJobStateException("Job " + job.getName() + " is running; stop it before deactivating");
        }
        job.setActive(false);
        log.info("Job {} deactivated", job.getName());
        return etlJobRepository.save(job);
    }

    /**
     * Returns RUNNING jobs older than {@code ceiling} to PENDING and frees the engine lock they hold.
     */
    @Transactional
    public List<EtlJob> recoverStuckJobs(Duration ceiling) {
        Instant now = Instant.now();
        List<EtlJob> recovered = new ArrayList<>();
        for (EtlJob job : etlJobRepository.findStartedBefore(JobStatus.RUNNING, now.minus(ceiling))) {
            if (etlJobRepository.compareAndSetStatus(job.getId(), JobStatus.RUNNING, JobStatus.PENDING,
                    STUCK_RECOVERY_MESSAGE, now) == 1) {
                engineLockRepository.release(EngineLock.SINGLETON_ID, job.getId());
                log.warn("Job {} was RUNNING since {}; reset to PENDING", job.getName(), job.getLastRunStartedAt());
                recovered.add(job);
            }
        }
        return recovered;
    }

    /**
     * Enforces the single-execution constraint after the fact: when several jobs are
     * RUNNING, every job except the lock holder is forced back to PENDING.
     *
     * @return the jobs that were forced back
     */
    @Transactional
    public List<EtlJob> reconcileConcurrentRunning() {
        List<EtlJob> running = etlJobRepository.findByStatus(JobStatus.RUNNING);
        if (running.size() <= 1) {
            return List.of();
        }
        Long holder = engineLockRepository.findById(EngineLock.SINGLETON_ID)
                .map(EngineLock::getHolderJobId)
                .orElse(null);
        Long survivor = running.stream().anyMatch(job -> job.getId().equals(holder))
                ? holder
                : running.stream()
                .min(Comparator.comparing(EtlJob::getLastRunStartedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(EtlJob::getId)
                .orElse(null);

        log.error("Single-execution violation: {} jobs RUNNING ({}); keeping job {}", running.size(),
                running.stream().map(EtlJob::getName).toList(), survivor);
        Instant now = Instant.now();
        List<EtlJob> losers = new ArrayList<>();
        for (EtlJob job : running) {
            if (!job.getId().equals(survivor)
                    && etlJobRepository.compareAndSetStatus(job.getId(), JobStatus.RUNNING, JobStatus.PENDING,
                    CONCURRENT_RUN_MESSAGE, now) == 1) {
                losers.add(job);
            }
        }
        return losers;
    }

    /**
     * Frees an engine lock whose holder is no longer RUNNING.
     */
    @Transactional
    public boolean releaseOrphanedLock() {
        EngineLock lock = engineLockRepository.findById(EngineLock.SINGLETON_ID).orElse(null);
        if (lock == null || lock.getHolderJobId() == null) {
            return false;
        }
        boolean holderRunning = etlJobRepository.findById(lock.getHolderJobId()).map(EtlJob::isRunning).orElse(false);
        if (holderRunning) {
            return false;
        }
        engineLockRepository.release(EngineLock.SINGLETON_ID, lock.getHolderJobId());
        log.warn("Released engine lock held by job {} which is no longer running", lock.getHolderJobId());
        return true;
    }

    public JobStatusDTO toDto(EtlJob job) {
        return new JobStatusDTO(
                job.getId(),
                job.getName(),
                job.getJobType(),
                job.isActive(),
                job.getStatus(),
                job.getScheduleIntervalMinutes(),
                job.getRetryIntervalMinutes(),
                job.getRetryCount(),
                job.getErrorMessage(),
                job.getLastRunStartedAt(),
                job.getLastRunFinishedAt(),
                job.getLastSuccessAt(),
                job.getNextRunAt(),
                job.getCheckpointData() != null && !job.getCheckpointData().isEmpty()
        );
    }

    /**
     * Closes the run inside the caller's transaction. The conditional update holds the
     * row until commit, so the watchdog cannot reset the job halfway through.
     */
    private Optional<EtlJob> closeRun(Long jobId, Instant runStartedAt) {
        Instant now = Instant.now();
        if (runStartedAt == null
                || etlJobRepository.closeRun(jobId, JobStatus.RUNNING, runStartedAt, now) == 0) {
            log.warn("Dropping outcome of job {} run started at {}: the job has left that run", jobId, runStartedAt);
            return Optional.empty();
        }
        EtlJob job = getJob(jobId);
        job.setLastRunFinishedAt(now);
        return Optional.of(job);
    }

    private EtlJob release(EtlJob job) {
        engineLockRepository.release(EngineLock.SINGLETON_ID, job.getId());
        return job;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= ERROR_MESSAGE_LIMIT) {
            return message;
        }
        return message.substring(0, ERROR_MESSAGE_LIMIT);
    }
}
