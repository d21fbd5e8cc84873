package org.pulse.etl.repository;

import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EtlJobRepository extends JpaRepository<EtlJob, Long> {

    Optional<EtlJob> findByName(String name);

    List<EtlJob> findAllByOrderByIdAsc();

    List<EtlJob> findByStatus(JobStatus status);

    boolean existsByIdNotAndActiveTrueAndStatusIn(Long id, Collection<JobStatus> statuses);

    @Query("select j from EtlJob j where j.active = true and j.status in :statuses "
            + "and (j.nextRunAt is null or j.nextRunAt <= :now)")
    List<EtlJob> findDueJobs(@Param("statuses") Collection<JobStatus> statuses, @Param("now") Instant now);

    @Query("select j from EtlJob j where j.status = :status and j.lastRunStartedAt < :threshold")
    List<EtlJob> findStartedBefore(@Param("status") JobStatus status, @Param("threshold") Instant threshold);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EtlJob j set j.status = :running, j.lastRunStartedAt = :now, j.updatedAt = :now "
            + "where j.id = :id and j.active = true and j.status in :lockable")
    int compareAndSetRunning(@Param("id") Long id,
                             @Param("running") JobStatus running,
                             @Param("lockable") Collection<JobStatus> lockable,
                             @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EtlJob j set j.status = :target, j.errorMessage = :message, j.nextRunAt = :now, j.updatedAt = :now "
            + "where j.id = :id and j.status = :expected")
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("expected") JobStatus expected,
                            @Param("target") JobStatus target,
                            @Param("message") String message,
                            @Param("now") Instant now);

    /**
     * Stamps the end of one specific run. Matches nothing once the run was reset by the
     * watchdog or superseded by a newer run of the same job.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EtlJob j set j.lastRunFinishedAt = :now, j.updatedAt = :now "
            + "where j.id = :id and j.status = :running and j.lastRunStartedAt = :startedAt")
    int closeRun(@Param("id") Long id,
                 @Param("running") JobStatus running,
                 @Param("startedAt") Instant startedAt,
                 @Param("now") Instant now);
}
