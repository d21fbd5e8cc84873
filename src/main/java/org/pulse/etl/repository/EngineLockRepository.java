package org.pulse.etl.repository;

import org.pulse.etl.models.entity.EngineLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface EngineLockRepository extends JpaRepository<EngineLock, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EngineLock l set l.holderJobId = :jobId, l.acquiredAt = :now where l.id = :lockId and l.holderJobId is null")
    int acquire(@Param("lockId") Long lockId, @Param("jobId") Long jobId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update EngineLock l set l.holderJobId = null, l.acquiredAt = null where l.id = :lockId and l.holderJobId = :jobId")
    int release(@Param("lockId") Long lockId, @Param("jobId") Long jobId);
}
