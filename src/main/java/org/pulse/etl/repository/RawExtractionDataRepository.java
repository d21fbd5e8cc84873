package org.pulse.etl.repository;

import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.models.enums.ProcessingStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface RawExtractionDataRepository extends JpaRepository<RawExtractionData, Long> {

    Page<RawExtractionData> findByTenantId(Long tenantId, Pageable pageable);

    Page<RawExtractionData> findByTenantIdAndProcessingStatus(Long tenantId, ProcessingStatus status, Pageable pageable);

    Page<RawExtractionData> findByProcessingStatus(ProcessingStatus status, Pageable pageable);

    long countByProcessingStatus(ProcessingStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RawExtractionData r set r.processingStatus = :target where r.id = :id and r.processingStatus in :allowed")
    int transition(@Param("id") Long id,
                   @Param("allowed") Collection<ProcessingStatus> allowed,
                   @Param("target") ProcessingStatus target);
}
