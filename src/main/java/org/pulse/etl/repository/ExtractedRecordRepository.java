package org.pulse.etl.repository;

import org.pulse.etl.models.entity.ExtractedRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExtractedRecordRepository extends JpaRepository<ExtractedRecord, Long> {

    Optional<ExtractedRecord> findByTenantIdAndIntegrationIdAndEntityTypeAndRecordKey(
            Long tenantId, Long integrationId, String entityType, String recordKey);

    long countByTenantIdAndEntityType(Long tenantId, String entityType);
}
