package org.pulse.etl.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.pulse.etl.models.enums.ProcessingStatus;

import java.time.Instant;
import java.util.Map;

@Setter
@Getter
@Entity
@Table(name = "raw_extraction_data", indexes = {
        @Index(name = "idx_raw_extraction_status", columnList = "processing_status"),
        @Index(name = "idx_raw_extraction_integration", columnList = "tenant_id, integration_id")
})
public class RawExtractionData {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private Long tenantId;

    @Column(name = "integration_id", updatable = false)
    private Long integrationId;

    @Column(name = "entity_type", nullable = false, length = 80, updatable = false)
    private String entityType;

    @Column(name = "external_id", length = 255, updatable = false)
    private String externalId;

    // write-once: the complete API response for the batch
    @Column(name = "raw_data", nullable = false, updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> rawData;

    @Column(name = "extraction_metadata", updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> extractionMetadata;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false, length = 20)
    @ColumnDefault("'PENDING'")
    private ProcessingStatus processingStatus;

    @Column(name = "error_details")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> errorDetails;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;
}
