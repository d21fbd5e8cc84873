package org.pulse.etl.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "extracted_records", uniqueConstraints = @UniqueConstraint(name = "uk_extracted_records_key",
        columnNames = {"tenant_id", "integration_id", "entity_type", "record_key"}))
public class ExtractedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "integration_id")
    private Long integrationId;

    @Column(name = "entity_type", nullable = false, length = 80)
    private String entityType;

    @Column(name = "record_key", nullable = false, length = 255)
    private String recordKey;

    @Column(name = "data", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> data;

    @Column(name = "source_raw_data_id")
    private Long sourceRawDataId;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @ColumnDefault("now()")
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
