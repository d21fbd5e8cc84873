package org.pulse.etl.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.pulse.etl.models.enums.JobStatus;
import org.pulse.etl.models.enums.JobType;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@Entity
@DynamicUpdate
@Table(name = "etl_jobs", uniqueConstraints = @UniqueConstraint(name = "uk_etl_jobs_name", columnNames = "job_name"))
public class EtlJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "job_name", nullable = false, length = 80)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 20)
    private JobType jobType;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "integration_id")
    private Long integrationId;

    @ColumnDefault("true")
    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @ColumnDefault("'READY'")
    private JobStatus status;

    @Column(name = "schedule_interval_minutes", nullable = false)
    private Integer scheduleIntervalMinutes;

    @Column(name = "retry_interval_minutes", nullable = false)
    private Integer retryIntervalMinutes;

    @Column(name = "last_run_started_at")
    private Instant lastRunStartedAt;

    @Column(name = "last_run_finished_at")
    private Instant lastRunFinishedAt;

    @Column(name = "last_success_at")
    private Instant lastSuccessAt;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @ColumnDefault("0")
    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "checkpoint_data")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> checkpointData;

    @Column(name = "extraction_config")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> extractionConfig;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @ColumnDefault("now()")
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        createdAt = createdAt == null ? now : createdAt;
        updatedAt = now;
        if (status == null) {
            status = JobStatus.READY;
        }
        requireRetryShorterThanSchedule();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
        requireRetryShorterThanSchedule();
    }

    private void requireRetryShorterThanSchedule() {
        if (scheduleIntervalMinutes == null || retryIntervalMinutes == null
                || retryIntervalMinutes <= 0 || retryIntervalMinutes >= scheduleIntervalMinutes) {
            throw new IllegalStateException("Job " + name + ": retry interval (" + retryIntervalMinutes
                    + " min) must be positive and shorter than the schedule interval (" + scheduleIntervalMinutes + " min)");
        }
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }
}
