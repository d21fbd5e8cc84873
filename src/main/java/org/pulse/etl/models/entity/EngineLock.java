package org.pulse.etl.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Singleton row guarding the single-execution constraint. The row with
 * {@link #SINGLETON_ID} is held by at most one job at a time.
 */
@Getter
@Setter
@Entity
@Table(name = "etl_engine_lock")
public class EngineLock {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "holder_job_id")
    private Long holderJobId;

    @Column(name = "acquired_at")
    private Instant acquiredAt;

    public static EngineLock unheld() {
        EngineLock lock = new EngineLock();
        lock.setId(SINGLETON_ID);
        return lock;
    }
}
