package org.pulse.etl.models.enums;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    READY,
    PENDING,
    RUNNING,
    FINISHED,
    FAILED,
    PAUSED;

    /**
     * Statuses from which the orchestrator may move a job to {@link #RUNNING}.
     */
    public static final Set<JobStatus> LOCKABLE = EnumSet.of(PENDING, READY, FINISHED);

    public boolean isLockable() {
        return LOCKABLE.contains(this);
    }
}
