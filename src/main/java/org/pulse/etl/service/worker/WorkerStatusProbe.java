package org.pulse.etl.service.worker;

public interface WorkerStatusProbe {

    /**
     * @return whether at least one consumer of the transform queue is alive
     */
    boolean isRunning();
}
