package org.pulse.etl.service.extraction;

import org.pulse.etl.exceptions.ExtractionCancelledException;
import org.pulse.etl.models.enums.InterruptionReason;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop flag of one run. The first cancellation reason wins.
 */
public class CancellationToken {

    private final AtomicReference<InterruptionReason> reason = new AtomicReference<>();

    public void cancel() {
        cancel(InterruptionReason.MANUAL_STOP);
    }

    public void cancel(InterruptionReason why) {
        reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public InterruptionReason reason() {
        return reason.get();
    }

    public void throwIfCancelled(String jobName) {
        InterruptionReason why = reason.get();
        if (why != null) {
            throw new ExtractionCancelledException(jobName, why);
        }
    }
}
