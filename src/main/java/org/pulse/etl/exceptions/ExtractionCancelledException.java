package org.pulse.etl.exceptions;

import lombok.Getter;
import org.pulse.etl.models.enums.InterruptionReason;

@Getter
public class ExtractionCancelledException extends EtlException {

    private final InterruptionReason reason;

    public ExtractionCancelledException(String jobName) {
        this(jobName, InterruptionReason.MANUAL_STOP);
    }

    public ExtractionCancelledException(String jobName, InterruptionReason reason) {
        super(reason == InterruptionReason.MANUAL_STOP
                ? "Job " + jobName + " was stopped by user request"
                : "Job " + jobName + " was cancelled (" + reason.value() + ")", false);
        this.reason = reason;
    }
}
