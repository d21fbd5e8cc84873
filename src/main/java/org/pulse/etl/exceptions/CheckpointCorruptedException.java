package org.pulse.etl.exceptions;

public class CheckpointCorruptedException extends EtlException {

    public CheckpointCorruptedException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
