package org.pulse.etl.exceptions;

/**
 * Network timeouts, 5xx responses and similar failures worth retrying in-process.
 */
public class TransientExtractionException extends EtlException {

    public TransientExtractionException(String message) {
        super(message, true);
    }

    public TransientExtractionException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
