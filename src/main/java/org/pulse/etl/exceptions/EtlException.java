package org.pulse.etl.exceptions;

import lombok.Getter;

/**
 * Base type for failures raised inside the extraction call chain.
 */
@Getter
public class EtlException extends RuntimeException {

    private final boolean retryable;

    public EtlException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public EtlException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }
}
