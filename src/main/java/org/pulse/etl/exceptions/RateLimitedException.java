package org.pulse.etl.exceptions;

import lombok.Getter;

import java.time.Instant;

/**
 * Raised by an extraction client when the remote API refuses further calls.
 * {@code resetAt} is the moment the remote quota resets, when the API reports it.
 */
@Getter
public class RateLimitedException extends EtlException {

    private final Instant resetAt;
    private final String entityType;

    public RateLimitedException(String message, Instant resetAt, String entityType) {
        super(message, true);
        this.resetAt = resetAt;
        this.entityType = entityType;
    }

    public RateLimitedException(String message) {
        this(message, null, null);
    }
}
