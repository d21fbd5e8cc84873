package org.pulse.etl.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.configuration.EtlProperties;
import org.pulse.etl.exceptions.TransientExtractionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries a page fetch in-process with bounded exponential backoff. Only
 * {@link TransientExtractionException} is retried; everything else propagates at once.
 */
@Slf4j
@Component
public class TransientRetryExecutor {

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int attempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    @Autowired
    public TransientRetryExecutor(EtlProperties properties) {
        this(properties, duration -> Thread.sleep(duration.toMillis()));
    }

    TransientRetryExecutor(EtlProperties properties, Sleeper sleeper) {
        this.attempts = Math.max(1, properties.getExtraction().getTransientAttempts());
        this.initialBackoff = properties.getExtraction().getInitialBackoff();
        this.maxBackoff = properties.getExtraction().getMaxBackoff();
        this.sleeper = sleeper;
    }

    public <T> T execute(String description, Supplier<T> action) {
        Duration backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (TransientExtractionException exception) {
                if (attempt >= attempts) {
                    log.warn("{} failed after {} attempts: {}", description, attempt, exception.getMessage());
                    throw exception;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        description, attempt, attempts, backoff.toMillis(), exception.getMessage());
                pause(backoff, exception);
                backoff = backoff.multipliedBy(2).compareTo(maxBackoff) > 0 ? maxBackoff : backoff.multipliedBy(2);
            }
        }
    }

    private void pause(Duration backoff, TransientExtractionException cause) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new TransientExtractionException("Interrupted while backing off", cause);
        }
    }
}
