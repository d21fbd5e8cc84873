package org.pulse.etl.models.dto;

import java.time.Instant;

/**
 * Terminal result of one extraction run, the only thing the registry learns about it.
 */
public record ExtractionOutcome(
        Status status,
        String message,
        Instant resetAt,
        long pagesProcessed,
        long itemsProcessed
) {

    public enum Status {
        COMPLETED,
        RATE_LIMITED,
        INTERRUPTED,
        FAILED,
        CRITICAL
    }

    public static ExtractionOutcome completed(long pages, long items) {
        return new ExtractionOutcome(Status.COMPLETED, null, null, pages, items);
    }

    public static ExtractionOutcome rateLimited(String message, Instant resetAt, long pages, long items) {
        return new ExtractionOutcome(Status.RATE_LIMITED, message, resetAt, pages, items);
    }

    public static ExtractionOutcome interrupted(String message, long pages, long items) {
        return new ExtractionOutcome(Status.INTERRUPTED, message, null, pages, items);
    }

    public static ExtractionOutcome failed(String message, long pages, long items) {
        return new ExtractionOutcome(Status.FAILED, message, null, pages, items);
    }

    public static ExtractionOutcome critical(String message) {
        return new ExtractionOutcome(Status.CRITICAL, message, null, 0, 0);
    }
}
