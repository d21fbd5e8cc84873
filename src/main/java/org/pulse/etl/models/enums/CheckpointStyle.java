package org.pulse.etl.models.enums;

/**
 * How a source recovers from interruption.
 * <p>
 * {@code CURSOR} sources resume pagination exactly where they stopped.
 * {@code RESTART} sources throw the checkpoint away and re-extract everything,
 * relying on idempotent upserts downstream.
 */
public enum CheckpointStyle {
    CURSOR,
    RESTART
}
