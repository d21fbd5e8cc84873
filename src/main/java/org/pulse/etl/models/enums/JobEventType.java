package org.pulse.etl.models.enums;

public enum JobEventType {
    STATUS,
    PROGRESS,
    EXCEPTION,
    COMPLETION
}
