package org.pulse.etl.models.enums;

public enum RecoveryMode {
    FRESH_START,
    CHECKPOINT_RESUME,
    RESTART
}
