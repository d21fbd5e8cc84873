package org.pulse.etl.service.recovery;

import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.enums.RecoveryMode;

import java.time.Instant;

public record RecoveryPlan(
        RecoveryMode mode,
        CheckpointDocument checkpoint,
        Instant since
) {
}
