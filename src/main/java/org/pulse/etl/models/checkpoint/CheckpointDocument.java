package org.pulse.etl.models.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;
import org.pulse.etl.models.enums.InterruptionReason;

import java.time.Instant;

/**
 * Recovery state stored in {@code etl_jobs.checkpoint_data}. The concrete
 * variant is chosen by the job's {@link org.pulse.etl.models.enums.CheckpointStyle}.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class CheckpointDocument {

    private Instant checkpointTimestamp;
    private String checkpointPhase;
    private InterruptionReason interruption;
}
