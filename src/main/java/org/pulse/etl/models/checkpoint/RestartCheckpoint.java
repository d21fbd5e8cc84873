package org.pulse.etl.models.checkpoint;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RestartCheckpoint extends CheckpointDocument {

    private Instant lastSyncAt;
    private Long totalProcessed;
    private String currentUnit;
    private List<String> unitsCompleted = new ArrayList<>();
}
