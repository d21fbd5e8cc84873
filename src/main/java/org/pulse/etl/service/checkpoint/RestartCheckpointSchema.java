package org.pulse.etl.service.checkpoint;

import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.checkpoint.RestartCheckpoint;
import org.pulse.etl.models.enums.CheckpointStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class RestartCheckpointSchema implements CheckpointSchema {

    @Override
    public boolean supports(CheckpointStyle style) {
        return style == CheckpointStyle.RESTART;
    }

    @Override
    public Class<? extends CheckpointDocument> documentType() {
        return RestartCheckpoint.class;
    }

    @Override
    public List<String> missingFields(CheckpointDocument document) {
        RestartCheckpoint checkpoint = (RestartCheckpoint) document;
        List<String> missing = new ArrayList<>();
        if (checkpoint.getCheckpointTimestamp() == null) {
            missing.add("checkpoint_timestamp");
        }
        if (checkpoint.getTotalProcessed() == null) {
            missing.add("total_processed");
        }
        return missing;
    }
}
