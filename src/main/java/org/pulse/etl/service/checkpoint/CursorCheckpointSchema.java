package org.pulse.etl.service.checkpoint;

import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.checkpoint.CursorCheckpoint;
import org.pulse.etl.models.checkpoint.RepoQueueEntry;
import org.pulse.etl.models.enums.CheckpointStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CursorCheckpointSchema implements CheckpointSchema {

    @Override
    public boolean supports(CheckpointStyle style) {
        return style == CheckpointStyle.CURSOR;
    }

    @Override
    public Class<? extends CheckpointDocument> documentType() {
        return CursorCheckpoint.class;
    }

    @Override
    public List<String> missingFields(CheckpointDocument document) {
        CursorCheckpoint checkpoint = (CursorCheckpoint) document;
        List<String> missing = new ArrayList<>();
        if (checkpoint.getCheckpointTimestamp() == null) {
            missing.add("checkpoint_timestamp");
        }
        if (checkpoint.getRepoProcessingQueue() == null || checkpoint.getRepoProcessingQueue().isEmpty()) {
            missing.add("repo_processing_queue");
            return missing;
        }
        for (int i = 0; i < checkpoint.getRepoProcessingQueue().size(); i++) {
            RepoQueueEntry entry = checkpoint.getRepoProcessingQueue().get(i);
            if (entry == null || entry.getName() == null || entry.getName().isBlank()) {
                missing.add("repo_processing_queue[" + i + "].name");
            }
        }
        // a nested cursor is meaningless without the pull request it belongs to
        if (checkpoint.getCurrentPrNodeId() == null && CursorCheckpoint.NESTED_KINDS.stream()
                .anyMatch(kind -> checkpoint.nestedCursor(kind) != null)) {
            missing.add("current_pr_node_id");
        }
        return missing;
    }
}
