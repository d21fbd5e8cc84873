package org.pulse.etl.models.enums;

import lombok.Getter;

import java.util.List;

@Getter
public enum JobType {
    JIRA(CheckpointStyle.RESTART, List.of("units", "issues", "finalize")),
    GITHUB(CheckpointStyle.CURSOR, List.of("repositories", "pull_requests", "finalize"));

    private final CheckpointStyle checkpointStyle;
    private final List<String> steps;

    JobType(CheckpointStyle checkpointStyle, List<String> steps) {
        this.checkpointStyle = checkpointStyle;
        this.steps = steps;
    }

    public int totalSteps() {
        return steps.size();
    }

    public int stepIndex(String step) {
        int index = steps.indexOf(step);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown step '" + step + "' for job type " + name());
        }
        return index;
    }
}
