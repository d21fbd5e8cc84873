package org.pulse.etl.service.extraction;

import org.pulse.etl.models.enums.CheckpointStyle;

public interface ExtractionStrategy {

    boolean supports(CheckpointStyle style);

    void extract(ExtractionContext context);
}
