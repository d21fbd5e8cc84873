package org.pulse.etl.service.checkpoint;

import org.pulse.etl.models.checkpoint.CheckpointDocument;
import org.pulse.etl.models.enums.CheckpointStyle;

import java.util.List;

public interface CheckpointSchema {

    boolean supports(CheckpointStyle style);

    Class<? extends CheckpointDocument> documentType();

    /**
     * @return names of required fields absent from the document; empty when the document is usable
     */
    List<String> missingFields(CheckpointDocument document);
}
