package org.pulse.etl.service.worker;

import org.pulse.etl.models.dto.TransformedRecord;

import java.util.Map;

public interface RecordTransformer {

    /**
     * @throws org.pulse.etl.exceptions.RecordValidationException when the item cannot become a record
     */
    TransformedRecord transform(String entityType, Map<String, Object> item);
}
