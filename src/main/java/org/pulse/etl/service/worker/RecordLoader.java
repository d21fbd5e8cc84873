package org.pulse.etl.service.worker;

import org.pulse.etl.models.dto.TransformedRecord;
import org.pulse.etl.models.entity.RawExtractionData;

import java.util.List;

/**
 * Writes transformed records to their final store. Implementations upsert by record
 * key, so loading the same batch twice leaves the store unchanged.
 */
public interface RecordLoader {

    int upsert(RawExtractionData source, List<TransformedRecord> records);
}
