package org.pulse.etl.exceptions;

import lombok.Getter;

@Getter
public class RecordValidationException extends EtlException {

    private final String recordKey;

    public RecordValidationException(String recordKey, String message) {
        super(message, false);
        this.recordKey = recordKey;
    }
}
