package org.pulse.etl.exceptions;

public class RawDataNotFoundException extends RuntimeException {

    public RawDataNotFoundException(Long rawDataId) {
        super("Raw data not found: " + rawDataId);
    }
}
