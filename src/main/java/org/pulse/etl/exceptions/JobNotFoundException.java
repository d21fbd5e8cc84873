package org.pulse.etl.exceptions;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(Long jobId) {
        super("Job not found: " + jobId);
    }
}
