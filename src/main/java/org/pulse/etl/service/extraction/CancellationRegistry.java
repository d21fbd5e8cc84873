package org.pulse.etl.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.models.enums.InterruptionReason;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation tokens of the runs currently executing, keyed by job id. A job id maps
 * to the token of its newest run.
 */
@Slf4j
@Component
public class CancellationRegistry {

    private final Map<Long, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(Long jobId) {
        CancellationToken token = new CancellationToken();
        CancellationToken previous = tokens.put(jobId, token);
        if (previous != null) {
            log.debug("Job {} registered a new run while an older run still held a token", jobId);
        }
        return token;
    }

    public boolean cancel(Long jobId) {
        return cancel(jobId, InterruptionReason.MANUAL_STOP);
    }

    public boolean cancel(Long jobId, InterruptionReason reason) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) {
            return false;
        }
        token.cancel(reason);
        log.info("Stop requested for job {} ({})", jobId, reason.value());
        return true;
    }

    public boolean isRegistered(Long jobId) {
        return tokens.containsKey(jobId);
    }

    /**
     * Drops the token of a finished run. A newer run's token stays registered.
     */
    public void unregister(Long jobId, CancellationToken token) {
        tokens.remove(jobId, token);
    }
}
