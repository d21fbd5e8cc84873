package org.pulse.etl.models.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InterruptionReason {
    RATE_LIMITED("rate_limited"),
    MANUAL_STOP("manual_stop"),
    WATCHDOG("watchdog"),
    TRANSIENT_FAILURE("transient_failure"),
    FAILURE("failure");

    private final String value;

    InterruptionReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
