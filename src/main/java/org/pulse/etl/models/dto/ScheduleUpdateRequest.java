package org.pulse.etl.models.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record ScheduleUpdateRequest(
        @NotNull @Min(1) Integer scheduleIntervalMinutes,
        @NotNull @Min(1) Integer retryIntervalMinutes
) {

    @AssertTrue(message = "retryIntervalMinutes must be shorter than scheduleIntervalMinutes")
    public boolean isRetryShorterThanSchedule() {
        return scheduleIntervalMinutes == null || retryIntervalMinutes == null
                || retryIntervalMinutes < scheduleIntervalMinutes;
    }
}
