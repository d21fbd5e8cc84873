package org.pulse.etl.service.events;

import org.pulse.etl.models.dto.JobEvent;

public interface JobEventListener {

    void onEvent(JobEvent event);
}
