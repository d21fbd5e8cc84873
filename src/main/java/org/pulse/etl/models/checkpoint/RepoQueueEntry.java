package org.pulse.etl.models.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One repository in the processing queue. {@code cursor} is the next pull
 * request page to fetch; {@code null} means the first page.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepoQueueEntry {

    private String name;
    private boolean finished;
    private String cursor;

    public static RepoQueueEntry pending(String name) {
        return new RepoQueueEntry(name, false, null);
    }
}
