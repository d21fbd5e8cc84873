package org.pulse.etl.service.extraction;

import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.dto.ExtractionRequest;
import org.pulse.etl.models.enums.JobType;

/**
 * Fetches one page from a remote API.
 * <p>
 * Implementations throw {@link org.pulse.etl.exceptions.RateLimitedException} when the
 * remote quota is exhausted and {@link org.pulse.etl.exceptions.TransientExtractionException}
 * for timeouts and server errors. Pull request items may carry a {@code nested_cursors}
 * map ({@code commits}, {@code reviews}, {@code comments}, {@code review_threads}) naming
 * the continuation cursor of every nested collection that has more pages.
 */
public interface ExtractionClient {

    String NESTED_CURSORS = "nested_cursors";

    boolean supports(JobType jobType);

    ExtractionPage fetchPage(ExtractionRequest request);
}
