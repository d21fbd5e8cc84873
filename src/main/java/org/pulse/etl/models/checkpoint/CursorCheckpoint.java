package org.pulse.etl.models.checkpoint;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CursorCheckpoint extends CheckpointDocument {

    public static final String COMMITS = "commits";
    public static final String REVIEWS = "reviews";
    public static final String COMMENTS = "comments";
    public static final String REVIEW_THREADS = "review_threads";

    public static final List<String> NESTED_KINDS = List.of(COMMITS, REVIEWS, COMMENTS, REVIEW_THREADS);

    private List<RepoQueueEntry> repoProcessingQueue = new ArrayList<>();
    private Instant lastRepoSyncCheckpoint;
    private String lastPrCursor;
    private String currentPrNodeId;
    private String lastCommitCursor;
    private String lastReviewCursor;
    private String lastCommentCursor;
    private String lastReviewThreadCursor;

    public Optional<RepoQueueEntry> nextUnfinished() {
        return repoProcessingQueue.stream().filter(entry -> !entry.isFinished()).findFirst();
    }

    public boolean hasNestedState() {
        return currentPrNodeId != null && NESTED_KINDS.stream().anyMatch(kind -> nestedCursor(kind) != null);
    }

    public String nestedCursor(String kind) {
        return switch (kind) {
            case COMMITS -> lastCommitCursor;
            case REVIEWS -> lastReviewCursor;
            case COMMENTS -> lastCommentCursor;
            case REVIEW_THREADS -> lastReviewThreadCursor;
            default -> throw new IllegalArgumentException("Unknown nested kind: " + kind);
        };
    }

    public void setNestedCursor(String kind, String cursor) {
        switch (kind) {
            case COMMITS -> lastCommitCursor = cursor;
            case REVIEWS -> lastReviewCursor = cursor;
            case COMMENTS -> lastCommentCursor = cursor;
            case REVIEW_THREADS -> lastReviewThreadCursor = cursor;
            default -> throw new IllegalArgumentException("Unknown nested kind: " + kind);
        }
    }

    public void clearNestedState() {
        currentPrNodeId = null;
        NESTED_KINDS.forEach(kind -> setNestedCursor(kind, null));
    }

    public static CursorCheckpoint forRepositories(List<String> repositories) {
        CursorCheckpoint checkpoint = new CursorCheckpoint();
        repositories.forEach(name -> checkpoint.getRepoProcessingQueue().add(RepoQueueEntry.pending(name)));
        return checkpoint;
    }
}
