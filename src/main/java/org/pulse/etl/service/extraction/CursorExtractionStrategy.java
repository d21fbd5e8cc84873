package org.pulse.etl.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.models.checkpoint.CursorCheckpoint;
import org.pulse.etl.models.checkpoint.RepoQueueEntry;
import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.enums.CheckpointStyle;
import org.pulse.etl.models.enums.RecoveryMode;
import org.pulse.etl.service.checkpoint.CheckpointService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Repository by repository, page by page extraction of pull requests and their
 * nested collections. The checkpoint is saved after every page, so a resumed run
 * continues from the exact page (and nested page) where the previous one stopped.
 */
@Slf4j
@Component
public class CursorExtractionStrategy extends CheckpointingExtractionStrategy<CursorCheckpoint> {

    static final String STEP_REPOSITORIES = "repositories";
    static final String STEP_PULL_REQUESTS = "pull_requests";
    static final String STEP_FINALIZE = "finalize";

    public CursorExtractionStrategy(CheckpointService checkpointService, PageDispatcher pageDispatcher) {
        super(checkpointService, pageDispatcher);
    }

    @Override
    public boolean supports(CheckpointStyle style) {
        return style == CheckpointStyle.CURSOR;
    }

    @Override
    protected CursorCheckpoint initialCheckpoint(ExtractionContext context) {
        if (context.getMode() == RecoveryMode.CHECKPOINT_RESUME
                && context.getResumeCheckpoint() instanceof CursorCheckpoint checkpoint) {
            checkpoint.setInterruption(null);
            return checkpoint;
        }
        CursorCheckpoint checkpoint = new CursorCheckpoint();
        checkpoint.setLastRepoSyncCheckpoint(context.getSince());
        return checkpoint;
    }

    @Override
    protected void run(ExtractionContext context, CursorCheckpoint checkpoint) {
        context.enterPhase(STEP_REPOSITORIES);
        if (checkpoint.getRepoProcessingQueue().isEmpty()) {
            discoverRepositories(context).forEach(name -> checkpoint.getRepoProcessingQueue().add(RepoQueueEntry.pending(name)));
            save(context, checkpoint);
        }
        List<RepoQueueEntry> queue = checkpoint.getRepoProcessingQueue();
        context.reportProgress(STEP_REPOSITORIES, null, queue.size() + " repositories queued");

        context.enterPhase(STEP_PULL_REQUESTS);
        for (int i = 0; i < queue.size(); i++) {
            RepoQueueEntry entry = queue.get(i);
            if (entry.isFinished()) {
                continue;
            }
            extractPullRequests(context, checkpoint, entry);
            entry.setFinished(true);
            entry.setCursor(null);
            checkpoint.setLastPrCursor(null);
            save(context, checkpoint);
            context.reportProgress(STEP_PULL_REQUESTS, (double) (i + 1) / queue.size(), "Finished " + entry.getName());
        }

        context.enterPhase(STEP_FINALIZE);
        pageDispatcher.publishMarker(context, false);
        context.reportProgress(STEP_FINALIZE, null, "Extracted " + context.itemCount() + " items");
    }

    private List<String> discoverRepositories(ExtractionContext context) {
        List<String> configured = context.configList("repositories");
        if (!configured.isEmpty()) {
            return configured;
        }
        Object organization = context.config().get("organization");
        if (organization == null || organization.toString().isBlank()) {
            throw new IllegalStateException("Job " + context.getJob().getName()
                    + " needs 'repositories' or 'organization' in its extraction config");
        }

        List<String> discovered = new ArrayList<>();
        String cursor = null;
        do {
            ExtractionPage page = context.fetch(STEP_REPOSITORIES, organization.toString(), cursor);
            pageDispatcher.dispatch(context, page, organization.toString(), cursor);
            page.items().stream()
                    .map(item -> item.get("name"))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .forEach(discovered::add);
            cursor = page.nextCursor();
        } while (cursor != null);
        log.info("Job {} discovered {} repositories in {}", context.getJob().getName(), discovered.size(), organization);
        return discovered;
    }

    private void extractPullRequests(ExtractionContext context, CursorCheckpoint checkpoint, RepoQueueEntry entry) {
        String skipThrough = null;
        if (checkpoint.hasNestedState()) {
            skipThrough = checkpoint.getCurrentPrNodeId();
            log.info("Job {} resuming nested collections of pull request {} in {}",
                    context.getJob().getName(), skipThrough, entry.getName());
            extractNestedPages(context, checkpoint, skipThrough);
        }

        String cursor = entry.getCursor();
        while (true) {
            ExtractionPage page = context.fetch(STEP_PULL_REQUESTS, entry.getName(), cursor);
            pageDispatcher.dispatch(context, page, entry.getName(), cursor);

            List<Map<String, Object>> items = page.items();
            int start = 0;
            if (skipThrough != null) {
                int resumedAt = indexOfNode(items, skipThrough);
                if (resumedAt < 0) {
                    log.warn("Job {}: pull request {} not found on resumed page of {}, processing the whole page",
                            context.getJob().getName(), skipThrough, entry.getName());
                } else {
                    start = resumedAt + 1;
                }
                skipThrough = null;
            }
            for (int k = start; k < items.size(); k++) {
                startNested(context, checkpoint, items.get(k));
            }

            entry.setCursor(page.nextCursor());
            checkpoint.setLastPrCursor(page.nextCursor());
            save(context, checkpoint);
            if (!page.hasNextPage()) {
                return;
            }
            cursor = page.nextCursor();
        }
    }

    private void startNested(ExtractionContext context, CursorCheckpoint checkpoint, Map<String, Object> pullRequest) {
        if (!(pullRequest.get(ExtractionClient.NESTED_CURSORS) instanceof Map<?, ?> cursors) || cursors.isEmpty()) {
            return;
        }
        String nodeId = nodeId(pullRequest);
        boolean pending = false;
        for (String kind : CursorCheckpoint.NESTED_KINDS) {
            Object cursor = cursors.get(kind);
            checkpoint.setNestedCursor(kind, cursor == null ? null : cursor.toString());
            pending |= cursor != null;
        }
        if (!pending || nodeId == null) {
            checkpoint.clearNestedState();
            return;
        }
        // every kind still to fetch is recorded up front so a resume knows exactly what is left
        checkpoint.setCurrentPrNodeId(nodeId);
        save(context, checkpoint);
        extractNestedPages(context, checkpoint, nodeId);
    }

    private void extractNestedPages(ExtractionContext context, CursorCheckpoint checkpoint, String nodeId) {
        for (String kind : CursorCheckpoint.NESTED_KINDS) {
            String cursor = checkpoint.nestedCursor(kind);
            while (cursor != null) {
                ExtractionPage page = context.fetch(kind, nodeId, cursor);
                pageDispatcher.dispatch(context, page, nodeId, cursor);
                cursor = page.nextCursor();
                checkpoint.setNestedCursor(kind, cursor);
                save(context, checkpoint);
            }
        }
        checkpoint.clearNestedState();
    }

    private static int indexOfNode(List<Map<String, Object>> items, String nodeId) {
        for (int i = 0; i < items.size(); i++) {
            if (nodeId.equals(nodeId(items.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private static String nodeId(Map<String, Object> item) {
        Object value = item.containsKey("node_id") ? item.get("node_id") : item.get("id");
        return value == null ? null : value.toString();
    }
}
