package org.pulse.etl.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.models.checkpoint.RestartCheckpoint;
import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.enums.CheckpointStyle;
import org.pulse.etl.service.checkpoint.CheckpointService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Full re-extraction of every configured unit since the last successful run.
 * Progress is recorded for visibility only; an interrupted run starts over.
 */
@Slf4j
@Component
public class RestartExtractionStrategy extends CheckpointingExtractionStrategy<RestartCheckpoint> {

    static final String STEP_UNITS = "units";
    static final String STEP_ISSUES = "issues";
    static final String STEP_FINALIZE = "finalize";

    public RestartExtractionStrategy(CheckpointService checkpointService, PageDispatcher pageDispatcher) {
        super(checkpointService, pageDispatcher);
    }

    @Override
    public boolean supports(CheckpointStyle style) {
        return style == CheckpointStyle.RESTART;
    }

    @Override
    protected RestartCheckpoint initialCheckpoint(ExtractionContext context) {
        RestartCheckpoint checkpoint = new RestartCheckpoint();
        checkpoint.setLastSyncAt(context.getSince());
        checkpoint.setTotalProcessed(0L);
        return checkpoint;
    }

    @Override
    protected void run(ExtractionContext context, RestartCheckpoint checkpoint) {
        context.enterPhase(STEP_UNITS);
        List<String> units = discoverUnits(context);
        save(context, checkpoint);
        context.reportProgress(STEP_UNITS, null, units.size() + " projects to extract");

        context.enterPhase(STEP_ISSUES);
        for (int i = 0; i < units.size(); i++) {
            String unit = units.get(i);
            checkpoint.setCurrentUnit(unit);
            String cursor = null;
            do {
                ExtractionPage page = context.fetch(STEP_ISSUES, unit, cursor);
                pageDispatcher.dispatch(context, page, unit, cursor);
                checkpoint.setTotalProcessed(checkpoint.getTotalProcessed() + page.items().size());
                save(context, checkpoint);
                cursor = page.nextCursor();
            } while (cursor != null);

            checkpoint.getUnitsCompleted().add(unit);
            save(context, checkpoint);
            context.reportProgress(STEP_ISSUES, (double) (i + 1) / units.size(), "Finished " + unit);
        }
        checkpoint.setCurrentUnit(null);

        context.enterPhase(STEP_FINALIZE);
        pageDispatcher.publishMarker(context, false);
        context.reportProgress(STEP_FINALIZE, null, "Extracted " + checkpoint.getTotalProcessed() + " issues");
    }

    private List<String> discoverUnits(ExtractionContext context) {
        List<String> configured = context.configList("projects");
        if (!configured.isEmpty()) {
            return configured;
        }
        List<String> discovered = new ArrayList<>();
        String cursor = null;
        do {
            ExtractionPage page = context.fetch("projects", null, cursor);
            pageDispatcher.dispatch(context, page, null, cursor);
            page.items().stream()
                    .map(item -> item.get("key"))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .forEach(discovered::add);
            cursor = page.nextCursor();
        } while (cursor != null);
        log.info("Job {} discovered {} projects", context.getJob().getName(), discovered.size());
        return discovered;
    }
}
