package com.armada.core.engine;

import com.armada.core.executor.UnitOfWork;
import com.armada.core.executor.WorkResult;
import com.armada.core.lock.LockHeldException;
import com.armada.core.model.ErrorRecord;
import com.armada.core.model.ItemState;
import com.armada.core.model.ItemStatus;
import com.armada.core.model.RunLevel;
import com.armada.core.model.RunState;
import com.armada.core.model.RunStatus;
import com.armada.core.model.RunSummary;
import com.armada.core.model.WorkItem;
import com.armada.core.plan.InvalidPlanException;
import com.armada.core.scheduler.SchedulerSettings;
import com.armada.core.state.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Project-level unit of work: runs the epic's own driver in-process, resuming its stored
 * state and plan. The nested run's whole lifetime is one outcome for the outer scheduler.
 *
 * <p>The output handed back for classification is the nested run's status line followed by
 * the messages of its failing items, so an auth or quota failure inside the epic halts the
 * project as well. Identifiers and counts of the nested run stay out of that text, where they
 * could read as error markers. An interrupted nested run is reported as interrupted, not failed,
 * so the epic stays in progress and the next resume continues it.
 */
public class EpicRunWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(EpicRunWork.class);

    private final RunDriver driver;
    private final RunStateStore stateStore;
    private final SchedulerSettings epicSettings;

    public EpicRunWork(RunDriver driver, RunStateStore stateStore, SchedulerSettings epicSettings) {
        this.driver = driver;
        this.stateStore = stateStore;
        this.epicSettings = epicSettings;
    }

    @Override
    public WorkResult execute(WorkItem item) {
        String runId = RunLevel.EPIC.runId(item.id());
        var request = new RunRequest(RunLevel.EPIC, item.id(), null, true, false, false, false,
                settingsFor(runId));
        log.info("Starting nested run {} (maxRetries={})", runId, request.settings().maxRetries());
        RunOutcome outcome;
        try {
            outcome = driver.execute(request);
        } catch (InvalidPlanException e) {
            log.warn("Nested run {} has no usable plan: {}", request.runId(), e.getMessage());
            return WorkResult.failure("status=invalid_plan nested run has no usable plan", RunOutcome.EXIT_FATAL);
        } catch (LockHeldException e) {
            log.warn("Nested run {} is locked: {}", request.runId(), e.getMessage());
            return WorkResult.failure("status=locked nested run is held by another live process", RunOutcome.EXIT_FATAL);
        }
        String output = describe(outcome);
        RunSummary summary = outcome.summary();
        log.info("Nested run {} ended: {} ({}/{} completed, {} failed, {} fatal)", request.runId(),
                outcome.status().wireName(), summary.completed(), summary.total(), summary.failed(),
                summary.fatal());
        if (outcome.status() == RunStatus.INTERRUPTED) {
            return WorkResult.interrupted(output, outcome.exitCode());
        }
        return outcome.isSuccess()
                ? WorkResult.success(output)
                : WorkResult.failure(output, outcome.exitCode());
    }

    /**
     * Each invocation grants failed items of the nested run a full retry budget on top of the
     * attempts they already spent, so an outer retry actually re-runs them.
     */
    SchedulerSettings settingsFor(String runId) {
        int spent = stateStore.find(runId)
                .map(state -> state.items().values().stream()
                        .filter(s -> s.status() == ItemStatus.FAILED)
                        .mapToInt(ItemState::attempts)
                        .max().orElse(0))
                .orElse(0);
        if (spent == 0) {
            return epicSettings;
        }
        return new SchedulerSettings(epicSettings.maxParallel(), spent + epicSettings.maxRetries(),
                epicSettings.itemTimeout());
    }

    static String describe(RunOutcome outcome) {
        var sb = new StringBuilder("status=").append(outcome.status().wireName());
        RunState state = outcome.state();
        boolean fatalOnly = outcome.status() == RunStatus.FATAL_ERROR;
        for (ErrorRecord error : lastErrorPerItem(state).values()) {
            ItemStatus status = state.statusOf(error.itemId());
            if (fatalOnly ? status == ItemStatus.FATAL : status != ItemStatus.COMPLETED) {
                sb.append('\n').append(error.message());
            }
        }
        return sb.toString();
    }

    private static Map<String, ErrorRecord> lastErrorPerItem(RunState state) {
        var last = new LinkedHashMap<String, ErrorRecord>();
        for (ErrorRecord error : state.errors()) {
            last.remove(error.itemId());
            last.put(error.itemId(), error);
        }
        return last;
    }
}
