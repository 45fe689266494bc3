package com.armada.core.engine;

import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventBus;
import com.armada.core.executor.UnitOfWork;
import com.armada.core.lock.LockManager;
import com.armada.core.lock.LockToken;
import com.armada.core.logging.MdcContext;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.RunState;
import com.armada.core.model.RunStatus;
import com.armada.core.model.RunSummary;
import com.armada.core.model.Wave;
import com.armada.core.plan.InvalidPlanException;
import com.armada.core.plan.PlanLoader;
import com.armada.core.plan.PlanStore;
import com.armada.core.scheduler.RunContext;
import com.armada.core.scheduler.WaveResult;
import com.armada.core.scheduler.WaveScheduler;
import com.armada.core.state.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level control loop for one orchestration target.
 *
 * <p>Setup resolves and validates the plan, acquires the run's lock, and loads or initializes
 * the run state. Waves then run strictly in order. Before each wave the driver stops with
 * {@code interrupted} if shutdown was requested, or with {@code fatal_error} if any item is
 * fatal. After the last wave the finalizer runs and the run is marked {@code completed}.
 * The lock is released however the driver exits.
 *
 * <p>Setup failures surface as exceptions ({@link InvalidPlanException},
 * {@link com.armada.core.lock.LockHeldException},
 * {@link com.armada.core.state.RunStateAlreadyExistsException}). Item failures never do.
 */
public class RunDriver {

    private static final Logger log = LoggerFactory.getLogger(RunDriver.class);

    private final RunStateStore stateStore;
    private final PlanStore planStore;
    private final PlanLoader planLoader;
    private final LockManager lockManager;
    private final WaveScheduler scheduler;
    private final RunFinalizer finalizer;
    private final WorkFactory workFactory;
    private final ShutdownSignal shutdown;
    private final EventBus eventBus;
    private final ArmadaMetrics metrics;

    public RunDriver(RunStateStore stateStore, PlanStore planStore, PlanLoader planLoader,
                     LockManager lockManager, WaveScheduler scheduler, RunFinalizer finalizer,
                     WorkFactory workFactory, ShutdownSignal shutdown, EventBus eventBus,
                     ArmadaMetrics metrics) {
        this.stateStore = stateStore;
        this.planStore = planStore;
        this.planLoader = planLoader;
        this.lockManager = lockManager;
        this.scheduler = scheduler;
        this.finalizer = finalizer;
        this.workFactory = workFactory;
        this.shutdown = shutdown;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public RunOutcome execute(RunRequest request) {
        return execute(request, null);
    }

    /**
     * @param work unit of work to use, or null to obtain one from the {@link WorkFactory}
     */
    public RunOutcome execute(RunRequest request, UnitOfWork work) {
        String runId = request.runId();
        Map<String, String> previousMdc = MdcContext.capture();
        MdcContext.setRun(runId);
        try {
            ExecutionPlan plan = resolvePlan(request);
            if (request.dryRun()) {
                RunState existing = stateStore.find(runId).orElse(null);
                log.info("Dry run of {}: {} wave(s), {} item(s)", runId, plan.waves().size(), plan.totalItems());
                return new RunOutcome(runId, null,
                        existing != null ? RunSummary.of(existing, plan) : null,
                        plan, existing, null, true);
            }

            LockToken lock = lockManager.acquire(runId, request.force());
            shutdown.runStarted();
            try {
                UnitOfWork effective = work != null ? work : workFactory.create(request, this);
                return drive(request, plan, effective);
            } finally {
                lockManager.release(lock);
                shutdown.runFinished();
            }
        } finally {
            MdcContext.restore(previousMdc);
        }
    }

    private RunOutcome drive(RunRequest request, ExecutionPlan plan, UnitOfWork work) {
        String runId = request.runId();
        RunState state = prepareState(request);
        planStore.save(runId, plan);

        int maxRetries = request.settings().maxRetries();
        if (state.status() == RunStatus.COMPLETED && !hasPendingWork(state, plan, maxRetries)) {
            log.info("Run {} already completed, nothing to do", runId);
            return outcome(state, plan, finalizerReport(runId));
        }

        state = stateStore.update(runId, s -> s.withStatus(RunStatus.RUNNING));
        publish("run.started", runId, Map.of(
                "level", request.level().prefix(),
                "waves", plan.waves().size(),
                "items", plan.totalItems()));
        log.info("Run {} started: {} wave(s), {} {}(s), maxParallel={}, maxRetries={}, timeout={}m",
                runId, plan.waves().size(), plan.totalItems(), request.level().itemNoun(),
                request.settings().maxParallel(), request.settings().maxRetries(),
                request.settings().itemTimeout().toMinutes());

        var ctx = new RunContext(runId, request.level(), plan, work, request.settings(),
                shutdown::isRequested, shutdown.asSleeper());

        for (Wave wave : plan.waves()) {
            if (state.waveCompleted(wave.number())
                    && WaveScheduler.eligibleItems(state, wave, maxRetries).isEmpty()) {
                log.debug("Wave {} already completed, skipping", wave.number());
                continue;
            }
            if (shutdown.isRequested() || Thread.currentThread().isInterrupted()) {
                return finish(runId, plan, RunStatus.INTERRUPTED, null);
            }
            if (stateStore.load(runId).hasFatalItems()) {
                return finish(runId, plan, RunStatus.FATAL_ERROR, null);
            }

            MdcContext.setWave(runId, wave.number());
            stateStore.update(runId, s -> s.withCurrentWave(wave.number()));
            publish("wave.started", runId, Map.of(
                    "wave", wave.number(),
                    "items", wave.itemIds(),
                    "description", wave.description() == null ? "" : wave.description()));
            log.info("Wave {}/{} started: {}", wave.number(), plan.waves().size(), wave.itemIds());

            WaveResult result = scheduler.runWave(ctx, wave);
            if (result.status() == WaveResult.Status.HALTED_FATAL) {
                return finish(runId, plan, RunStatus.FATAL_ERROR, null);
            }
            if (result.status() == WaveResult.Status.INTERRUPTED) {
                return finish(runId, plan, RunStatus.INTERRUPTED, null);
            }
            state = stateStore.update(runId, s -> s.withWaveCompleted(wave.number()));
            RunSummary progress = RunSummary.of(state, plan);
            publish("wave.completed", runId, Map.of(
                    "wave", wave.number(),
                    "passes", result.passes(),
                    "completed", progress.completed(),
                    "total", progress.total()));
            log.info("Wave {} complete after {} pass(es)", wave.number(), result.passes());
            MdcContext.setRun(runId);
        }

        state = stateStore.load(runId);
        if (state.hasFatalItems()) {
            return finish(runId, plan, RunStatus.FATAL_ERROR, null);
        }
        Path report = finalizer.finalizeRun(state, plan).orElse(null);
        return finish(runId, plan, RunStatus.COMPLETED, report);
    }

    private RunState prepareState(RunRequest request) {
        String runId = request.runId();
        if (request.fresh()) {
            stateStore.discard(runId);
            return stateStore.initialize(runId, request.level(), true);
        }
        if (request.resume()) {
            Optional<RunState> existing = stateStore.find(runId);
            if (existing.isPresent()) {
                RunState state = existing.get();
                log.info("Resuming run {} (status {}, completed waves {})", runId,
                        state.status().wireName(), state.completedWaves());
                if (state.status() == RunStatus.FATAL_ERROR) {
                    log.warn("Run {} previously halted on a fatal error; fatal items stay fatal until --fresh", runId);
                }
                return state;
            }
            log.info("No state to resume for run {}, starting a new run", runId);
        }
        return stateStore.initialize(runId, request.level(), false);
    }

    private ExecutionPlan resolvePlan(RunRequest request) {
        if (request.planFile() != null) {
            return planLoader.load(request.planFile());
        }
        return planStore.find(request.runId()).orElseThrow(() -> new InvalidPlanException(request.runId(),
                List.of("no plan file given and no stored plan at " + planStore.planFile(request.runId()))));
    }

    private RunOutcome finish(String runId, ExecutionPlan plan, RunStatus status, Path report) {
        RunState state = stateStore.update(runId, s -> s.withStatus(status));
        RunSummary summary = RunSummary.of(state, plan);
        if (metrics != null) {
            metrics.recordRunResult(state.level(), status);
        }
        String eventType = switch (status) {
            case COMPLETED -> "run.completed";
            case INTERRUPTED -> "run.interrupted";
            default -> "run.fatal";
        };
        publish(eventType, runId, Map.of(
                "status", status.wireName(),
                "completed", summary.completed(),
                "failed", summary.failed(),
                "fatal", summary.fatal(),
                "pending", summary.pending(),
                "total", summary.total()));
        if (status == RunStatus.COMPLETED) {
            log.info("Run {} completed: {}/{} completed, {} failed", runId,
                    summary.completed(), summary.total(), summary.failed());
        } else {
            log.warn("Run {} stopped with status {}: {}/{} completed, {} failed, {} fatal", runId,
                    status.wireName(), summary.completed(), summary.total(), summary.failed(), summary.fatal());
        }
        return new RunOutcome(runId, status, summary, plan, state, report, false);
    }

    private RunOutcome outcome(RunState state, ExecutionPlan plan, Path report) {
        return new RunOutcome(state.runId(), state.status(), RunSummary.of(state, plan), plan, state, report, false);
    }

    private Path finalizerReport(String runId) {
        if (finalizer instanceof ReportWriter writer) {
            Path file = writer.reportFile(runId);
            return Files.isRegularFile(file) ? file : null;
        }
        return null;
    }

    /**
     * True if some wave is unfinished, or a finished wave holds items the current retry budget
     * makes eligible again.
     */
    private static boolean hasPendingWork(RunState state, ExecutionPlan plan, int maxRetries) {
        return plan.waves().stream().anyMatch(w -> !state.waveCompleted(w.number())
                || !WaveScheduler.eligibleItems(state, w, maxRetries).isEmpty());
    }

    private void publish(String type, String runId, Map<String, Object> payload) {
        eventBus.publish(ArmadaEvent.of(type, runId, null, payload));
    }
}
