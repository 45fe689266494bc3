package com.armada.core.scheduler;

import com.armada.core.classify.ErrorClassifier;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventBus;
import com.armada.core.executor.BoundedExecutor;
import com.armada.core.executor.ExecutionListener;
import com.armada.core.executor.WorkOutcome;
import com.armada.core.logging.MdcContext;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.ErrorKind;
import com.armada.core.model.ErrorRecord;
import com.armada.core.model.ItemState;
import com.armada.core.model.ItemStatus;
import com.armada.core.model.RunState;
import com.armada.core.model.Wave;
import com.armada.core.model.WorkItem;
import com.armada.core.state.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one wave to completion: dispatches eligible items, classifies each outcome as it
 * arrives, records the transition, and repeats with backoff while failed items still have
 * attempts left.
 *
 * <p>Item state machine:
 * <pre>
 * pending     -&gt; in_progress   dispatched
 * in_progress -&gt; completed     success, or the item's artifact exists
 * in_progress -&gt; fatal         failure classified auth or quota
 * in_progress -&gt; failed        any other failure; attempts + 1
 * failed      -&gt; in_progress   while attempts &lt; maxRetries
 * </pre>
 *
 * An item whose work stopped early on a shutdown request keeps {@code in_progress} and is
 * re-dispatched on resume without spending an attempt.
 *
 * A wave is complete once no item is eligible. Any fatal item anywhere in the run stops the
 * scheduler before the next pass. Per-item failures never escape as exceptions; only state
 * store failures do.
 */
public class WaveScheduler {

    private static final Logger log = LoggerFactory.getLogger(WaveScheduler.class);
    private static final int MAX_MESSAGE_CHARS = 500;

    private final RunStateStore store;
    private final BoundedExecutor executor;
    private final ErrorClassifier classifier;
    private final BackoffPolicy backoff;
    private final ArtifactProbe artifacts;
    private final EventBus eventBus;
    private final ArmadaMetrics metrics;
    private final Clock clock;

    public WaveScheduler(RunStateStore store, BoundedExecutor executor, ErrorClassifier classifier,
                         BackoffPolicy backoff, ArtifactProbe artifacts, EventBus eventBus,
                         ArmadaMetrics metrics, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.classifier = classifier;
        this.backoff = backoff;
        this.artifacts = artifacts;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public WaveResult runWave(RunContext ctx, Wave wave) {
        String runId = ctx.runId();
        int maxRetries = ctx.settings().maxRetries();
        int passes = 0;
        int launched = 0;

        while (true) {
            RunState state = store.load(runId);
            if (state.hasFatalItems()) {
                log.warn("Fatal item present in run {}, not dispatching wave {}", runId, wave.number());
                return new WaveResult(WaveResult.Status.HALTED_FATAL, passes, launched);
            }
            if (ctx.stopRequested().getAsBoolean()) {
                return new WaveResult(WaveResult.Status.INTERRUPTED, passes, launched);
            }

            List<WorkItem> eligible = wave.itemIds().stream()
                    .filter(id -> isEligible(state.item(id), maxRetries))
                    .map(ctx.plan()::item)
                    .toList();
            if (eligible.isEmpty()) {
                logExhausted(state, wave, maxRetries);
                return new WaveResult(WaveResult.Status.COMPLETE, passes, launched);
            }

            if (passes > 0) {
                Duration delay = backoff.delay(passes);
                log.info("Wave {}: retry pass {} for {} in {}s", wave.number(), passes + 1,
                        ids(eligible), delay.toSeconds());
                eventBus.publish(ArmadaEvent.of("wave.retry", runId, null, Map.of(
                        "wave", wave.number(),
                        "pass", passes + 1,
                        "items", ids(eligible),
                        "delaySeconds", delay.toSeconds())));
                try {
                    ctx.sleeper().sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new WaveResult(WaveResult.Status.INTERRUPTED, passes, launched);
                }
                if (ctx.stopRequested().getAsBoolean()) {
                    return new WaveResult(WaveResult.Status.INTERRUPTED, passes, launched);
                }
            }

            passes++;
            launched += eligible.size();
            if (metrics != null) {
                metrics.recordWaveExecution(eligible.size());
            }
            log.info("Wave {} pass {}: dispatching {} {}(s): {}", wave.number(), passes, eligible.size(),
                    ctx.level().itemNoun(), ids(eligible));

            List<WorkOutcome> outcomes = executor.run(eligible, ctx.work(), ctx.settings().maxParallel(),
                    ctx.settings().itemTimeout(), new Recorder(ctx), ctx.stopRequested());
            log.debug("Wave {} pass {}: {} outcome(s)", wave.number(), passes, outcomes.size());

            if (Thread.currentThread().isInterrupted()) {
                return new WaveResult(WaveResult.Status.INTERRUPTED, passes, launched);
            }
        }
    }

    /**
     * Items the next pass would dispatch for {@code wave}, given {@code state}. Used by dry runs.
     */
    public static List<String> eligibleItems(RunState state, Wave wave, int maxRetries) {
        return wave.itemIds().stream().filter(id -> isEligible(state.item(id), maxRetries)).toList();
    }

    static boolean isEligible(ItemState item, int maxRetries) {
        return switch (item.status()) {
            case PENDING, IN_PROGRESS -> true;
            case FAILED -> item.attempts() < maxRetries;
            case COMPLETED, FATAL -> false;
        };
    }

    private void logExhausted(RunState state, Wave wave, int maxRetries) {
        for (String id : wave.itemIds()) {
            if (state.statusOf(id) == ItemStatus.FAILED) {
                log.warn("{} failed {} time(s), max retries ({}) reached", id, state.attemptsOf(id), maxRetries);
            }
        }
    }

    /** Applies each executor callback to the run state. Runs on the control thread only. */
    private final class Recorder implements ExecutionListener {

        private final RunContext ctx;

        Recorder(RunContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public void onStarted(WorkItem item) {
            RunState after = store.update(ctx.runId(),
                    s -> s.withItem(item.id(), s.item(item.id()).dispatched(now())));
            log.info("{} {} -> in_progress (attempt {})", ctx.level().itemNoun(), item.id(),
                    after.attemptsOf(item.id()) + 1);
            eventBus.publish(ArmadaEvent.of("item.started", ctx.runId(), item.id(),
                    Map.of("title", item.title() == null ? item.id() : item.title())));
        }

        @Override
        public void onFinished(WorkOutcome outcome) {
            String id = outcome.itemId();
            WorkItem item = ctx.plan().item(id);
            MdcContext.setItem(ctx.runId(), id);
            try {
                if (metrics != null) {
                    metrics.recordItemExecution(ctx.level(), outcome.elapsed());
                }
                log.debug("Output of {}:\n{}", id, outcome.rawOutput());

                if (outcome.interrupted() && ctx.stopRequested().getAsBoolean()) {
                    log.info("{} {} interrupted by shutdown, stays in_progress for resume",
                            ctx.level().itemNoun(), id);
                    eventBus.publish(ArmadaEvent.of("item.interrupted", ctx.runId(), id, Map.of()));
                    return;
                }

                Optional<String> artifact = artifacts.find(ctx.level(), item);
                if (outcome.success() || artifact.isPresent()) {
                    String message = artifact.orElse(firstLine(outcome.rawOutput()));
                    if (!outcome.success()) {
                        log.warn("{} exited with code {} but produced {}", id, outcome.exitCode(), message);
                    }
                    store.update(ctx.runId(), s -> s.withItem(id, s.item(id).completed(message, now())));
                    log.info("{} {} -> completed {}", ctx.level().itemNoun(), id, message);
                    record(ItemStatus.COMPLETED);
                    eventBus.publish(ArmadaEvent.of("item.completed", ctx.runId(), id, Map.of(
                            "message", message,
                            "elapsedSeconds", outcome.elapsed().toSeconds())));
                    return;
                }

                ErrorKind kind = classifier.classify(outcome.rawOutput(), outcome.exitCode());
                String message = truncate(outcome.rawOutput());
                Instant now = now();
                var error = new ErrorRecord(id, kind, message, now);

                if (kind.isFatal()) {
                    store.update(ctx.runId(), s -> s.withItem(id, s.item(id).fatal(kind.label(), now)).withError(error));
                    log.error("{} {} -> fatal ({}): {}", ctx.level().itemNoun(), id, kind.label(), message);
                    record(ItemStatus.FATAL);
                    eventBus.publish(ArmadaEvent.of("item.fatal", ctx.runId(), id, Map.of("kind", kind.label())));
                    return;
                }

                RunState after = store.update(ctx.runId(),
                        s -> s.withItem(id, s.item(id).failed(kind.label(), now)).withError(error));
                int attempts = after.attemptsOf(id);
                boolean willRetry = attempts < ctx.settings().maxRetries();
                log.warn("{} {} -> failed ({}, attempt {}/{}{})", ctx.level().itemNoun(), id, kind.label(),
                        attempts, ctx.settings().maxRetries(), willRetry ? ", will retry" : "");
                record(ItemStatus.FAILED);
                if (willRetry && metrics != null) {
                    metrics.recordRetry(kind);
                }
                eventBus.publish(ArmadaEvent.of("item.failed", ctx.runId(), id, Map.of(
                        "kind", kind.label(),
                        "attempts", attempts,
                        "willRetry", willRetry,
                        "timedOut", outcome.timedOut())));
            } finally {
                MdcContext.clearItem();
            }
        }

        private void record(ItemStatus status) {
            if (metrics != null) {
                metrics.recordItemOutcome(ctx.level(), status);
            }
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static List<String> ids(List<WorkItem> items) {
        return items.stream().map(WorkItem::id).toList();
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int nl = trimmed.indexOf('\n');
        String line = nl >= 0 ? trimmed.substring(0, nl) : trimmed;
        return line.length() > MAX_MESSAGE_CHARS ? line.substring(0, MAX_MESSAGE_CHARS) : line;
    }

    /** Keeps the tail, where errors usually are. */
    private static String truncate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= MAX_MESSAGE_CHARS ? trimmed
                : "..." + trimmed.substring(trimmed.length() - MAX_MESSAGE_CHARS);
    }
}
