package com.armada.core.scheduler;

import com.armada.core.classify.ErrorClassifier;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.events.EventBus;
import com.armada.core.executor.BoundedExecutor;
import com.armada.core.executor.UnitOfWork;
import com.armada.core.executor.WorkResult;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.ErrorKind;
import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.ItemState;
import com.armada.core.model.ItemStatus;
import com.armada.core.model.RunLevel;
import com.armada.core.model.RunState;
import com.armada.core.model.Wave;
import com.armada.core.model.WorkItem;
import com.armada.core.state.RunStateStore;
import com.armada.core.state.StateJson;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WaveSchedulerTest {

    private static final String RUN_ID = "epic-151";
    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    @TempDir
    Path stateDir;

    private RunStateStore store;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private List<Duration> sleeps;
    private List<ArmadaEvent> events;
    private ArtifactProbe artifacts;
    private ScriptedWork work;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new RunStateStore(stateDir, StateJson.newObjectMapper(), clock, 1, "host-a");
        store.initialize(RUN_ID, RunLevel.EPIC, false);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(events::add);
        registry = new SimpleMeterRegistry();
        sleeps = new ArrayList<>();
        artifacts = ArtifactProbe.NONE;
        work = new ScriptedWork();
    }

    private WaveScheduler scheduler() {
        return new WaveScheduler(store, new BoundedExecutor("test"), new ErrorClassifier(),
                new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(300), 0.2, () -> 0.5),
                (level, item) -> artifacts.find(level, item), eventBus, new ArmadaMetrics(registry),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private RunContext context(ExecutionPlan plan, int maxRetries) {
        return new RunContext(RUN_ID, RunLevel.EPIC, plan, work, new SchedulerSettings(2, maxRetries, Duration.ZERO),
                () -> false, sleeps::add);
    }

    private static ExecutionPlan plan(Wave... waves) {
        return new ExecutionPlan(List.of(waves), null, List.of(), null);
    }

    private static Wave wave(int number, String... ids) {
        return new Wave(number, List.of(ids), null);
    }

    @Nested
    @DisplayName("dispatch and retry")
    class DispatchAndRetry {

        @Test
        @DisplayName("completes every item in a single pass when all succeed")
        void allSucceed() {
            Wave wave = wave(1, "A", "B", "C");

            WaveResult result = scheduler().runWave(context(plan(wave), 2), wave);

            assertEquals(WaveResult.Status.COMPLETE, result.status());
            assertEquals(1, result.passes());
            assertEquals(3, result.launched());
            RunState state = store.load(RUN_ID);
            for (String id : List.of("A", "B", "C")) {
                assertEquals(ItemStatus.COMPLETED, state.statusOf(id));
                assertEquals(0, state.attemptsOf(id));
            }
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("retries a failed item after backoff and counts one attempt")
        void retryOnce() {
            work.fail("B", "connect ECONNREFUSED");
            Wave wave = wave(1, "A", "B");

            WaveResult result = scheduler().runWave(context(plan(wave), 2), wave);

            assertEquals(WaveResult.Status.COMPLETE, result.status());
            assertEquals(2, result.passes());
            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.COMPLETED, state.statusOf("A"));
            assertEquals(ItemStatus.COMPLETED, state.statusOf("B"));
            assertEquals(1, state.attemptsOf("B"));
            assertEquals(1, work.executions("A"));
            assertEquals(2, work.executions("B"));
            assertEquals(List.of(Duration.ofSeconds(5)), sleeps);
            assertEquals(1, state.errors().size());
            assertEquals(ErrorKind.NETWORK, state.errors().get(0).kind());
        }

        @Test
        @DisplayName("stops retrying once attempts reach maxRetries and leaves the item failed")
        void exhaustsRetries() {
            work.fail("X", "network unreachable", "network unreachable", "network unreachable");
            Wave wave = wave(1, "X", "Y");

            WaveResult result = scheduler().runWave(context(plan(wave), 2), wave);

            assertEquals(WaveResult.Status.COMPLETE, result.status());
            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.FAILED, state.statusOf("X"));
            assertEquals(2, state.attemptsOf("X"));
            assertEquals(2, work.executions("X"));
            assertEquals(ItemStatus.COMPLETED, state.statusOf("Y"));
            assertEquals(1.0, registry.find("armada.retries").tag("kind", "NETWORK_ERROR").counter().count());
        }

        @Test
        @DisplayName("with maxRetries 0 an item runs once and is never retried")
        void noRetries() {
            work.fail("A", "boom");
            Wave wave = wave(1, "A");

            scheduler().runWave(context(plan(wave), 0), wave);

            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.FAILED, state.statusOf("A"));
            assertEquals(1, state.attemptsOf("A"));
            assertEquals(1, work.executions("A"));
        }

        @Test
        @DisplayName("an unclassified failure is recorded with kind NONE and retried")
        void unclassifiedFailure() {
            work.fail("A", "compilation failed");
            Wave wave = wave(1, "A");

            scheduler().runWave(context(plan(wave), 2), wave);

            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.COMPLETED, state.statusOf("A"));
            assertEquals(ErrorKind.NONE, state.errors().get(0).kind());
            assertEquals("done A", state.item("A").message());
        }

        @Test
        @DisplayName("backoff grows with each retry pass")
        void backoffGrows() {
            work.fail("A", "503", "503", "503");
            Wave wave = wave(1, "A");

            scheduler().runWave(context(plan(wave), 4), wave);

            assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(20)), sleeps);
            assertEquals(ItemStatus.COMPLETED, store.load(RUN_ID).statusOf("A"));
        }
    }

    @Nested
    @DisplayName("fatal errors")
    class FatalErrors {

        @Test
        @DisplayName("an auth failure marks the item fatal and halts the wave")
        void authIsFatal() {
            work.fail("A", "HTTP 401 Unauthorized", "HTTP 401 Unauthorized");
            Wave wave = wave(1, "A", "B");

            WaveResult result = scheduler().runWave(context(plan(wave), 2), wave);

            assertEquals(WaveResult.Status.HALTED_FATAL, result.status());
            assertEquals(1, result.passes());
            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.FATAL, state.statusOf("A"));
            assertEquals("AUTH_ERROR", state.item("A").message());
            assertEquals(0, state.attemptsOf("A"));
            assertEquals(1, work.executions("A"));
            assertEquals(ErrorKind.AUTH, state.errors().get(0).kind());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("a fatal item elsewhere in the run prevents any dispatch")
        void priorFatalHalts() {
            store.update(RUN_ID, s -> s.withItem("Z", s.item("Z").dispatched(NOW).fatal("QUOTA_EXCEEDED", NOW)));
            Wave wave = wave(2, "A");

            WaveResult result = scheduler().runWave(context(plan(wave(1, "Z"), wave), 2), wave);

            assertEquals(WaveResult.Status.HALTED_FATAL, result.status());
            assertEquals(0, result.passes());
            assertEquals(0, work.executions("A"));
        }
    }

    @Nested
    @DisplayName("resume and artifacts")
    class ResumeAndArtifacts {

        @Test
        @DisplayName("an in_progress item left by a crash is re-dispatched without counting an attempt")
        void redispatchInProgress() {
            store.update(RUN_ID, s -> s
                    .withItem("A", s.item("A").dispatched(NOW))
                    .withItem("B", s.item("B").dispatched(NOW).completed("done", NOW)));
            Wave wave = wave(1, "A", "B");

            scheduler().runWave(context(plan(wave), 2), wave);

            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.COMPLETED, state.statusOf("A"));
            assertEquals(0, state.attemptsOf("A"));
            assertEquals(1, work.executions("A"));
            assertEquals(0, work.executions("B"));
        }

        @Test
        @DisplayName("a failed item with attempts left is retried on resume, an exhausted one is not")
        void resumeFailed() {
            store.update(RUN_ID, s -> s
                    .withItem("A", s.item("A").dispatched(NOW).failed("NETWORK_ERROR", NOW))
                    .withItem("B", s.item("B").dispatched(NOW).failed("NETWORK_ERROR", NOW)
                            .dispatched(NOW).failed("NETWORK_ERROR", NOW)));
            Wave wave = wave(1, "A", "B");

            scheduler().runWave(context(plan(wave), 2), wave);

            assertEquals(1, work.executions("A"));
            assertEquals(0, work.executions("B"));
            assertEquals(ItemStatus.FAILED, store.load(RUN_ID).statusOf("B"));
        }

        @Test
        @DisplayName("an existing artifact turns a failed exit into completion")
        void artifactCompletes() {
            work.fail("A", "exit 1");
            artifacts = (level, item) -> item.id().equals("A")
                    ? Optional.of("https://example.test/pull/9") : Optional.empty();
            Wave wave = wave(1, "A");

            scheduler().runWave(context(plan(wave), 2), wave);

            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.COMPLETED, state.statusOf("A"));
            assertEquals("https://example.test/pull/9", state.item("A").message());
            assertTrue(state.errors().isEmpty());
        }

        @Test
        @DisplayName("a stop request before dispatch interrupts the wave")
        void stopBeforeDispatch() {
            Wave wave = wave(1, "A");
            var ctx = new RunContext(RUN_ID, RunLevel.EPIC, plan(wave), work,
                    new SchedulerSettings(2, 2, Duration.ZERO), () -> true, sleeps::add);

            WaveResult result = scheduler().runWave(ctx, wave);

            assertEquals(WaveResult.Status.INTERRUPTED, result.status());
            assertEquals(0, work.executions("A"));
            assertEquals(ItemStatus.PENDING, store.load(RUN_ID).statusOf("A"));
        }

        @Test
        @DisplayName("work cut short by shutdown stays in_progress without an attempt or error")
        void interruptedWorkStaysInProgress() {
            Wave wave = wave(1, "A");
            var stop = new AtomicBoolean();
            UnitOfWork stopping = item -> {
                stop.set(true);
                return WorkResult.interrupted("status=interrupted", 130);
            };
            var ctx = new RunContext(RUN_ID, RunLevel.EPIC, plan(wave), stopping,
                    new SchedulerSettings(2, 1, Duration.ZERO), stop::get, sleeps::add);

            WaveResult result = scheduler().runWave(ctx, wave);

            assertEquals(WaveResult.Status.INTERRUPTED, result.status());
            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.IN_PROGRESS, state.statusOf("A"));
            assertEquals(0, state.attemptsOf("A"));
            assertTrue(state.errors().isEmpty());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("item.interrupted")));
            assertEquals(List.of("A"), WaveScheduler.eligibleItems(state, wave, 1));
        }

        @Test
        @DisplayName("an interrupted result without a shutdown request counts as a failure")
        void interruptedWithoutShutdownFails() {
            Wave wave = wave(1, "A");
            UnitOfWork stopping = item -> WorkResult.interrupted("status=interrupted", 130);
            var ctx = new RunContext(RUN_ID, RunLevel.EPIC, plan(wave), stopping,
                    new SchedulerSettings(2, 1, Duration.ZERO), () -> false, sleeps::add);

            WaveResult result = scheduler().runWave(ctx, wave);

            assertEquals(WaveResult.Status.COMPLETE, result.status());
            RunState state = store.load(RUN_ID);
            assertEquals(ItemStatus.FAILED, state.statusOf("A"));
            assertEquals(1, state.attemptsOf("A"));
        }
    }

    @Test
    @DisplayName("publishes started, failed, retry and completed events")
    void publishesEvents() {
        work.fail("A", "429 Too Many Requests");
        Wave wave = wave(1, "A");

        scheduler().runWave(context(plan(wave), 2), wave);

        List<String> types = events.stream().map(ArmadaEvent::eventType).toList();
        assertEquals(List.of("item.started", "item.failed", "wave.retry", "item.started", "item.completed"), types);
        ArmadaEvent failed = events.get(1);
        assertEquals("A", failed.itemId());
        assertEquals("RATE_LIMIT", failed.payload().get("kind"));
        assertEquals(true, failed.payload().get("willRetry"));
    }

    @Test
    @DisplayName("eligibleItems previews the next pass")
    void eligibleItems() {
        RunState state = RunState.initial(RUN_ID, RunLevel.EPIC, NOW, 1, "h")
                .withItem("A", ItemState.PENDING.dispatched(NOW).completed("", NOW))
                .withItem("B", ItemState.PENDING.dispatched(NOW).failed("", NOW))
                .withItem("C", ItemState.PENDING.dispatched(NOW).fatal("", NOW));

        assertEquals(List.of("B", "D"), WaveScheduler.eligibleItems(state, wave(1, "A", "B", "C", "D"), 2));
        assertEquals(List.of("D"), WaveScheduler.eligibleItems(state, wave(1, "A", "B", "C", "D"), 1));
    }

    /** Fails each item with the queued outputs, in order, then succeeds. */
    static final class ScriptedWork implements UnitOfWork {
        private final Map<String, Deque<String>> failures = new HashMap<>();
        private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

        void fail(String id, String... outputs) {
            failures.put(id, new ArrayDeque<>(List.of(outputs)));
        }

        int executions(String id) {
            AtomicInteger count = counts.get(id);
            return count == null ? 0 : count.get();
        }

        @Override
        public WorkResult execute(WorkItem item) {
            counts.computeIfAbsent(item.id(), k -> new AtomicInteger()).incrementAndGet();
            Deque<String> queue = failures.get(item.id());
            String output;
            synchronized (this) {
                output = queue == null ? null : queue.poll();
            }
            return output == null ? WorkResult.success("done " + item.id()) : WorkResult.failure(output, 1);
        }
    }
}
