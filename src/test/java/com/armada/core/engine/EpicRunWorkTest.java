package com.armada.core.engine;

import com.armada.core.classify.ErrorClassifier;
import com.armada.core.events.EventBus;
import com.armada.core.executor.BoundedExecutor;
import com.armada.core.executor.UnitOfWork;
import com.armada.core.executor.WorkResult;
import com.armada.core.lock.HostProcessProbe;
import com.armada.core.lock.LockManager;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.ErrorKind;
import com.armada.core.model.ErrorRecord;
import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.ItemState;
import com.armada.core.model.ItemStatus;
import com.armada.core.model.RunLevel;
import com.armada.core.model.RunState;
import com.armada.core.model.RunStatus;
import com.armada.core.model.RunSummary;
import com.armada.core.plan.PlanLoader;
import com.armada.core.plan.PlanStore;
import com.armada.core.scheduler.ArtifactProbe;
import com.armada.core.scheduler.BackoffPolicy;
import com.armada.core.scheduler.SchedulerSettings;
import com.armada.core.scheduler.WaveScheduler;
import com.armada.core.state.RunStateStore;
import com.armada.core.state.StateJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class EpicRunWorkTest {

    private static final SchedulerSettings EPIC_SETTINGS = new SchedulerSettings(0, 1, Duration.ZERO);
    private static final SchedulerSettings PROJECT_SETTINGS = new SchedulerSettings(2, 1, Duration.ZERO);

    @TempDir
    Path stateDir;

    private RunStateStore stateStore;
    private PlanLoader loader;
    private PlanStore planStore;
    private RunDriver driver;
    private final Map<String, String> issueOutputs = new ConcurrentHashMap<>();
    private final Set<String> failOnce = ConcurrentHashMap.newKeySet();
    private ObjectMapper mapper;
    private ShutdownSignal signal;
    private final Set<String> shutdownAfter = ConcurrentHashMap.newKeySet();

    @BeforeEach
    void setUp() {
        mapper = StateJson.newObjectMapper();
        loader = new PlanLoader(mapper);
        stateStore = new RunStateStore(stateDir, mapper);
        planStore = new PlanStore(stateDir, mapper, loader);
        driver = newDriver(new ShutdownSignal());
    }

    private RunDriver newDriver(ShutdownSignal shutdownSignal) {
        signal = shutdownSignal;
        var eventBus = new EventBus();
        var metrics = new ArmadaMetrics(new SimpleMeterRegistry());
        var scheduler = new WaveScheduler(stateStore, new BoundedExecutor("test"), new ErrorClassifier(),
                new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0.0), ArtifactProbe.NONE,
                eventBus, metrics, Clock.systemUTC());
        UnitOfWork issues = item -> {
            if (shutdownAfter.remove(item.id())) {
                signal.request();
            }
            if (failOnce.remove(item.id())) {
                return WorkResult.failure("connection refused", 1);
            }
            String failure = issueOutputs.get(item.id());
            return failure == null ? WorkResult.success("https://example.test/pull/" + item.id())
                    : WorkResult.failure(failure, 1);
        };
        WorkFactory factory = (request, d) -> request.level() == RunLevel.PROJECT
                ? new EpicRunWork(d, stateStore, EPIC_SETTINGS) : issues;
        return new RunDriver(stateStore, planStore, loader, new LockManager(stateDir, mapper, new HostProcessProbe()),
                scheduler, RunFinalizer.NONE, factory, shutdownSignal, eventBus, metrics);
    }

    private void storeEpicPlan(String epic, String json) {
        planStore.save("epic-" + epic, loader.parse(json, "test"));
    }

    private Path projectPlan(String json) throws Exception {
        Path file = stateDir.resolve("project-input.json");
        Files.writeString(file, json);
        return file;
    }

    private RunOutcome runProject(Path plan) {
        return driver.execute(new RunRequest(RunLevel.PROJECT, "q3", plan, false, false, false, false,
                PROJECT_SETTINGS));
    }

    @Test
    @DisplayName("a project completes when every nested epic run completes")
    void projectCompletes() throws Exception {
        storeEpicPlan("151", "{\"waves\": [{\"wave\": 1, \"issues\": [1, 2]}]}");
        storeEpicPlan("160", "{\"waves\": [{\"wave\": 1, \"issues\": [3]}]}");
        Path plan = projectPlan("{\"epic_waves\": [{\"wave\": 1, \"epics\": [151]}, {\"wave\": 2, \"epics\": [160]}]}");

        RunOutcome outcome = runProject(plan);

        assertEquals(RunStatus.COMPLETED, outcome.status());
        assertEquals(RunOutcome.EXIT_SUCCESS, outcome.exitCode());
        assertEquals(RunStatus.COMPLETED, stateStore.load("epic-151").status());
        assertEquals(RunStatus.COMPLETED, stateStore.load("epic-160").status());
        assertEquals(ItemStatus.COMPLETED, stateStore.load("project-q3").statusOf("151"));
        assertEquals("status=completed", stateStore.load("project-q3").item("151").message());
    }

    @Test
    @DisplayName("an auth failure inside an epic halts the whole project")
    void fatalPropagates() throws Exception {
        storeEpicPlan("151", "{\"waves\": [{\"wave\": 1, \"issues\": [1]}]}");
        storeEpicPlan("160", "{\"waves\": [{\"wave\": 1, \"issues\": [3]}]}");
        issueOutputs.put("1", "Error: 403 Forbidden");
        Path plan = projectPlan("{\"epic_waves\": [{\"wave\": 1, \"epics\": [151]}, {\"wave\": 2, \"epics\": [160]}]}");

        RunOutcome outcome = runProject(plan);

        assertEquals(RunStatus.FATAL_ERROR, outcome.status());
        assertEquals(RunStatus.FATAL_ERROR, stateStore.load("epic-151").status());
        RunState project = stateStore.load("project-q3");
        assertEquals(ItemStatus.FATAL, project.statusOf("151"));
        assertEquals(ErrorKind.AUTH, project.errors().get(0).kind());
        assertFalse(stateStore.exists("epic-160"));
    }

    @Test
    @DisplayName("an epic without a stored plan fails as an ordinary, non-fatal item")
    void missingEpicPlan() throws Exception {
        Path plan = projectPlan("{\"epic_waves\": [{\"wave\": 1, \"epics\": [429]}]}");

        RunOutcome outcome = runProject(plan);

        assertEquals(RunStatus.COMPLETED, outcome.status());
        assertEquals(RunOutcome.EXIT_PARTIAL, outcome.exitCode());
        RunState project = stateStore.load("project-q3");
        assertEquals(ItemStatus.FAILED, project.statusOf("429"));
        assertEquals(ErrorKind.NONE, project.errors().get(0).kind());
    }

    @Test
    @DisplayName("an outer retry re-runs the failed issues of a nested run")
    void outerRetryReRunsFailedIssues() throws Exception {
        storeEpicPlan("151", "{\"waves\": [{\"wave\": 1, \"issues\": [1, 2]}]}");
        failOnce.add("1");
        Path plan = projectPlan("{\"epic_waves\": [{\"wave\": 1, \"epics\": [151]}]}");

        RunOutcome outcome = driver.execute(new RunRequest(RunLevel.PROJECT, "q3", plan, false, false, false,
                false, new SchedulerSettings(2, 2, Duration.ZERO)));

        assertEquals(RunStatus.COMPLETED, outcome.status());
        assertEquals(RunOutcome.EXIT_SUCCESS, outcome.exitCode());
        RunState project = stateStore.load("project-q3");
        assertEquals(1, project.attemptsOf("151"));
        assertEquals(ErrorKind.NETWORK, project.errors().get(0).kind());
        RunState epic = stateStore.load("epic-151");
        assertEquals(ItemStatus.COMPLETED, epic.statusOf("1"));
        assertEquals(1, epic.attemptsOf("1"));
        assertEquals(ItemStatus.COMPLETED, epic.statusOf("2"));
    }

    @Test
    @DisplayName("an epic interrupted by shutdown is continued, not failed, when the project resumes")
    void interruptedEpicResumes() throws Exception {
        storeEpicPlan("151", "{\"waves\": [{\"wave\": 1, \"issues\": [1]}, {\"wave\": 2, \"issues\": [2]}]}");
        shutdownAfter.add("1");
        Path plan = projectPlan("{\"epic_waves\": [{\"wave\": 1, \"epics\": [151]}]}");

        RunOutcome first = runProject(plan);

        assertEquals(RunStatus.INTERRUPTED, first.status());
        assertEquals(RunOutcome.EXIT_INTERRUPTED, first.exitCode());
        assertEquals(RunStatus.INTERRUPTED, stateStore.load("epic-151").status());
        assertEquals(ItemStatus.PENDING, stateStore.load("epic-151").statusOf("2"));
        RunState interrupted = stateStore.load("project-q3");
        assertEquals(ItemStatus.IN_PROGRESS, interrupted.statusOf("151"));
        assertEquals(0, interrupted.attemptsOf("151"));
        assertTrue(interrupted.errors().isEmpty());

        driver = newDriver(new ShutdownSignal());
        RunOutcome resumed = driver.execute(new RunRequest(RunLevel.PROJECT, "q3", null, true, false, false,
                false, PROJECT_SETTINGS));

        assertEquals(RunStatus.COMPLETED, resumed.status());
        assertEquals(RunOutcome.EXIT_SUCCESS, resumed.exitCode());
        RunState project = stateStore.load("project-q3");
        assertEquals(ItemStatus.COMPLETED, project.statusOf("151"));
        assertEquals(0, project.attemptsOf("151"));
        RunState epic = stateStore.load("epic-151");
        assertEquals(RunStatus.COMPLETED, epic.status());
        assertEquals(ItemStatus.COMPLETED, epic.statusOf("1"));
        assertEquals(ItemStatus.COMPLETED, epic.statusOf("2"));
    }

    @Test
    @DisplayName("nested retry budget grows by the attempts already spent")
    void settingsForExtendsBudget() {
        var work = new EpicRunWork(driver, stateStore, EPIC_SETTINGS);
        assertEquals(EPIC_SETTINGS, work.settingsFor("epic-151"));

        Instant now = Instant.parse("2026-01-10T12:00:00Z");
        stateStore.initialize("epic-151", RunLevel.EPIC, false);
        stateStore.update("epic-151", s -> s
                .withItem("1", ItemState.PENDING.dispatched(now).failed("x", now).dispatched(now).failed("x", now))
                .withItem("2", ItemState.PENDING.dispatched(now).completed("", now)));

        SchedulerSettings extended = work.settingsFor("epic-151");
        assertEquals(3, extended.maxRetries());
        assertEquals(EPIC_SETTINGS.maxParallel(), extended.maxParallel());
    }

    @Test
    @DisplayName("describe lists fatal messages only for a fatal nested run")
    void describe() {
        Instant now = Instant.parse("2026-01-10T12:00:00Z");
        RunState state = RunState.initial("epic-151", RunLevel.EPIC, now, 1, "h")
                .withItem("1", ItemState.PENDING.dispatched(now).fatal("AUTH_ERROR", now))
                .withItem("2", ItemState.PENDING.dispatched(now).failed("NETWORK_ERROR", now))
                .withError(new ErrorRecord("2", ErrorKind.NETWORK, "connection refused", now))
                .withError(new ErrorRecord("1", ErrorKind.AUTH, "401 Unauthorized", now));
        ExecutionPlan plan = loader.parse("{\"waves\": [{\"wave\": 1, \"issues\": [1, 2]}]}", "test");
        var fatal = new RunOutcome("epic-151", RunStatus.FATAL_ERROR, RunSummary.of(state, plan), plan, state,
                null, false);
        var partial = new RunOutcome("epic-151", RunStatus.COMPLETED, RunSummary.of(state, plan), plan, state,
                null, false);

        assertEquals("status=fatal_error\n401 Unauthorized", EpicRunWork.describe(fatal));
        assertEquals(List.of("status=completed", "connection refused", "401 Unauthorized"),
                List.of(EpicRunWork.describe(partial).split("\n")));
    }
}
