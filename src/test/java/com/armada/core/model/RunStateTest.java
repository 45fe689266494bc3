package com.armada.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunStateTest {

    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    private final RunState initial = RunState.initial("epic-151", RunLevel.EPIC, NOW, 42, "host-a");

    @Test
    @DisplayName("initial state is empty and initialized")
    void initialState() {
        assertEquals(RunState.CURRENT_VERSION, initial.version());
        assertEquals(RunStatus.INITIALIZED, initial.status());
        assertEquals(0, initial.currentWave());
        assertTrue(initial.completedWaves().isEmpty());
        assertTrue(initial.items().isEmpty());
        assertTrue(initial.errors().isEmpty());
    }

    @Test
    @DisplayName("unknown items read as pending with zero attempts")
    void unknownItemsPending() {
        assertEquals(ItemStatus.PENDING, initial.statusOf("145"));
        assertEquals(0, initial.attemptsOf("145"));
    }

    @Test
    @DisplayName("completed waves stay sorted and unique")
    void completedWavesSet() {
        RunState state = initial.withWaveCompleted(2).withWaveCompleted(1).withWaveCompleted(2);
        assertEquals(List.of(1, 2), state.completedWaves());
        assertTrue(state.waveCompleted(1));
        assertFalse(state.waveCompleted(3));
    }

    @Test
    @DisplayName("withItem records states and fatal detection sees them")
    void items() {
        RunState state = initial
                .withItem("145", initial.item("145").dispatched(NOW))
                .withItem("146", initial.item("146").dispatched(NOW).fatal("AUTH_ERROR", NOW));

        assertEquals(ItemStatus.IN_PROGRESS, state.statusOf("145"));
        assertTrue(state.hasFatalItems());
        assertEquals(1, state.countItems(ItemStatus.FATAL));
        assertFalse(initial.hasFatalItems());
    }

    @Test
    @DisplayName("with* methods do not mutate the original")
    void immutability() {
        RunState running = initial.withStatus(RunStatus.RUNNING).withCurrentWave(1)
                .withError(new ErrorRecord("145", ErrorKind.NETWORK, "refused", NOW));

        assertEquals(RunStatus.INITIALIZED, initial.status());
        assertTrue(initial.errors().isEmpty());
        assertEquals(RunStatus.RUNNING, running.status());
        assertEquals(1, running.currentWave());
        assertEquals(1, running.errors().size());
        assertThrows(UnsupportedOperationException.class, () -> running.errors().clear());
    }

    @Test
    @DisplayName("touchedBy stamps writer pid and time but keeps creation time")
    void touchedBy() {
        Instant later = NOW.plusSeconds(60);
        RunState touched = initial.touchedBy(99, later);
        assertEquals(99, touched.pid());
        assertEquals(later, touched.updatedAt());
        assertEquals(NOW, touched.createdAt());
    }

    @Test
    @DisplayName("summary counts items from the plan, unseen ones as pending")
    void summary() {
        var plan = new ExecutionPlan(
                List.of(new Wave(1, List.of("1", "2"), ""), new Wave(2, List.of("3", "4"), "")),
                null, List.of(), null);
        RunState state = initial
                .withItem("1", ItemState.PENDING.dispatched(NOW).completed("", NOW))
                .withItem("2", ItemState.PENDING.dispatched(NOW).failed("x", NOW))
                .withItem("3", ItemState.PENDING.dispatched(NOW));

        RunSummary summary = RunSummary.of(state, plan);
        assertEquals(new RunSummary(1, 1, 0, 2, 4), summary);
        assertFalse(summary.allCompleted());
    }
}
