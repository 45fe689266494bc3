package com.armada.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The single persisted record of one orchestration run; the sole basis for resumption.
 *
 * <p>Instances are immutable. Every change produces a new instance through one of the
 * {@code with*} methods, which enforce the item state machine and keep the completed-wave
 * set sorted and duplicate-free. Items absent from {@link #items()} are pending.
 */
public record RunState(
    @JsonProperty("version") int version,
    @JsonProperty("run_id") String runId,
    @JsonProperty("level") RunLevel level,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("current_wave") int currentWave,
    @JsonProperty("completed_waves") List<Integer> completedWaves,
    @JsonProperty("items") Map<String, ItemState> items,
    @JsonProperty("errors") List<ErrorRecord> errors,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("pid") long pid,
    @JsonProperty("hostname") String hostname
) {
    public static final int CURRENT_VERSION = 1;

    public RunState {
        completedWaves = completedWaves == null ? List.of()
                : completedWaves.stream().distinct().sorted().toList();
        items = items == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(items));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RunState initial(String runId, RunLevel level, Instant now, long pid, String hostname) {
        return new RunState(CURRENT_VERSION, runId, level, RunStatus.INITIALIZED, 0,
                List.of(), Map.of(), List.of(), now, now, pid, hostname);
    }

    public ItemState item(String itemId) {
        return items.getOrDefault(itemId, ItemState.PENDING);
    }

    public ItemStatus statusOf(String itemId) {
        return item(itemId).status();
    }

    public int attemptsOf(String itemId) {
        return item(itemId).attempts();
    }

    public boolean hasFatalItems() {
        return items.values().stream().anyMatch(s -> s.status() == ItemStatus.FATAL);
    }

    public long countItems(ItemStatus status) {
        return items.values().stream().filter(s -> s.status() == status).count();
    }

    public boolean waveCompleted(int wave) {
        return completedWaves.contains(wave);
    }

    public RunState withStatus(RunStatus next) {
        return new RunState(version, runId, level, next, currentWave, completedWaves, items, errors,
                createdAt, updatedAt, pid, hostname);
    }

    public RunState withCurrentWave(int wave) {
        return new RunState(version, runId, level, status, wave, completedWaves, items, errors,
                createdAt, updatedAt, pid, hostname);
    }

    public RunState withWaveCompleted(int wave) {
        var waves = new ArrayList<>(completedWaves);
        waves.add(wave);
        return new RunState(version, runId, level, status, currentWave, waves, items, errors,
                createdAt, updatedAt, pid, hostname);
    }

    /**
     * Replaces an item's state. The caller derives {@code next} from {@link #item(String)}
     * through {@link ItemState}'s transition methods, which reject illegal moves.
     */
    public RunState withItem(String itemId, ItemState next) {
        var copy = new TreeMap<>(items);
        copy.put(itemId, next);
        return new RunState(version, runId, level, status, currentWave, completedWaves, copy, errors,
                createdAt, updatedAt, pid, hostname);
    }

    public RunState withError(ErrorRecord error) {
        var copy = new ArrayList<>(errors);
        copy.add(error);
        return new RunState(version, runId, level, status, currentWave, completedWaves, items, copy,
                createdAt, updatedAt, pid, hostname);
    }

    /** Stamps the last-writer identity; applied by the store on every persisted change. */
    public RunState touchedBy(long writerPid, Instant now) {
        return new RunState(version, runId, level, status, currentWave, completedWaves, items, errors,
                createdAt, now, writerPid, hostname);
    }
}
