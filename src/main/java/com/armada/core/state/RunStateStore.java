package com.armada.core.state;

import com.armada.core.model.RunLevel;
import com.armada.core.model.RunState;
import com.armada.core.model.RunStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * File-backed store for {@link RunState} documents, one JSON file per run identifier.
 *
 * <p>Every write goes to a temporary file in the same directory and is then renamed over
 * the target, so a crash leaves either the old or the new document, never a partial one.
 * The store guarantees atomicity of a single write only; mutual exclusion across processes
 * is the job of {@link com.armada.core.lock.LockManager}, and callers within one process
 * must not issue overlapping {@link #update} calls for the same run.
 */
public class RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(RunStateStore.class);

    private final Path stateDir;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final long pid;
    private final String hostname;

    public RunStateStore(Path stateDir, ObjectMapper mapper) {
        this(stateDir, mapper, Clock.systemUTC(), ProcessHandle.current().pid(), localHostname());
    }

    public RunStateStore(Path stateDir, ObjectMapper mapper, Clock clock, long pid, String hostname) {
        this.stateDir = stateDir;
        this.mapper = mapper;
        this.clock = clock;
        this.pid = pid;
        this.hostname = hostname;
    }

    public Path stateFile(String runId) {
        return stateDir.resolve(runId + ".json");
    }

    public boolean exists(String runId) {
        return Files.isRegularFile(stateFile(runId));
    }

    /**
     * Creates a fresh state for the run.
     *
     * @param fresh allow replacing a prior state that reached {@code completed}
     * @throws RunStateAlreadyExistsException if a state exists and is not a completed run
     *                                        being explicitly restarted
     */
    public RunState initialize(String runId, RunLevel level, boolean fresh) {
        Optional<RunState> existing = find(runId);
        if (existing.isPresent()) {
            RunStatus status = existing.get().status();
            if (!(fresh && status == RunStatus.COMPLETED)) {
                throw new RunStateAlreadyExistsException(runId, status.wireName());
            }
            log.info("Replacing completed state of run {} with a fresh one", runId);
        }
        RunState state = RunState.initial(runId, level, now(), pid, hostname);
        write(runId, state);
        log.info("Initialized state for run {} at {}", runId, stateFile(runId));
        return state;
    }

    /**
     * @throws RunStateNotFoundException if the run has no state
     */
    public RunState load(String runId) {
        return find(runId).orElseThrow(() -> new RunStateNotFoundException(runId));
    }

    public Optional<RunState> find(String runId) {
        Path file = stateFile(runId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        RunState state;
        try {
            state = mapper.readValue(file.toFile(), RunState.class);
        } catch (IOException e) {
            throw new StateStoreException("Cannot read state file " + file + ": " + e.getMessage(), e);
        }
        validate(runId, state, file);
        return Optional.of(state);
    }

    /**
     * Applies {@code mutator} to the on-disk state and persists the result atomically.
     * A mutator that returns an equal state causes no write at all.
     *
     * @return the state now on disk
     */
    public RunState update(String runId, UnaryOperator<RunState> mutator) {
        RunState current = load(runId);
        RunState next = mutator.apply(current);
        if (next == null) {
            throw new IllegalStateException("State mutator returned null for run " + runId);
        }
        if (next.equals(current)) {
            return current;
        }
        next = next.touchedBy(pid, now());
        write(runId, next);
        return next;
    }

    /** Deletes the run's state. Only called for an operator-requested fresh start. */
    public void discard(String runId) {
        try {
            if (Files.deleteIfExists(stateFile(runId))) {
                log.info("Discarded state of run {}", runId);
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot delete state of run " + runId, e);
        }
    }

    /**
     * Writes {@code content} to {@code target} through a sibling temporary file and a rename.
     */
    public static void atomicWrite(Path target, byte[] content) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, ".tmp.", ".json");
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StateStoreException("Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    private void write(String runId, RunState state) {
        try {
            atomicWrite(stateFile(runId), mapper.writeValueAsBytes(state));
        } catch (IOException e) {
            throw new StateStoreException("Cannot serialize state of run " + runId, e);
        }
    }

    private static void validate(String runId, RunState state, Path file) {
        if (state == null) {
            throw new StateStoreException("State file " + file + " is empty");
        }
        if (!runId.equals(state.runId())) {
            throw new StateStoreException("State file " + file + " belongs to run " + state.runId()
                    + ", expected " + runId);
        }
        if (state.status() == null || state.level() == null) {
            throw new StateStoreException("State file " + file + " is missing status or level");
        }
        if (state.version() > RunState.CURRENT_VERSION) {
            throw new StateStoreException("State file " + file + " has unsupported version " + state.version());
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            return "unknown";
        }
    }
}
