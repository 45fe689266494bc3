package com.armada.core.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Guarantees at most one live orchestrator per run identifier through a lock file
 * ({@code <runId>.lock}) that records the owner's PID.
 *
 * <p>A lock whose owner is no longer alive, or whose content cannot be read, is stale and
 * is reclaimed without {@code force}. A live owner is terminated only when {@code force}
 * is set.
 */
public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);
    private static final int MAX_ATTEMPTS = 3;
    private static final Duration TERMINATE_TIMEOUT = Duration.ofSeconds(10);

    private final Path stateDir;
    private final ObjectMapper mapper;
    private final ProcessProbe probe;
    private final Clock clock;

    public LockManager(Path stateDir, ObjectMapper mapper, ProcessProbe probe) {
        this(stateDir, mapper, probe, Clock.systemUTC());
    }

    public LockManager(Path stateDir, ObjectMapper mapper, ProcessProbe probe, Clock clock) {
        this.stateDir = stateDir;
        this.mapper = mapper;
        this.probe = probe;
        this.clock = clock;
    }

    public Path lockFile(String runId) {
        return stateDir.resolve(runId + ".lock");
    }

    /**
     * @throws LockHeldException if a live process owns the lock and {@code force} is false
     * @throws LockException      if the lock file cannot be created or a forced takeover fails
     */
    public LockToken acquire(String runId, boolean force) {
        Path file = lockFile(runId);
        long self = probe.currentPid();
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            if (tryCreate(file, runId, self)) {
                log.info("Acquired lock for run {} (PID {})", runId, self);
                return new LockToken(runId, self, file);
            }
            Optional<LockRecord> existing = read(file);
            long owner = existing.map(LockRecord::pid).orElse(-1L);
            if (owner > 0 && owner != self && probe.isAlive(owner)) {
                if (!force) {
                    throw new LockHeldException(runId, owner);
                }
                log.warn("Force takeover of run {}: terminating PID {} and its children", runId, owner);
                if (!probe.terminateTree(owner, TERMINATE_TIMEOUT)) {
                    throw new LockException("PID " + owner + " holding run " + runId + " could not be terminated");
                }
            } else if (owner == self) {
                throw new LockHeldException(runId, owner);
            } else {
                log.info("Removing stale lock for run {} (PID {} not running)", runId,
                        owner > 0 ? owner : "unknown");
            }
            deleteLock(file);
        }
        throw new LockException("Could not acquire lock for run " + runId + " after " + MAX_ATTEMPTS + " attempts");
    }

    /**
     * Removes the lock only if it still records the token's PID. A lock taken over by another
     * process after a stale reclaim is left alone.
     */
    public void release(LockToken token) {
        Optional<LockRecord> existing = read(token.file());
        if (existing.isEmpty()) {
            log.debug("Lock for run {} already gone", token.runId());
            return;
        }
        if (existing.get().pid() != token.pid()) {
            log.warn("Lock for run {} now belongs to PID {}, not releasing", token.runId(), existing.get().pid());
            return;
        }
        deleteLock(token.file());
        log.info("Released lock for run {}", token.runId());
    }

    public Optional<LockRecord> read(String runId) {
        return read(lockFile(runId));
    }

    /**
     * Publishes a fully written lock file in one step: the record goes to a temporary file
     * that is then hard-linked to the lock name, which fails if the name already exists.
     */
    private boolean tryCreate(Path file, String runId, long pid) {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            byte[] content = mapper.writeValueAsBytes(
                    new LockRecord(runId, pid, clock.instant().truncatedTo(ChronoUnit.SECONDS)));
            tmp = Files.createTempFile(dir, ".lock.", ".tmp");
            Files.write(tmp, content);
            try {
                Files.createLink(file, tmp);
            } catch (UnsupportedOperationException e) {
                Files.write(file, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            }
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new LockException("Cannot create lock file " + file + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.debug("Could not remove temporary lock file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    private Optional<LockRecord> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), LockRecord.class));
        } catch (IOException e) {
            log.warn("Unreadable lock file {}: {}", file, e.getMessage());
            return Optional.of(new LockRecord(null, -1L, null));
        }
    }

    private void deleteLock(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new LockException("Cannot remove lock file " + file + ": " + e.getMessage(), e);
        }
    }
}
