package com.armada.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Tracks agent processes spawned by this JVM so they can be torn down on timeout or on a
 * forced shutdown. Descendants are signalled before their parent.
 */
public class ChildProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChildProcessRegistry.class);
    private static final Duration TERM_GRACE = Duration.ofSeconds(5);

    private final Set<Process> live = ConcurrentHashMap.newKeySet();

    public void register(Process process) {
        live.add(process);
    }

    public void unregister(Process process) {
        live.remove(process);
    }

    public int size() {
        return live.size();
    }

    /** Terminates every registered process tree. */
    public void destroyAll() {
        List<Process> snapshot = List.copyOf(live);
        if (!snapshot.isEmpty()) {
            log.warn("Terminating {} agent process(es)", snapshot.size());
        }
        snapshot.forEach(this::destroyTree);
    }

    public void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(TERM_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("PID {} ignored SIGTERM, killing", process.pid());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        } finally {
            live.remove(process);
        }
    }
}
