package com.armada.dispatch.cli;

import com.armada.agent.ChildProcessRegistry;
import com.armada.core.config.ArmadaProperties;
import com.armada.core.engine.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * JVM shutdown hook for SIGINT/SIGTERM: raises the shutdown signal, waits up to the grace
 * period for active runs to persist {@code interrupted} and release their locks, then
 * terminates any agent processes still running.
 */
@Component
public class GracefulShutdown {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdown.class);

    private final ShutdownSignal signal;
    private final ChildProcessRegistry processes;
    private final Duration grace;
    private Thread hook;

    public GracefulShutdown(ShutdownSignal signal, ChildProcessRegistry processes, ArmadaProperties properties) {
        this.signal = signal;
        this.processes = processes;
        this.grace = Duration.ofSeconds(properties.getShutdownGraceSeconds());
    }

    public synchronized void install() {
        if (hook != null) {
            return;
        }
        hook = new Thread(this::onShutdown, "armada-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
    }

    /** Removes the hook after a normal exit. Has no effect once the JVM is already shutting down. */
    public synchronized void uninstall() {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays");
        }
        hook = null;
    }

    void onShutdown() {
        signal.request();
        if (signal.activeRuns() == 0) {
            return;
        }
        ConsoleOutput.warn("Interrupt received. Waiting up to " + grace.toSeconds()
                + "s for in-flight items to finish...");
        try {
            if (signal.awaitIdle(grace)) {
                log.info("All runs stopped cleanly");
                return;
            }
            log.warn("Grace period of {}s exceeded", grace.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        processes.destroyAll();
    }
}
