package com.armada.core.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessProbe} backed by {@link ProcessHandle}.
 */
public class HostProcessProbe implements ProcessProbe {

    private static final Logger log = LoggerFactory.getLogger(HostProcessProbe.class);

    @Override
    public long currentPid() {
        return ProcessHandle.current().pid();
    }

    @Override
    public boolean isAlive(long pid) {
        return pid > 0 && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean terminateTree(long pid, Duration timeout) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return true;
        }
        ProcessHandle process = handle.get();
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        if (awaitExit(process, timeout)) {
            return true;
        }
        log.warn("PID {} did not exit within {}s, killing forcibly", pid, timeout.toSeconds());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        return awaitExit(process, Duration.ofSeconds(5));
    }

    private static boolean awaitExit(ProcessHandle process, Duration timeout) {
        try {
            process.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !process.isAlive();
        } catch (ExecutionException e) {
            return !process.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }
}
