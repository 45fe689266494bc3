package com.armada.core.executor;

import com.armada.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Runs work items in parallel with at most {@code maxParallel} live at once.
 *
 * <p>The calling thread is the control thread: it launches items, blocks on a completion
 * queue, and launches the next item as soon as a slot frees. A per-item timeout cancels the
 * item's future and interrupts its worker. Concurrency is bounded by the in-flight count, not
 * by the pool size. Outcomes are returned uninterpreted.
 *
 * <p>When {@code stopRequested} turns true no further items are launched; those already in
 * flight are awaited normally.
 */
public class BoundedExecutor {

    private static final Logger log = LoggerFactory.getLogger(BoundedExecutor.class);

    private final String threadPrefix;

    public BoundedExecutor(String threadPrefix) {
        this.threadPrefix = threadPrefix;
    }

    /**
     * @param maxParallel    maximum live items, {@code <= 0} for unbounded
     * @param perItemTimeout per-item limit, {@code null} or zero for none
     * @return outcomes of every launched item, in completion order
     */
    public List<WorkOutcome> run(List<WorkItem> items, UnitOfWork work, int maxParallel,
                                 Duration perItemTimeout, ExecutionListener listener,
                                 BooleanSupplier stopRequested) {
        if (items.isEmpty()) {
            return List.of();
        }
        int limit = maxParallel <= 0 ? items.size() : Math.min(maxParallel, items.size());
        boolean timed = perItemTimeout != null && !perItemTimeout.isZero() && !perItemTimeout.isNegative();

        ExecutorService workers = Executors.newCachedThreadPool(threadFactory("worker"));
        ScheduledExecutorService timer = timed
                ? Executors.newSingleThreadScheduledExecutor(threadFactory("timeout")) : null;
        var completion = new ExecutorCompletionService<WorkOutcome>(workers);
        var pending = new ArrayDeque<>(items);
        var inFlight = new HashMap<Future<WorkOutcome>, Launch>();
        var outcomes = new ArrayList<WorkOutcome>(items.size());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        try {
            launchWhileFree(pending, inFlight, limit, completion, work, listener, stopRequested,
                    timer, perItemTimeout, mdc);
            while (!inFlight.isEmpty()) {
                Future<WorkOutcome> done;
                try {
                    done = completion.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for {} in-flight item(s)", inFlight.size());
                    return outcomes;
                }
                Launch launch = inFlight.remove(done);
                WorkOutcome outcome = collect(done, launch, perItemTimeout);
                outcomes.add(outcome);
                listener.onFinished(outcome);
                launchWhileFree(pending, inFlight, limit, completion, work, listener, stopRequested,
                        timer, perItemTimeout, mdc);
            }
            if (!pending.isEmpty()) {
                log.info("Stop requested, {} item(s) not launched", pending.size());
            }
            return outcomes;
        } finally {
            workers.shutdownNow();
            if (timer != null) {
                timer.shutdownNow();
            }
        }
    }

    private void launchWhileFree(Deque<WorkItem> pending, Map<Future<WorkOutcome>, Launch> inFlight,
                                 int limit, ExecutorCompletionService<WorkOutcome> completion,
                                 UnitOfWork work, ExecutionListener listener, BooleanSupplier stopRequested,
                                 ScheduledExecutorService timer, Duration perItemTimeout,
                                 Map<String, String> mdc) {
        while (inFlight.size() < limit && !pending.isEmpty()) {
            if (stopRequested.getAsBoolean()) {
                return;
            }
            WorkItem item = pending.poll();
            listener.onStarted(item);
            long startNanos = System.nanoTime();
            Future<WorkOutcome> future = completion.submit(() -> execute(item, work, startNanos, mdc));
            inFlight.put(future, new Launch(item, startNanos));
            if (timer != null) {
                timer.schedule(() -> future.cancel(true), perItemTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            log.debug("Launched {} ({} in flight)", item.id(), inFlight.size());
        }
    }

    private static WorkOutcome execute(WorkItem item, UnitOfWork work, long startNanos, Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        MDC.put("itemId", item.id());
        try {
            WorkResult result = work.execute(item);
            return WorkOutcome.of(item.id(), result, since(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkOutcome.error(item.id(), e, since(startNanos));
        } catch (Exception e) {
            log.warn("Unit of work for {} threw {}", item.id(), e.toString());
            return WorkOutcome.error(item.id(), e, since(startNanos));
        } finally {
            MDC.clear();
        }
    }

    private static WorkOutcome collect(Future<WorkOutcome> done, Launch launch, Duration perItemTimeout) {
        Duration elapsed = since(launch.startNanos());
        if (done.isCancelled()) {
            log.warn("Item {} exceeded its {} minute timeout", launch.item().id(), perItemTimeout.toMinutes());
            return WorkOutcome.timeout(launch.item().id(), perItemTimeout, elapsed);
        }
        try {
            return done.get();
        } catch (CancellationException e) {
            return WorkOutcome.timeout(launch.item().id(), perItemTimeout, elapsed);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return WorkOutcome.error(launch.item().id(), cause, elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkOutcome.error(launch.item().id(), e, elapsed);
        }
    }

    private ThreadFactory threadFactory(String role) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, threadPrefix + "-" + role + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record Launch(WorkItem item, long startNanos) {}
}
