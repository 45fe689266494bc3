package com.armada.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process fan-out of run progress events.
 * <p>
 * Every subscriber sees the events of every run, nested epic runs included; the
 * {@link ArmadaEvent#runId()} tells them apart. Events are delivered on the publishing
 * thread, which for item events is the scheduler's control thread, so a subscriber sees the
 * events of one run in the order they happened. A failing subscriber is logged and skipped.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<ArmadaEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(ArmadaEvent event) {
        log.debug("{} {} {}", event.runId(), event.eventType(), event.itemId() == null ? "" : event.itemId());
        for (Consumer<ArmadaEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {} of run {}", event.eventType(), event.runId(), e);
            }
        }
    }

    /**
     * @return a handle that removes {@code consumer} again
     */
    public Subscription subscribe(Consumer<ArmadaEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
