package com.taskloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for loop events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LoopEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<LoopEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(LoopEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<LoopEvent>> runSubs = event.runId() == null ? null : runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<LoopEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<LoopEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<LoopEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<LoopEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<LoopEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<LoopEvent> subscriber, LoopEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
