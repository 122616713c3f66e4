package com.baton.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for coordination events.
 * <p>
 * Every subscriber receives every event and filters for itself.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<CoordinationEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(CoordinationEvent event) {
        log.debug("Publishing event: {} for work item {}", event.eventType(), event.workItemId());
        for (Consumer<CoordinationEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to all events.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<CoordinationEvent> consumer) {
        subscribers.add(consumer);
        log.debug("Subscribed to all events");
        return () -> subscribers.remove(consumer);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CoordinationEvent> subscriber, CoordinationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
