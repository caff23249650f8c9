package com.quillmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for validation and resolution events.
 * <p>
 * Supports per-type subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<TypedSubscriber> typedSubscribers = new CopyOnWriteArrayList<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<QuillmindEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (type-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(QuillmindEvent event) {
        log.debug("Publishing event: {} for batch {}", event.eventType(), event.batchId());

        for (TypedSubscriber subscriber : typedSubscribers) {
            if (subscriber.eventType().equals(event.eventType())) {
                deliverSafely(subscriber.consumer(), event);
            }
        }

        for (Consumer<QuillmindEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one type.
     *
     * @param eventType the event type to receive
     * @param consumer  callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<QuillmindEvent> consumer) {
        var subscriber = new TypedSubscriber(eventType, consumer);
        typedSubscribers.add(subscriber);
        log.debug("Subscribed to {}", eventType);
        return () -> typedSubscribers.remove(subscriber);
    }

    /**
     * Subscribe to every event.
     *
     * @param consumer callback invoked for each event regardless of type
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<QuillmindEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record TypedSubscriber(String eventType, Consumer<QuillmindEvent> consumer) {}

    private void deliverSafely(Consumer<QuillmindEvent> subscriber, QuillmindEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
