package com.quillmind.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private QuillmindEvent event(String type) {
        return new QuillmindEvent(type, "QV-1", "goal-1", Map.of(), Instant.now());
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers only matching event types to typed subscribers")
        void deliversMatchingType() {
            List<QuillmindEvent> received = new ArrayList<>();
            eventBus.subscribe(QuillmindEvent.VALIDATION_COMPLETED, received::add);

            eventBus.publish(event(QuillmindEvent.VALIDATION_COMPLETED));
            eventBus.publish(event(QuillmindEvent.RESOLUTION_COMPLETED));

            assertEquals(1, received.size());
            assertEquals(QuillmindEvent.VALIDATION_COMPLETED, received.get(0).eventType());
        }

        @Test
        @DisplayName("global subscribers receive everything")
        void globalSubscriber() {
            List<QuillmindEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(QuillmindEvent.RESOLUTION_FALLBACK));
            eventBus.publish(event(QuillmindEvent.RESOLUTION_INCONSISTENT));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<QuillmindEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribeAll(received::add);
            subscription.unsubscribe();

            eventBus.publish(event(QuillmindEvent.VALIDATION_COMPLETED));
            assertTrue(received.isEmpty());
        }
    }

    // -- Error isolation tests ------------------------------------------------

    @Nested
    @DisplayName("error isolation")
    class ErrorIsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriberIsolated() {
            List<QuillmindEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(QuillmindEvent.VALIDATION_COMPLETED)));
            assertEquals(1, received.size());
        }
    }
}
