package com.colloquy.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

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

    private static StreamEvent event(String type, String conversationId) {
        return new StreamEvent(type, conversationId, Map.of("message", "m"), Instant.now());
    }

    @Nested
    @DisplayName("StreamEvent")
    class StreamEventTests {

        @Test
        @DisplayName("complete, paused and error events are terminal")
        void terminalTypes() {
            assertTrue(event("conversation_complete", "c").isTerminal());
            assertTrue(event("conversation_paused", "c").isTerminal());
            assertTrue(event("error", "c").isTerminal());
            assertFalse(event("agent_response", "c").isTerminal());
            assertFalse(event("status", "c").isTerminal());
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("conversation subscribers only see their conversation")
        void scopedDelivery() {
            List<StreamEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("c1", received::add);

            eventBus.publish(event("status", "c1"));
            eventBus.publish(event("status", "c2"));

            assertEquals(1, received.size());
            assertEquals("c1", received.get(0).conversationId());
        }

        @Test
        @DisplayName("global subscribers see every conversation")
        void globalDelivery() {
            List<StreamEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("status", "c1"));
            eventBus.publish(event("status", "c2"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery and drops empty lists")
        void unsubscribe() {
            List<StreamEvent> received = new CopyOnWriteArrayList<>();
            var subscription = eventBus.subscribe("c1", received::add);
            assertEquals(1, eventBus.subscriberCount("c1"));

            subscription.unsubscribe();
            eventBus.publish(event("status", "c1"));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.subscriberCount("c1"));
        }

        @Test
        @DisplayName("a failing subscriber does not block the others")
        void failingSubscriber() {
            List<StreamEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("c1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("c1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("status", "c1")));
            assertEquals(1, received.size());
        }
    }
}
