package com.colloquy.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for conversation stream events.
 * <p>
 * Subscribers register per conversation or globally. A failing subscriber is logged
 * and does not affect delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<StreamEvent>>> conversationSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<StreamEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(StreamEvent event) {
        log.debug("Publishing {} for conversation {}", event.type(), event.conversationId());

        List<Consumer<StreamEvent>> subs = conversationSubscribers.get(event.conversationId());
        if (subs != null) {
            for (Consumer<StreamEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<StreamEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String conversationId, Consumer<StreamEvent> consumer) {
        conversationSubscribers.computeIfAbsent(conversationId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to conversation {}", conversationId);
        return () -> conversationSubscribers.computeIfPresent(conversationId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<StreamEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount(String conversationId) {
        List<Consumer<StreamEvent>> subs = conversationSubscribers.get(conversationId);
        return subs != null ? subs.size() : 0;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<StreamEvent> subscriber, StreamEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {}: {}", event.type(), e.getMessage(), e);
        }
    }
}
