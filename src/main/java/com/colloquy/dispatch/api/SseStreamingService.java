package com.colloquy.dispatch.api;

import com.colloquy.core.events.EventBus;
import com.colloquy.core.events.StreamEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * Each frame is named after the event type and carries {@code {type, data}} as JSON.
 * An emitter is completed after the conversation's terminal event. Periodic heartbeat
 * comments keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for conversation {}: {}", registration.conversationId, e.getMessage());
            }
        }
    }

    /**
     * Creates an emitter that observes a conversation.
     */
    public SseEmitter createEmitter(String conversationId) {
        return createEmitter(conversationId, () -> {});
    }

    /**
     * Creates an emitter for a conversation.
     *
     * @param onDisconnect invoked when the client goes away before the conversation ends
     */
    public SseEmitter createEmitter(String conversationId, Runnable onDisconnect) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new EmitterRegistration(conversationId, emitter);
        registration.subscription = eventBus.subscribe(conversationId, event -> {
            sendEvent(emitter, event);
            if (event.isTerminal() && close(registration)) {
                emitter.complete();
            }
        });
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> disconnect(registration, onDisconnect));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for conversation {}", conversationId);
            disconnect(registration, onDisconnect);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for conversation {}: {}", conversationId, ex.getMessage());
            disconnect(registration, onDisconnect);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for conversation {}: {}", conversationId, e.getMessage());
        }
        log.info("SSE emitter created for conversation {} (timeout={}ms)", conversationId, timeoutMs);
        return emitter;
    }

    /**
     * Completes every open emitter of a conversation, e.g. after a run was stopped silently.
     */
    public void completeAll(String conversationId) {
        for (EmitterRegistration registration : activeRegistrations) {
            if (registration.conversationId.equals(conversationId) && close(registration)) {
                registration.emitter.complete();
            }
        }
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, StreamEvent event) {
        try {
            Map<String, Object> frame = new LinkedHashMap<>();
            frame.put("type", event.type());
            frame.put("data", event.data());
            emitter.send(SseEmitter.event().name(event.type()).data(frame));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for conversation {}: {}",
                    event.type(), event.conversationId(), e.getMessage());
        }
    }

    private void disconnect(EmitterRegistration registration, Runnable onDisconnect) {
        if (close(registration)) {
            onDisconnect.run();
        }
    }

    /**
     * @return true for the call that actually closed the registration
     */
    private boolean close(EmitterRegistration registration) {
        if (!registration.closed.compareAndSet(false, true)) {
            return false;
        }
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        return true;
    }

    private static final class EmitterRegistration {
        private final String conversationId;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile EventBus.Subscription subscription;

        EmitterRegistration(String conversationId, SseEmitter emitter) {
            this.conversationId = conversationId;
            this.emitter = emitter;
        }
    }
}
