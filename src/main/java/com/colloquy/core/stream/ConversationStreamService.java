package com.colloquy.core.stream;

import com.colloquy.core.agent.AgentDirectory;
import com.colloquy.core.credit.CostAccountant;
import com.colloquy.core.credit.InsufficientCreditsException;
import com.colloquy.core.engine.ConversationEngine;
import com.colloquy.core.engine.ConversationProperties;
import com.colloquy.core.engine.ConversationRun;
import com.colloquy.core.events.EventBus;
import com.colloquy.core.events.StreamEvent;
import com.colloquy.core.logging.MdcContext;
import com.colloquy.core.model.Agent;
import com.colloquy.core.model.ConversationStatus;
import com.colloquy.core.model.Message;
import com.colloquy.core.model.MessageRole;
import com.colloquy.core.model.WorkflowEvent;
import com.colloquy.core.persistence.ConversationStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives conversation runs and turns their events into the wire protocol.
 * <p>
 * Every generated reply is appended to the {@link ConversationStore} before its
 * {@code agent_response} is published on the {@link EventBus}. Credit updates carry the
 * running total for the run. Runs execute on a dedicated worker pool so a slow model call
 * never ties up a request thread.
 */
@Service
public class ConversationStreamService {

    private static final Logger log = LoggerFactory.getLogger(ConversationStreamService.class);

    private final ConversationEngine engine;
    private final AgentDirectory agentDirectory;
    private final ConversationStore store;
    private final CostAccountant accountant;
    private final EventBus eventBus;
    private final ConversationProperties properties;
    private final ExecutorService executor;

    private final ConcurrentHashMap<String, ConversationHandle> running = new ConcurrentHashMap<>();

    /** Conversations being prepared or run. Claimed before anything is persisted. */
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    @Autowired
    public ConversationStreamService(ConversationEngine engine, AgentDirectory agentDirectory,
                                     ConversationStore store, CostAccountant accountant, EventBus eventBus,
                                     ConversationProperties properties) {
        this(engine, agentDirectory, store, accountant, eventBus, properties, newWorkerPool(properties.getWorkerThreads()));
    }

    ConversationStreamService(ConversationEngine engine, AgentDirectory agentDirectory,
                              ConversationStore store, CostAccountant accountant, EventBus eventBus,
                              ConversationProperties properties, ExecutorService executor) {
        this.engine = engine;
        this.agentDirectory = agentDirectory;
        this.store = store;
        this.accountant = accountant;
        this.eventBus = eventBus;
        this.properties = properties;
        this.executor = executor;
    }

    @PreDestroy
    void shutdown() {
        running.values().forEach(ConversationHandle::deactivate);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Validates the request and records the opening user message of a new conversation.
     * The run does not start until {@link #launch} or {@link #run} is called.
     *
     * @throws IllegalArgumentException     for a blank message, no agents or a non-positive turn limit
     * @throws InsufficientCreditsException when the user has no credits left
     */
    public ConversationHandle open(ConversationLaunch request) {
        String conversationId = UUID.randomUUID().toString();
        claim(conversationId);
        try {
            return prepare(conversationId, List.of(), request);
        } catch (RuntimeException e) {
            claimed.remove(conversationId);
            throw e;
        }
    }

    /**
     * Continues a stored conversation with a new user message.
     *
     * @throws ConversationNotFoundException when nothing is stored under {@code conversationId}
     * @throws IllegalStateException         when a run for the conversation is still in progress
     */
    public ConversationHandle resume(String conversationId, ConversationLaunch request) {
        claim(conversationId);
        try {
            List<Message> transcript = store.load(conversationId);
            if (transcript.isEmpty()) {
                throw new ConversationNotFoundException(conversationId);
            }
            return prepare(conversationId, transcript, request);
        } catch (RuntimeException e) {
            claimed.remove(conversationId);
            throw e;
        }
    }

    /** Runs the conversation on the worker pool. */
    public CompletableFuture<ConversationStatus> launch(ConversationHandle handle) {
        CompletableFuture.runAsync(() -> run(handle), executor).exceptionally(ex -> {
            log.error("Conversation {} could not be scheduled: {}", handle.conversationId(), ex.getMessage());
            finish(handle, ConversationStatus.FAILED);
            return null;
        });
        return handle.completion();
    }

    /**
     * Runs the conversation on the calling thread until it ends or is stopped.
     */
    public ConversationStatus run(ConversationHandle handle) {
        String conversationId = handle.conversationId();
        MdcContext.setConversation(conversationId);
        ConversationStatus status = ConversationStatus.FAILED;
        try (ConversationRun run = engine.start(conversationId, handle.userId(), handle.transcript(),
                handle.agents(), handle.maxTurns(), handle::isActive)) {
            while (run.hasNext()) {
                dispatch(handle, run.next());
            }
            status = run.outcome();
        } catch (RuntimeException e) {
            log.error("Conversation {} aborted while streaming: {}", conversationId, e.getMessage(), e);
            handle.recordError("Conversation error: " + e.getMessage());
            publish(conversationId, "error", Map.of("error", "Conversation error: " + e.getMessage()));
        } finally {
            finish(handle, status);
            MdcContext.clear();
        }
        return status;
    }

    /**
     * Asks a running conversation to stop. The run exits at its next step without further events.
     *
     * @return false when no run is in progress for the conversation
     */
    public boolean stop(String conversationId) {
        ConversationHandle handle = running.get(conversationId);
        if (handle == null || !handle.deactivate()) {
            return false;
        }
        log.info("Stop requested for conversation {}", conversationId);
        return true;
    }

    public Optional<ConversationHandle> find(String conversationId) {
        return Optional.ofNullable(running.get(conversationId));
    }

    /**
     * @throws ConversationNotFoundException when nothing is stored under {@code conversationId}
     */
    public List<Message> transcript(String conversationId) {
        List<Message> transcript = store.load(conversationId);
        if (transcript.isEmpty()) {
            throw new ConversationNotFoundException(conversationId);
        }
        return transcript;
    }

    private void claim(String conversationId) {
        if (!claimed.add(conversationId)) {
            throw new IllegalStateException("Conversation " + conversationId + " is already running");
        }
    }

    private ConversationHandle prepare(String conversationId, List<Message> history, ConversationLaunch request) {
        if (request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        if (request.agentIds() == null || request.agentIds().isEmpty()) {
            throw new IllegalArgumentException("at least one agent id is required");
        }
        int maxTurns = request.maxTurns() != null ? request.maxTurns() : properties.getDefaultMaxTurns();
        if (maxTurns < 1) {
            throw new IllegalArgumentException("max turns must be a positive integer");
        }

        String userId = request.userId() != null && !request.userId().isBlank() ? request.userId() : null;
        if (userId != null) {
            accountant.ensureAccount(userId);
            long balance = accountant.balance(userId).orElse(0L);
            if (balance <= 0) {
                throw new InsufficientCreditsException(1, balance);
            }
        }

        List<String> agentIds = new ArrayList<>(new LinkedHashSet<>(request.agentIds()));
        List<Agent> agents = agentDirectory.resolveAll(userId, agentIds);

        Message opening = Message.user(request.message().trim());
        store.append(conversationId, opening);
        List<Message> transcript = new ArrayList<>(history);
        transcript.add(opening);

        var handle = new ConversationHandle(conversationId, userId, transcript, agents, maxTurns);
        running.put(conversationId, handle);
        log.info("Prepared conversation {} with agents {} (max {} turns)", conversationId, agentIds, maxTurns);
        return handle;
    }

    private void dispatch(ConversationHandle handle, WorkflowEvent event) {
        String conversationId = handle.conversationId();
        switch (event.type()) {
            case STATUS -> publish(conversationId, "status", Map.of("message", event.message()));
            case AGENT_RESPONSE -> {
                store.append(conversationId, new Message(MessageRole.ASSISTANT, event.message(),
                        event.agentName(), event.agentId(), event.timestamp()));
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("content", event.message());
                data.put("agentId", event.agentId());
                data.put("agentName", event.agentName());
                data.put("isComplete", true);
                data.put("timestamp", event.timestamp());
                publish(conversationId, "agent_response", data);
            }
            case CREDIT_UPDATE -> {
                long total = handle.addCredits(event.creditsUsed());
                publish(conversationId, "credit_update", Map.of(
                        "creditsUsed", total,
                        "remainingCredits", event.remainingCredits()));
            }
            case CONVERSATION_COMPLETE -> publish(conversationId, "conversation_complete", closingData(handle, event));
            case CONVERSATION_PAUSED -> publish(conversationId, "conversation_paused", closingData(handle, event));
            case ERROR -> {
                handle.recordError(event.message());
                publish(conversationId, "error", Map.of("error", event.message()));
            }
        }
    }

    private static Map<String, Object> closingData(ConversationHandle handle, WorkflowEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversationId", handle.conversationId());
        data.put("totalCreditsUsed", handle.totalCreditsUsed());
        data.put("message", event.message());
        return data;
    }

    private void publish(String conversationId, String type, Map<String, Object> data) {
        eventBus.publish(new StreamEvent(type, conversationId, data, Instant.now()));
    }

    private void finish(ConversationHandle handle, ConversationStatus status) {
        if (running.remove(handle.conversationId(), handle)) {
            claimed.remove(handle.conversationId());
        }
        handle.finish(status);
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "conversation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
