package com.colloquy.core.stream;

import com.colloquy.core.model.Agent;
import com.colloquy.core.model.ConversationStatus;
import com.colloquy.core.model.Message;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A prepared or running conversation run together with its liveness flag.
 */
public class ConversationHandle {

    private final String conversationId;
    private final String userId;
    private final List<Message> transcript;
    private final List<Agent> agents;
    private final int maxTurns;
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final AtomicLong creditsUsed = new AtomicLong();
    private final CompletableFuture<ConversationStatus> completion = new CompletableFuture<>();
    private volatile String error;

    ConversationHandle(String conversationId, String userId, List<Message> transcript,
                       List<Agent> agents, int maxTurns) {
        this.conversationId = conversationId;
        this.userId = userId;
        this.transcript = List.copyOf(transcript);
        this.agents = List.copyOf(agents);
        this.maxTurns = maxTurns;
    }

    public String conversationId() {
        return conversationId;
    }

    public String userId() {
        return userId;
    }

    public List<Message> transcript() {
        return transcript;
    }

    public List<Agent> agents() {
        return agents;
    }

    public int maxTurns() {
        return maxTurns;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Flips the liveness flag. The run stops at its next step.
     *
     * @return false if the handle was already inactive
     */
    public boolean deactivate() {
        return active.compareAndSet(true, false);
    }

    public long totalCreditsUsed() {
        return creditsUsed.get();
    }

    long addCredits(long credits) {
        return creditsUsed.addAndGet(credits);
    }

    /** The error that ended the run, if any. */
    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    void recordError(String message) {
        error = message;
    }

    /** Completes with the run's final status. */
    public CompletableFuture<ConversationStatus> completion() {
        return completion;
    }

    void finish(ConversationStatus status) {
        active.set(false);
        completion.complete(status);
    }
}
