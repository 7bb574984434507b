package com.colloquy.core.state;

import com.colloquy.core.model.Message;
import com.colloquy.core.model.RosterEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one conversation run.
 * <p>
 * Owned by a single run and never shared between threads. The transcript is append-only,
 * {@code turnCount} only grows and {@code conversationComplete} never goes back to false.
 */
public class ConversationState {

    private final String conversationId;
    private final String userId;
    private final List<Message> messages;
    private final List<RosterEntry> agents;
    private final int maxTurns;
    private String currentSpeaker;
    private int turnCount;
    private boolean conversationComplete;

    public ConversationState(String conversationId, String userId, List<Message> transcript,
                             List<RosterEntry> agents, int maxTurns) {
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive, got " + maxTurns);
        }
        this.conversationId = conversationId;
        this.userId = userId;
        this.messages = new ArrayList<>(transcript);
        this.agents = List.copyOf(agents);
        this.maxTurns = maxTurns;
    }

    public String conversationId() {
        return conversationId;
    }

    public String userId() {
        return userId;
    }

    public List<Message> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<RosterEntry> agents() {
        return agents;
    }

    public String currentSpeaker() {
        return currentSpeaker;
    }

    public int turnCount() {
        return turnCount;
    }

    public int maxTurns() {
        return maxTurns;
    }

    public boolean conversationComplete() {
        return conversationComplete;
    }

    public boolean turnBudgetExhausted() {
        return turnCount >= maxTurns;
    }

    /** Last {@code n} messages, oldest first. */
    public List<Message> recentMessages(int n) {
        int from = Math.max(0, messages.size() - n);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    /**
     * Records a generated reply: appends it, advances the turn counter and moves the floor
     * to its author.
     */
    public void recordTurn(Message reply) {
        if (conversationComplete) {
            throw new IllegalStateException("Conversation " + conversationId + " is already complete");
        }
        if (turnBudgetExhausted()) {
            throw new IllegalStateException("Turn budget of " + maxTurns + " exhausted for " + conversationId);
        }
        messages.add(reply);
        turnCount++;
        currentSpeaker = reply.agentId();
    }

    public void markComplete() {
        conversationComplete = true;
    }
}
