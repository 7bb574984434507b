package com.colloquy.core.state;

import com.colloquy.core.model.Agent;
import com.colloquy.core.model.AiConfig;
import com.colloquy.core.model.Message;
import com.colloquy.core.model.RosterEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationStateTest {

    private static final Agent ALICE = new Agent("alice", "Alice", "", "", new AiConfig("openai", "m", null), null, null);

    private static ConversationState state(int maxTurns) {
        return new ConversationState("c1", "u1", List.of(Message.user("Hi")),
                List.of(new RosterEntry("alice", "Alice", "")), maxTurns);
    }

    @Test
    @DisplayName("maxTurns must be positive")
    void rejectsNonPositiveMaxTurns() {
        assertThrows(IllegalArgumentException.class, () -> state(0));
    }

    @Test
    @DisplayName("recordTurn appends, counts and moves the floor")
    void recordTurn() {
        var state = state(3);

        state.recordTurn(Message.assistant(ALICE, "Hello"));

        assertEquals(2, state.messages().size());
        assertEquals(1, state.turnCount());
        assertEquals("alice", state.currentSpeaker());
        assertFalse(state.turnBudgetExhausted());
    }

    @Test
    @DisplayName("no reply is accepted past the turn budget")
    void budgetEnforced() {
        var state = state(1);
        state.recordTurn(Message.assistant(ALICE, "one"));

        assertTrue(state.turnBudgetExhausted());
        assertThrows(IllegalStateException.class, () -> state.recordTurn(Message.assistant(ALICE, "two")));
        assertEquals(1, state.turnCount());
    }

    @Test
    @DisplayName("no reply is accepted once complete")
    void completeIsFinal() {
        var state = state(5);
        state.markComplete();

        assertTrue(state.conversationComplete());
        assertThrows(IllegalStateException.class, () -> state.recordTurn(Message.assistant(ALICE, "late")));
    }

    @Test
    @DisplayName("messages view is read-only and the input list is copied")
    void defensiveCopies() {
        var state = state(5);

        assertThrows(UnsupportedOperationException.class, () -> state.messages().add(Message.user("x")));
        assertEquals(1, state.recentMessages(5).size());
    }

    @Test
    @DisplayName("recentMessages returns the tail oldest first")
    void recentMessages() {
        var state = state(5);
        state.recordTurn(Message.assistant(ALICE, "a"));
        state.recordTurn(Message.assistant(ALICE, "b"));

        var recent = state.recentMessages(2);

        assertEquals(List.of("a", "b"), recent.stream().map(Message::content).toList());
    }
}
