package com.colloquy.core.supervisor;

import com.colloquy.core.llm.LlmEmptyResponseException;
import com.colloquy.core.llm.LlmProperties;
import com.colloquy.core.llm.LlmService;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.AiConfig;
import com.colloquy.core.model.Message;
import com.colloquy.core.model.MessageRole;
import com.colloquy.core.model.RosterEntry;
import com.colloquy.core.model.TerminationDecision;
import com.colloquy.core.state.ConversationState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TerminationEvaluatorTest {

    private LlmService llmService;
    private TerminationEvaluator evaluator;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        evaluator = new TerminationEvaluator(llmService, new LlmProperties(), new ColloquyMetrics(new SimpleMeterRegistry()));
    }

    private static ConversationState state(int assistantReplies) {
        var messages = new java.util.ArrayList<Message>();
        messages.add(Message.user("Hello"));
        for (int i = 0; i < assistantReplies; i++) {
            messages.add(new Message(MessageRole.ASSISTANT, "Hey " + i, "Agent" + i, "a" + i, i));
        }
        return new ConversationState("conv-1", null, messages, List.of(new RosterEntry("a0", "Agent0", "")), 10);
    }

    private void supervisorReturns(TerminationDecision decision) {
        when(llmService.generateStructured(any(AiConfig.class), eq(TerminationDecision.class), anyString(),
                anyString(), anyDouble(), anyInt())).thenReturn(decision);
    }

    @Test
    @DisplayName("fewer than three messages continues without asking the model")
    void tooShort() {
        TerminationDecision decision = evaluator.shouldStop(state(1));

        assertFalse(decision.shouldTerminate());
        assertEquals(TerminationEvaluator.TOO_SHORT_REASON, decision.reason());
        verifyNoInteractions(llmService);
    }

    @Test
    @DisplayName("returns the model's decision")
    void modelDecision() {
        supervisorReturns(new TerminationDecision(true, "greetings exchanged"));

        TerminationDecision decision = evaluator.shouldStop(state(2));

        assertTrue(decision.shouldTerminate());
        assertEquals("greetings exchanged", decision.reason());
    }

    @Test
    @DisplayName("model failure biases toward continuing")
    void failureContinues() {
        when(llmService.generateStructured(any(), any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenThrow(new LlmEmptyResponseException("empty"));

        TerminationDecision decision = evaluator.shouldStop(state(3));

        assertFalse(decision.shouldTerminate());
        assertEquals(TerminationEvaluator.ERROR_REASON, decision.reason());
    }

    @Test
    @DisplayName("null decision biases toward continuing")
    void nullDecisionContinues() {
        supervisorReturns(null);

        assertFalse(evaluator.shouldStop(state(3)).shouldTerminate());
    }

    @Test
    @DisplayName("prompt carries only the last five messages")
    void promptUsesRecentWindow() {
        supervisorReturns(new TerminationDecision(false, "ongoing"));

        evaluator.shouldStop(state(6));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).generateStructured(any(), eq(TerminationDecision.class),
                eq(SupervisorPrompts.TERMINATION_SYSTEM_PROMPT), prompt.capture(), anyDouble(), anyInt());
        assertFalse(prompt.getValue().contains("User: Hello"));
        assertFalse(prompt.getValue().contains("Agent0: Hey 0"));
        assertTrue(prompt.getValue().contains("Agent1: Hey 1"));
        assertTrue(prompt.getValue().contains("Agent5: Hey 5"));
    }
}
