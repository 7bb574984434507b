package com.colloquy.core.supervisor;

import com.colloquy.core.llm.LlmParseException;
import com.colloquy.core.llm.LlmProperties;
import com.colloquy.core.llm.LlmService;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.Agent;
import com.colloquy.core.model.AgentSelection;
import com.colloquy.core.model.AiConfig;
import com.colloquy.core.model.Message;
import com.colloquy.core.model.RosterEntry;
import com.colloquy.core.state.ConversationState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SpeakerSelectorTest {

    private static final RosterEntry ALICE = new RosterEntry("alice", "Alice", "historian");
    private static final RosterEntry BOB = new RosterEntry("bob", "Bob", "engineer");
    private static final RosterEntry CAROL = new RosterEntry("carol", "Carol", "skeptic");

    private LlmService llmService;
    private SimpleMeterRegistry registry;
    private SpeakerSelector selector;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        registry = new SimpleMeterRegistry();
        selector = new SpeakerSelector(llmService, new LlmProperties(), new ColloquyMetrics(registry));
    }

    private void supervisorReturns(AgentSelection selection) {
        when(llmService.generateStructured(any(AiConfig.class), eq(AgentSelection.class), anyString(), anyString(),
                anyDouble(), anyInt())).thenReturn(selection);
    }

    private static Message reply(RosterEntry speaker, String content) {
        return new Message(com.colloquy.core.model.MessageRole.ASSISTANT, content, speaker.name(),
                speaker.agentId(), System.currentTimeMillis());
    }

    private static ConversationState state(List<Message> messages, RosterEntry... roster) {
        return new ConversationState("conv-1", null, messages, List.of(roster), 10);
    }

    @Test
    @DisplayName("returns the supervisor's pick when it differs from the last speaker")
    void returnsModelPick() {
        supervisorReturns(new AgentSelection("bob", "engineering question", 1));

        var selection = selector.selectNext(state(List.of(Message.user("How do engines work?")), ALICE, BOB))
                .orElseThrow();

        assertEquals("bob", selection.agentId());
        assertEquals("engineering question", selection.reasoning());
        assertEquals(1.0, registry.find("colloquy.selection.total").tag("outcome", "model").counter().count());
    }

    @Test
    @DisplayName("re-picking the most recent speaker is overridden with the first other roster agent")
    void overridesRepeatSpeaker() {
        supervisorReturns(new AgentSelection("alice", "she knows history", 2));
        var messages = List.of(Message.user("Tell me about Rome"), reply(ALICE, "Rome was founded..."));

        var selection = selector.selectNext(state(messages, ALICE, BOB, CAROL)).orElseThrow();

        assertEquals("bob", selection.agentId());
        assertEquals(SpeakerSelector.OVERRIDE_REASONING, selection.reasoning());
        assertEquals(2, selection.turns());
    }

    @Test
    @DisplayName("an agent who spoke earlier but not last may be picked again")
    void onlyMostRecentSpeakerIsExcluded() {
        supervisorReturns(new AgentSelection("alice", "follow-up", 1));
        var messages = List.of(Message.user("Rome?"), reply(ALICE, "Founded in 753 BC"), reply(BOB, "Great roads"));

        var selection = selector.selectNext(state(messages, ALICE, BOB)).orElseThrow();

        assertEquals("alice", selection.agentId());
    }

    @Test
    @DisplayName("a single-agent roster keeps its only agent")
    void singleAgentRoster() {
        supervisorReturns(new AgentSelection("alice", "only one", 1));
        var messages = List.of(Message.user("Hi"), reply(ALICE, "Hello"));

        assertEquals("alice", selector.selectNext(state(messages, ALICE)).orElseThrow().agentId());
    }

    @Test
    @DisplayName("supervisor failure falls back to the first roster agent")
    void fallbackOnError() {
        when(llmService.generateStructured(any(), any(), anyString(), anyString(), anyDouble(), anyInt()))
                .thenThrow(new LlmParseException("bad json", new RuntimeException()));

        var selection = selector.selectNext(state(List.of(Message.user("Hi")), ALICE, BOB)).orElseThrow();

        assertEquals("alice", selection.agentId());
        assertEquals(SpeakerSelector.FALLBACK_REASONING, selection.reasoning());
        assertEquals(1, selection.turns());
        assertEquals(1.0, registry.find("colloquy.selection.total").tag("outcome", "fallback").counter().count());
    }

    @Test
    @DisplayName("blank agent id or negative turns are treated as a failed call")
    void invalidSelectionFallsBack() {
        supervisorReturns(new AgentSelection(" ", "?", 1));
        assertEquals(SpeakerSelector.FALLBACK_REASONING,
                selector.selectNext(state(List.of(Message.user("Hi")), BOB, ALICE)).orElseThrow().reasoning());

        supervisorReturns(new AgentSelection("alice", "?", -1));
        var selection = selector.selectNext(state(List.of(Message.user("Hi")), BOB, ALICE)).orElseThrow();
        assertEquals("bob", selection.agentId());
    }

    @Test
    @DisplayName("zero turns is passed through as a pause")
    void zeroTurnsPassesThrough() {
        supervisorReturns(new AgentSelection("bob", "let the user speak", 0));

        var selection = selector.selectNext(state(List.of(Message.user("Hi")), ALICE, BOB)).orElseThrow();

        assertTrue(selection.isPause());
    }

    @Test
    @DisplayName("empty roster yields no selection")
    void emptyRoster() {
        assertTrue(selector.selectNext(state(List.of(Message.user("Hi")))).isEmpty());
        verifyNoInteractions(llmService);
    }

    @Test
    @DisplayName("prompt lists the roster, the last five messages and the most recent speaker")
    void promptContents() {
        supervisorReturns(new AgentSelection("carol", "skeptic", 1));
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user("first message"));
        for (int i = 0; i < 5; i++) {
            messages.add(reply(i % 2 == 0 ? ALICE : BOB, "point " + i));
        }

        selector.selectNext(state(messages, ALICE, BOB, CAROL));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).generateStructured(any(), eq(AgentSelection.class),
                eq(SupervisorPrompts.SELECTION_SYSTEM_PROMPT), prompt.capture(), eq(0.3), eq(4096));
        String text = prompt.getValue();
        assertTrue(text.contains("- carol: Carol - skeptic"));
        assertFalse(text.contains("first message"));
        assertTrue(text.contains("Alice: point 4"));
        assertTrue(text.contains("The last message was from Alice"));
        assertTrue(text.contains("Agents who spoke recently: Alice, Bob"));
    }

    @Test
    @DisplayName("recentDistinctSpeakers lists distinct assistants, most recent first")
    void recentDistinctSpeakers() {
        var messages = List.of(Message.user("Hi"), reply(ALICE, "a"), reply(BOB, "b"), reply(ALICE, "c"),
                reply(CAROL, "d"));

        Map<String, String> speakers = SpeakerSelector.recentDistinctSpeakers(messages);

        assertEquals(List.of("carol", "alice", "bob"), new ArrayList<>(speakers.keySet()));
        assertEquals("Carol", speakers.get("carol"));
    }

    @Test
    @DisplayName("works with agents built from the directory")
    void rosterFromAgents() {
        supervisorReturns(new AgentSelection("x", "r", 1));
        var agent = new Agent("x", "Xena", "p", "warrior", new AiConfig("openai", "gpt-4o-mini", null), null, null);

        var selection = selector.selectNext(state(List.of(Message.user("Hi")), agent.toRosterEntry()));

        assertEquals("x", selection.orElseThrow().agentId());
    }
}
