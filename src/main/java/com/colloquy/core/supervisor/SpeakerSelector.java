package com.colloquy.core.supervisor;

import com.colloquy.core.llm.LlmProperties;
import com.colloquy.core.llm.LlmService;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.AgentSelection;
import com.colloquy.core.model.Message;
import com.colloquy.core.model.RosterEntry;
import com.colloquy.core.state.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the supervisor model who should speak next.
 * <p>
 * The prompt lists up to three recent distinct speakers, but only the single most recent
 * one is enforced: if the model picks that agent again, the first other roster agent is
 * chosen instead. Supervisor failures never stop the conversation; they fall back to
 * the first roster agent.
 */
@Service
public class SpeakerSelector {

    private static final Logger log = LoggerFactory.getLogger(SpeakerSelector.class);

    static final int CONTEXT_MESSAGES = 5;
    static final int RECENT_SPEAKER_WINDOW = 3;
    static final String OVERRIDE_REASONING = "Forced variety to avoid repetition";
    static final String FALLBACK_REASONING = "Fallback selection due to error";

    private final LlmService llmService;
    private final SupervisorCallSettings settings;
    private final ColloquyMetrics metrics;

    public SpeakerSelector(LlmService llmService, LlmProperties llmProperties, ColloquyMetrics metrics) {
        this.llmService = llmService;
        this.settings = SupervisorCallSettings.from(llmProperties);
        this.metrics = metrics;
    }

    /**
     * @return the next speaker, or empty when the roster is empty
     */
    public Optional<AgentSelection> selectNext(ConversationState state) {
        List<RosterEntry> roster = state.agents();
        if (roster.isEmpty()) {
            log.warn("Roster is empty, no speaker to select");
            return Optional.empty();
        }

        List<Message> recent = state.recentMessages(CONTEXT_MESSAGES);
        Map<String, String> recentSpeakers = recentDistinctSpeakers(state.messages());
        String mostRecent = recentSpeakers.isEmpty() ? null : recentSpeakers.keySet().iterator().next();

        AgentSelection selection;
        try {
            String prompt = SupervisorPrompts.selectionPrompt(roster, recent, new ArrayList<>(recentSpeakers.values()));
            selection = llmService.generateStructured(settings.model(), AgentSelection.class,
                    SupervisorPrompts.SELECTION_SYSTEM_PROMPT, prompt, settings.temperature(), settings.maxTokens());
            validate(selection);
        } catch (RuntimeException e) {
            log.warn("Speaker selection failed, falling back to {}: {}", roster.get(0).agentId(), e.getMessage());
            metrics.recordSelection("fallback");
            return Optional.of(new AgentSelection(roster.get(0).agentId(), FALLBACK_REASONING, 1));
        }

        int turns = selection.turnsOrDefault();
        if (mostRecent != null && mostRecent.equals(selection.agentId())) {
            Optional<RosterEntry> alternative = roster.stream()
                    .filter(a -> !a.agentId().equals(mostRecent))
                    .findFirst();
            if (alternative.isPresent()) {
                log.info("Supervisor picked {} again, overriding with {}", mostRecent, alternative.get().agentId());
                metrics.recordSelection("override");
                return Optional.of(new AgentSelection(alternative.get().agentId(), OVERRIDE_REASONING, turns));
            }
        }

        log.info("Supervisor selected {} for {} turn(s): {}", selection.agentId(), turns, selection.reasoning());
        metrics.recordSelection("model");
        return Optional.of(new AgentSelection(selection.agentId(), selection.reasoning(), turns));
    }

    /**
     * Up to {@value #RECENT_SPEAKER_WINDOW} distinct assistant speakers, most recent first,
     * keyed by agent id with the display name as value.
     */
    static Map<String, String> recentDistinctSpeakers(List<Message> messages) {
        Map<String, String> speakers = new LinkedHashMap<>();
        for (int i = messages.size() - 1; i >= 0 && speakers.size() < RECENT_SPEAKER_WINDOW; i--) {
            Message m = messages.get(i);
            if (!m.isAssistant()) {
                continue;
            }
            String key = m.agentId() != null ? m.agentId() : m.speaker();
            if (key != null) {
                speakers.putIfAbsent(key, m.speaker() != null ? m.speaker() : key);
            }
        }
        return speakers;
    }

    private static void validate(AgentSelection selection) {
        if (selection == null || selection.agentId() == null || selection.agentId().isBlank()) {
            throw new IllegalArgumentException("Supervisor returned no agent id");
        }
        if (selection.turnsOrDefault() < 0) {
            throw new IllegalArgumentException("Supervisor returned negative turns: " + selection.turns());
        }
    }
}
