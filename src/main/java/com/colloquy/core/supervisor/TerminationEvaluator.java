package com.colloquy.core.supervisor;

import com.colloquy.core.llm.LlmProperties;
import com.colloquy.core.llm.LlmService;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.TerminationDecision;
import com.colloquy.core.state.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Asks the supervisor model whether the group conversation has run its course.
 * Errors bias toward continuing.
 */
@Service
public class TerminationEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TerminationEvaluator.class);

    static final int MIN_MESSAGES = 3;
    static final int CONTEXT_MESSAGES = 5;
    static final String ERROR_REASON = "continuing due to parsing error";
    static final String TOO_SHORT_REASON = "conversation too short to evaluate";

    private final LlmService llmService;
    private final SupervisorCallSettings settings;
    private final ColloquyMetrics metrics;

    public TerminationEvaluator(LlmService llmService, LlmProperties llmProperties, ColloquyMetrics metrics) {
        this.llmService = llmService;
        this.settings = SupervisorCallSettings.from(llmProperties);
        this.metrics = metrics;
    }

    public TerminationDecision shouldStop(ConversationState state) {
        if (state.messages().size() < MIN_MESSAGES) {
            return new TerminationDecision(false, TOO_SHORT_REASON);
        }

        TerminationDecision decision;
        try {
            String prompt = SupervisorPrompts.terminationPrompt(state.recentMessages(CONTEXT_MESSAGES));
            decision = llmService.generateStructured(settings.model(), TerminationDecision.class,
                    SupervisorPrompts.TERMINATION_SYSTEM_PROMPT, prompt, settings.temperature(), settings.maxTokens());
        } catch (RuntimeException e) {
            log.warn("Termination check failed, continuing: {}", e.getMessage());
            return new TerminationDecision(false, ERROR_REASON);
        }
        if (decision == null) {
            return new TerminationDecision(false, ERROR_REASON);
        }

        log.info("Termination check: {} ({})", decision.shouldTerminate() ? "stop" : "continue", decision.reason());
        metrics.recordTerminationCheck(decision.shouldTerminate());
        return decision;
    }
}
