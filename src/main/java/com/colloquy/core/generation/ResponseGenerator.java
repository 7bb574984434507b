package com.colloquy.core.generation;

import com.colloquy.core.llm.LlmService;
import com.colloquy.core.llm.PromptMessage;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.Agent;
import com.colloquy.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces one agent's reply to the transcript so far.
 * <p>
 * A blank reply is retried once at a slightly higher temperature with a steering message
 * appended. Google-hosted models get the nudge as a user turn, every other provider as a
 * system turn. If the retry is blank too, a filler greeting is returned so the turn is never
 * empty. Exceptions from the model call are not retried.
 */
@Service
public class ResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(ResponseGenerator.class);

    static final double PRIMARY_TEMPERATURE = 0.7;
    static final double RETRY_TEMPERATURE = 0.8;
    static final int DEFAULT_MAX_TOKENS = 1000;
    static final String FALLBACK_REPLY = "Hey there!";
    static final String USER_NUDGE = "Please continue the conversation with a substantive response.";
    static final String SYSTEM_NUDGE = "Please provide a substantive response to continue the conversation.";

    private final LlmService llmService;
    private final ColloquyMetrics metrics;

    public ResponseGenerator(LlmService llmService, ColloquyMetrics metrics) {
        this.llmService = llmService;
        this.metrics = metrics;
    }

    /**
     * @throws GenerationFailureException when the model call itself fails
     */
    public String generate(Agent agent, List<Message> transcript) {
        String systemPrompt = AgentInstructions.systemPrompt(agent);
        List<PromptMessage> messages = toPromptMessages(transcript);
        int maxTokens = agent.maxTokens() != null ? agent.maxTokens() : DEFAULT_MAX_TOKENS;

        String reply = call(agent, systemPrompt, messages, PRIMARY_TEMPERATURE, maxTokens);
        if (!reply.isBlank()) {
            return reply;
        }

        log.warn("Empty reply from {} ({}/{}), retrying once", agent.name(),
                agent.aiConfig().provider(), agent.aiConfig().model());
        List<PromptMessage> nudged = new ArrayList<>(messages);
        nudged.add(agent.aiConfig().isGoogleFamily()
                ? PromptMessage.user(USER_NUDGE)
                : PromptMessage.system(SYSTEM_NUDGE));
        String retry = call(agent, systemPrompt, nudged, RETRY_TEMPERATURE, maxTokens);
        metrics.recordEmptyReply(!retry.isBlank());
        if (!retry.isBlank()) {
            return retry;
        }

        log.warn("Retry for {} was empty as well, using fallback reply", agent.name());
        return FALLBACK_REPLY;
    }

    private String call(Agent agent, String systemPrompt, List<PromptMessage> messages,
                        double temperature, int maxTokens) {
        try {
            String text = llmService.generateText(agent.aiConfig(), systemPrompt, messages, temperature, maxTokens);
            return text != null ? text.trim() : "";
        } catch (RuntimeException e) {
            throw new GenerationFailureException(agent.agentId(), e);
        }
    }

    private static List<PromptMessage> toPromptMessages(List<Message> transcript) {
        return transcript.stream()
                .map(m -> new PromptMessage(m.role(), m.content()))
                .toList();
    }
}
