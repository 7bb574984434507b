package com.colloquy.core.llm;

import com.colloquy.core.model.AiConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Wraps Spring AI's {@link ChatClient} behind the two calls the conversation engine needs:
 * free-text generation for agent replies and structured (typed) output for supervisor decisions.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to append a JSON schema to the user prompt
 * and deserialize the reply, falling back to a lenient Jackson parse when the model wraps the
 * JSON in markdown or adds stray fields.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClientRegistry clients;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClientRegistry clients) {
        this.clients = clients;
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
    }

    /**
     * Generates a free-text reply.
     *
     * @param model        provider and model to call
     * @param systemPrompt instructions for the model
     * @param messages     transcript as role/content pairs, oldest first
     * @param temperature  sampling temperature
     * @param maxTokens    reply length ceiling
     * @return the reply text, never null but possibly blank
     */
    public String generateText(AiConfig model, String systemPrompt, List<PromptMessage> messages,
                               double temperature, int maxTokens) {
        log.debug("Text generation → {}/{} ({} messages, t={})",
                model.provider(), model.model(), messages.size(), temperature);
        long start = System.currentTimeMillis();
        String content = clients.clientFor(model.provider()).prompt()
                .system(systemPrompt)
                .messages(toSpringMessages(messages))
                .options(options(model, temperature, maxTokens))
                .call()
                .content();
        log.debug("Text generation complete → {}/{} ({}ms)",
                model.provider(), model.model(), System.currentTimeMillis() - start);
        return content != null ? content : "";
    }

    /**
     * Sends a system + user prompt and returns the response deserialized into {@code outputType}.
     *
     * @throws LlmEmptyResponseException when the model returns nothing
     * @throws LlmParseException         when the response cannot be mapped onto {@code outputType}
     */
    public <T> T generateStructured(AiConfig model, Class<T> outputType, String systemPrompt, String prompt,
                                    double temperature, int maxTokens) {
        log.info("LLM call started → {} via {}/{}", outputType.getSimpleName(), model.provider(), model.model());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = clients.clientFor(model.provider()).prompt()
                .system(systemPrompt)
                .user(prompt + "\n\n" + converter.getFormat())
                .options(options(model, temperature, maxTokens))
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    private <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    private static ChatOptions options(AiConfig model, double temperature, int maxTokens) {
        var builder = ChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens);
        if (model.model() != null && !model.model().isBlank()) {
            builder.model(model.model());
        }
        return builder.build();
    }

    private static List<Message> toSpringMessages(List<PromptMessage> messages) {
        return messages.stream().map(LlmService::toSpringMessage).toList();
    }

    private static Message toSpringMessage(PromptMessage message) {
        return switch (message.role()) {
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> new AssistantMessage(message.content());
            case SYSTEM -> new SystemMessage(message.content());
        };
    }
}
