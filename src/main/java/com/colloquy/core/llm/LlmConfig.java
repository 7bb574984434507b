package com.colloquy.core.llm;

import com.colloquy.core.agent.AgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the provider-keyed chat clients.
 * <p>
 * The default provider uses Spring AI's auto-configured client. Each entry under
 * {@code colloquy.llm.providers} that has a base URL and an API key gets its own client
 * against that provider's OpenAI-compatible endpoint. Startup fails when the supervisor or a
 * configured agent names a provider without a client.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    public ChatClientRegistry chatClientRegistry(ChatClient.Builder builder, LlmProperties properties,
                                                 AgentProperties agentProperties) {
        Map<String, ChatClient> dedicated = new LinkedHashMap<>();
        properties.getProviders().forEach((provider, settings) -> {
            if (!settings.isConfigured()) {
                log.info("Provider {} has no base-url or api-key, skipping", provider);
                return;
            }
            dedicated.put(provider, ChatClient.create(chatModel(settings)));
            log.info("Chat client for provider {} → {}", provider, settings.getBaseUrl());
        });
        var registry = new ChatClientRegistry(properties.getDefaultProvider(), builder.build(), dedicated);

        List<String> missing = new ArrayList<>();
        if (!registry.supports(properties.getSupervisorProvider())) {
            missing.add("supervisor → " + properties.getSupervisorProvider());
        }
        for (AgentProperties.AgentDefinition def : agentProperties.getAgents()) {
            if (!registry.supports(def.getProvider())) {
                missing.add(def.getId() + " → " + def.getProvider());
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No chat client configured for " + String.join(", ", missing)
                    + "; add base-url and api-key under colloquy.llm.providers");
        }

        log.info("Chat clients ready: default {} plus {}; supervisor model {}/{}",
                properties.getDefaultProvider(), registry.dedicatedProviders(),
                properties.getSupervisorProvider(), properties.getSupervisorModel());
        return registry;
    }

    static OpenAiChatModel chatModel(LlmProperties.ProviderSettings settings) {
        OpenAiApi.Builder api = OpenAiApi.builder()
                .baseUrl(settings.getBaseUrl())
                .apiKey(settings.getApiKey());
        if (settings.getCompletionsPath() != null && !settings.getCompletionsPath().isBlank()) {
            api.completionsPath(settings.getCompletionsPath());
        }
        return OpenAiChatModel.builder()
                .openAiApi(api.build())
                .build();
    }
}
