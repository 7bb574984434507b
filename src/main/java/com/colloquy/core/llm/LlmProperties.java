package com.colloquy.core.llm;

import com.colloquy.core.model.AiConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the supervisor model that picks speakers and decides when to stop, plus the
 * extra providers agents may use.
 */
@Component
@ConfigurationProperties(prefix = "colloquy.llm")
public class LlmProperties {

    /** Provider served by the auto-configured Spring AI client. */
    private String defaultProvider = "openai";

    private String supervisorProvider = "openai";
    private String supervisorModel = "gpt-4o-mini";
    private double supervisorTemperature = 0.3;
    private int supervisorMaxTokens = 4096;

    /** Provider key → OpenAI-compatible endpoint, e.g. groq, ollama, anthropic, google. */
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    public String getDefaultProvider() {
        return defaultProvider;
    }

    public void setDefaultProvider(String defaultProvider) {
        this.defaultProvider = defaultProvider;
    }

    public String getSupervisorProvider() {
        return supervisorProvider;
    }

    public void setSupervisorProvider(String supervisorProvider) {
        this.supervisorProvider = supervisorProvider;
    }

    public String getSupervisorModel() {
        return supervisorModel;
    }

    public void setSupervisorModel(String supervisorModel) {
        this.supervisorModel = supervisorModel;
    }

    public double getSupervisorTemperature() {
        return supervisorTemperature;
    }

    public void setSupervisorTemperature(double supervisorTemperature) {
        this.supervisorTemperature = supervisorTemperature;
    }

    public int getSupervisorMaxTokens() {
        return supervisorMaxTokens;
    }

    public void setSupervisorMaxTokens(int supervisorMaxTokens) {
        this.supervisorMaxTokens = supervisorMaxTokens;
    }

    public AiConfig supervisorConfig() {
        return new AiConfig(supervisorProvider, supervisorModel, null);
    }

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers;
    }

    public static class ProviderSettings {

        private String baseUrl;
        private String apiKey;

        /** Overrides {@code /v1/chat/completions} for endpoints that mount it elsewhere. */
        private String completionsPath;

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCompletionsPath() {
            return completionsPath;
        }

        public void setCompletionsPath(String completionsPath) {
            this.completionsPath = completionsPath;
        }
    }
}
