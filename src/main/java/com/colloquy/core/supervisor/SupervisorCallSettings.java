package com.colloquy.core.supervisor;

import com.colloquy.core.llm.LlmProperties;
import com.colloquy.core.model.AiConfig;

/**
 * Model, temperature and token ceiling used for every supervisor call.
 */
record SupervisorCallSettings(AiConfig model, double temperature, int maxTokens) {

    static SupervisorCallSettings from(LlmProperties properties) {
        return new SupervisorCallSettings(properties.supervisorConfig(),
                properties.getSupervisorTemperature(), properties.getSupervisorMaxTokens());
    }
}
