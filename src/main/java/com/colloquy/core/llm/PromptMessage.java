package com.colloquy.core.llm;

import com.colloquy.core.model.MessageRole;

/**
 * Provider-neutral role/content pair sent to a model.
 */
public record PromptMessage(MessageRole role, String content) {

    public static PromptMessage user(String content) {
        return new PromptMessage(MessageRole.USER, content);
    }

    public static PromptMessage assistant(String content) {
        return new PromptMessage(MessageRole.ASSISTANT, content);
    }

    public static PromptMessage system(String content) {
        return new PromptMessage(MessageRole.SYSTEM, content);
    }
}
