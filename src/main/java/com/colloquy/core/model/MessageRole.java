package com.colloquy.core.model;

/**
 * Author role of a transcript message.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
