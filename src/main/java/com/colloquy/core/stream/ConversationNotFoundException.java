package com.colloquy.core.stream;

public class ConversationNotFoundException extends RuntimeException {

    public ConversationNotFoundException(String conversationId) {
        super("Conversation " + conversationId + " not found");
    }
}
