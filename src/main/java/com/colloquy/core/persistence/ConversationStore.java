package com.colloquy.core.persistence;

import com.colloquy.core.model.Message;

import java.util.List;

/**
 * Durable, append-only transcripts keyed by conversation id.
 */
public interface ConversationStore {

    void append(String conversationId, Message message);

    /** The stored transcript, oldest first; empty for an unknown conversation. */
    List<Message> load(String conversationId);

    boolean exists(String conversationId);
}
