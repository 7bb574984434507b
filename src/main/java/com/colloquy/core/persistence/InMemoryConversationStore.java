package com.colloquy.core.persistence;

import com.colloquy.core.model.Message;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ConversationStore} held in memory; transcripts are lost on restart.
 */
public class InMemoryConversationStore implements ConversationStore {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Message>> transcripts = new ConcurrentHashMap<>();

    @Override
    public void append(String conversationId, Message message) {
        transcripts.computeIfAbsent(conversationId, k -> new CopyOnWriteArrayList<>()).add(message);
    }

    @Override
    public List<Message> load(String conversationId) {
        List<Message> messages = transcripts.get(conversationId);
        return messages != null ? List.copyOf(messages) : List.of();
    }

    @Override
    public boolean exists(String conversationId) {
        return transcripts.containsKey(conversationId);
    }
}
