package com.colloquy.core.model;

/**
 * Tags of the events produced by a conversation run.
 */
public enum WorkflowEventType {
    STATUS("status"),
    AGENT_RESPONSE("agent_response"),
    CREDIT_UPDATE("credit_update"),
    CONVERSATION_COMPLETE("conversation_complete"),
    CONVERSATION_PAUSED("conversation_paused"),
    ERROR("error");

    private final String wireName;

    WorkflowEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == CONVERSATION_COMPLETE || this == CONVERSATION_PAUSED || this == ERROR;
    }
}
