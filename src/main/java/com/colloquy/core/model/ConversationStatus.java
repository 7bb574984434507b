package com.colloquy.core.model;

/**
 * Lifecycle status of a conversation run as seen by the transport layer.
 */
public enum ConversationStatus {
    RUNNING,
    COMPLETED,
    PAUSED,     // Supervisor handed the floor back to the user
    FAILED,
    STOPPED
}
