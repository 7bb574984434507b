package com.colloquy.core.model;

import java.io.Serializable;

/**
 * One element of the lazy event sequence produced by a conversation run.
 * <p>
 * {@code agentId}, {@code agentName}, {@code creditsUsed} and {@code remainingCredits}
 * are only populated for the event types that carry them.
 *
 * @param type             event tag
 * @param message          status text, reply content or error text
 * @param agentId          speaking agent for {@code agent_response}
 * @param agentName        speaking agent's display name for {@code agent_response}
 * @param creditsUsed      credits charged for the reply, for {@code credit_update}
 * @param remainingCredits balance after the charge, for {@code credit_update}
 * @param timestamp        epoch milliseconds
 */
public record WorkflowEvent(
    WorkflowEventType type,
    String message,
    String agentId,
    String agentName,
    Long creditsUsed,
    Long remainingCredits,
    long timestamp
) implements Serializable {

    public static WorkflowEvent status(String message) {
        return new WorkflowEvent(WorkflowEventType.STATUS, message, null, null, null, null, System.currentTimeMillis());
    }

    public static WorkflowEvent agentResponse(Message message) {
        return new WorkflowEvent(WorkflowEventType.AGENT_RESPONSE, message.content(),
                message.agentId(), message.speaker(), null, null, message.timestamp());
    }

    public static WorkflowEvent creditUpdate(String agentId, long creditsUsed, long remainingCredits) {
        return new WorkflowEvent(WorkflowEventType.CREDIT_UPDATE, null, agentId, null,
                creditsUsed, remainingCredits, System.currentTimeMillis());
    }

    public static WorkflowEvent complete(String message) {
        return new WorkflowEvent(WorkflowEventType.CONVERSATION_COMPLETE, message, null, null, null, null, System.currentTimeMillis());
    }

    public static WorkflowEvent paused(String message) {
        return new WorkflowEvent(WorkflowEventType.CONVERSATION_PAUSED, message, null, null, null, null, System.currentTimeMillis());
    }

    public static WorkflowEvent error(String message) {
        return new WorkflowEvent(WorkflowEventType.ERROR, message, null, null, null, null, System.currentTimeMillis());
    }
}
