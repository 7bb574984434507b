package com.colloquy.core.model;

import java.io.Serializable;

/**
 * A configured persona taking part in a conversation. Immutable for the life of a run.
 *
 * @param agentId         stable identifier
 * @param name            display name
 * @param prompt          role instructions
 * @param characteristics free-text description the supervisor uses when picking speakers
 * @param aiConfig        model reference
 * @param chatStyle       style knobs
 * @param maxTokens       reply length ceiling, null for the default
 */
public record Agent(
    String agentId,
    String name,
    String prompt,
    String characteristics,
    AiConfig aiConfig,
    ChatStyle chatStyle,
    Integer maxTokens
) implements Serializable {

    public Agent {
        chatStyle = chatStyle != null ? chatStyle : ChatStyle.defaults();
    }

    public RosterEntry toRosterEntry() {
        return new RosterEntry(agentId, name, characteristics);
    }
}
