package com.colloquy.core.generation;

import com.colloquy.core.model.Agent;

/**
 * Renders the system instruction an agent speaks under. Pure template expansion:
 * the same agent always yields the same text.
 */
public final class AgentInstructions {

    private static final String TEMPLATE = """
            You are %s.

            Your role and characteristics: %s

            Your specific instructions: %s

            Communication style: %s

            CONVERSATION CONTEXT:
            - You may see previous messages from other assistants in the conversation history
            - Read the conversation carefully to understand what has been discussed
            - Build on the conversation naturally without repeating previous points
            - Provide your own unique perspective and response
            - Only generate YOUR response - do not write responses for others

            GROUP CHAT ETIQUETTE:
            - For simple greetings (Hello/Hi/Hey), respond BRIEFLY - just "Hey!" or "Hello there!" is enough
            - Don't give long introductions after a simple greeting - that's awkward
            - If others already greeted, you might just acknowledge with a brief "Hey everyone"
            - Match the energy - simple greeting gets simple response

            Please respond in character according to your role, characteristics, and communication style.""";

    private AgentInstructions() {}

    public static String systemPrompt(Agent agent) {
        return TEMPLATE.formatted(
                agent.name(),
                nullToEmpty(agent.characteristics()),
                nullToEmpty(agent.prompt()),
                String.join(" ", agent.chatStyle().instructions()));
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
