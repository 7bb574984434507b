package com.colloquy.core.supervisor;

import com.colloquy.core.model.Message;
import com.colloquy.core.model.RosterEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt text for the supervisor model.
 */
final class SupervisorPrompts {

    static final String SELECTION_SYSTEM_PROMPT = """
            You are a conversation supervisor for a natural group chat. Your role is to decide who speaks next OR if the conversation should pause.

            IMPORTANT GROUP CHAT DYNAMICS:
            - After a simple greeting (Hello, Hi, Hey), usually 1-2 people respond with brief greetings, then conversation naturally pauses
            - Not everyone needs to greet back - that would be unnatural
            - If someone just said hello and 1-2 agents already greeted back, the conversation should pause
            - Long introductions after "Hello" are awkward - keep it brief and natural
            - Sometimes NO ONE should respond (natural silence is normal)
            - If the user addresses an agent by name, that agent should answer

            Set "turns" to the number of consecutive replies the chosen agent should give (usually 1).
            Set "turns" to 0 when nobody should speak and the conversation should wait for the user.

            For simple greetings: Maximum 2 agents should respond, then let it pause naturally.""";

    static final String TERMINATION_SYSTEM_PROMPT = """
            You are a conversation supervisor analyzing whether a group chat should naturally pause.

            CRITICAL RULES FOR GREETINGS:
            - If user said "Hello/Hi/Hey" and 1-2 agents already responded with greetings, TERMINATE
            - Simple greetings don't need everyone to respond - that's unnatural
            - After brief greeting exchanges, conversations naturally pause until someone brings up a topic

            Consider:
            - Is this just a greeting exchange? If yes, and 2 agents responded, TERMINATE
            - Are agents starting to repeat greetings? TERMINATE
            - Is the conversation forced with no real topic? TERMINATE
            - Natural pauses are GOOD - don't force conversation

            Be aggressive about ending greeting-only conversations. Real group chats pause after "Hello" exchanges.""";

    private static final String SELECTION_PROMPT = """
            Available agents:
            %s

            Recent conversation:
            %s

            Based on the conversation context and each agent's expertise, which agent should respond next?
            Consider:
            1. Which agent's expertise is most relevant to the current topic
            2. Which agent hasn't spoken recently (for variety)
            3. Which agent would provide the most valuable response
            4. The selected agent should BUILD ON the current message, not repeat similar content
            %s""";

    private static final String VARIETY_RULE = """

            CRITICAL: The last message was from %s. You MUST select a DIFFERENT agent to avoid repetition.
            Agents who spoke recently: %s. Prefer someone who has not spoken recently.""";

    private static final String TERMINATION_PROMPT = """
            Recent conversation:
            %s

            Has this conversation reached a natural conclusion? Consider:
            1. Have the main topics been thoroughly discussed?
            2. Are agents starting to repeat themselves?
            3. Has the user's question/request been adequately addressed?
            4. Are there clear ending signals in the recent messages?""";

    private SupervisorPrompts() {}

    static String selectionPrompt(List<RosterEntry> roster, List<Message> recent, List<String> recentSpeakerNames) {
        String varietyRule = recentSpeakerNames.isEmpty()
                ? ""
                : VARIETY_RULE.formatted(recentSpeakerNames.get(0), String.join(", ", recentSpeakerNames));
        return SELECTION_PROMPT.formatted(renderRoster(roster), renderTranscript(recent), varietyRule);
    }

    static String terminationPrompt(List<Message> recent) {
        return TERMINATION_PROMPT.formatted(renderTranscript(recent));
    }

    static String renderRoster(List<RosterEntry> roster) {
        return roster.stream()
                .map(a -> "- " + a.agentId() + ": " + a.name() + " - " + nullToEmpty(a.characteristics()))
                .collect(Collectors.joining("\n"));
    }

    static String renderTranscript(List<Message> messages) {
        return messages.stream()
                .map(m -> (m.speaker() != null ? m.speaker() : "User") + ": " + m.content())
                .collect(Collectors.joining("\n"));
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
