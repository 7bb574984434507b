package com.colloquy.core.chat;

import com.colloquy.core.agent.AgentDirectory;
import com.colloquy.core.agent.AgentNotFoundException;
import com.colloquy.core.credit.CostAccountant;
import com.colloquy.core.credit.InsufficientCreditsException;
import com.colloquy.core.engine.TurnCharge;
import com.colloquy.core.engine.TurnMeter;
import com.colloquy.core.generation.ResponseGenerator;
import com.colloquy.core.logging.MdcContext;
import com.colloquy.core.model.Agent;
import com.colloquy.core.model.Message;
import com.colloquy.core.persistence.ConversationStore;
import com.colloquy.core.state.ConversationState;
import com.colloquy.core.stream.ConversationStreamService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One-to-one chat with a single agent, outside the supervised group flow.
 * <p>
 * The user message is stored before the model is called. The reply is charged the same
 * way a group turn is and only joins the transcript once it has been paid for.
 */
@Service
public class AgentChatService {

    private static final Logger log = LoggerFactory.getLogger(AgentChatService.class);

    private final AgentDirectory agentDirectory;
    private final ResponseGenerator responseGenerator;
    private final TurnMeter turnMeter;
    private final ConversationStore store;
    private final CostAccountant accountant;
    private final ConversationStreamService conversations;

    public AgentChatService(AgentDirectory agentDirectory, ResponseGenerator responseGenerator, TurnMeter turnMeter,
                            ConversationStore store, CostAccountant accountant,
                            ConversationStreamService conversations) {
        this.agentDirectory = agentDirectory;
        this.responseGenerator = responseGenerator;
        this.turnMeter = turnMeter;
        this.store = store;
        this.accountant = accountant;
        this.conversations = conversations;
    }

    /**
     * @param conversationId transcript to continue, null to start a new one
     * @throws IllegalArgumentException     for a blank message or agent id
     * @throws AgentNotFoundException       when the agent is not visible to the user
     * @throws InsufficientCreditsException when the user has no credits left or cannot pay for the reply
     * @throws IllegalStateException        when a group run is in progress on the same conversation
     */
    public AgentReply chat(String userId, String agentId, String message, String conversationId) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id is required");
        }
        String owner = userId != null && !userId.isBlank() ? userId : null;
        String id = conversationId != null && !conversationId.isBlank() ? conversationId : UUID.randomUUID().toString();
        if (conversations.find(id).isPresent()) {
            throw new IllegalStateException("Conversation " + id + " is already running");
        }

        if (owner != null) {
            accountant.ensureAccount(owner);
            long balance = accountant.balance(owner).orElse(0L);
            if (balance <= 0) {
                throw new InsufficientCreditsException(1, balance);
            }
        }
        Agent agent = agentDirectory.resolve(owner, agentId).orElseThrow(() -> new AgentNotFoundException(agentId));

        MdcContext.setTurn(id, agent.agentId(), 1);
        try {
            Message question = Message.user(message.trim());
            store.append(id, question);
            List<Message> transcript = store.load(id);

            String content = responseGenerator.generate(agent, transcript);
            var state = new ConversationState(id, owner, transcript, List.of(agent.toRosterEntry()), 1);
            Optional<TurnCharge> charge = turnMeter.charge(state, agent, content);

            Message reply = Message.assistant(agent, content);
            store.append(id, reply);
            log.info("{} answered in conversation {} ({} chars)", agent.name(), id, content.length());
            return new AgentReply(id, agent.agentId(), agent.name(), content,
                    charge.map(TurnCharge::credits).orElse(0L),
                    charge.map(TurnCharge::remainingCredits).orElse(null),
                    reply.timestamp());
        } finally {
            MdcContext.clear();
        }
    }
}
