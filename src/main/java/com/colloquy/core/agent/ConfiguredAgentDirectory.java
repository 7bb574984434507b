package com.colloquy.core.agent;

import com.colloquy.core.model.Agent;
import com.colloquy.core.model.AiConfig;
import com.colloquy.core.model.ChatStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AgentDirectory} backed by the agents declared in {@link AgentProperties}.
 * <p>
 * Agents with an owner are only visible to that user; agents without one are shared.
 */
@Service
public class ConfiguredAgentDirectory implements AgentDirectory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredAgentDirectory.class);

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public ConfiguredAgentDirectory(AgentProperties properties) {
        for (AgentProperties.AgentDefinition def : properties.getAgents()) {
            if (def.getId() == null || def.getId().isBlank()) {
                throw new IllegalStateException("Configured agent is missing an id: " + def.getName());
            }
            entries.put(def.getId(), new Entry(def.getOwner(), toAgent(def)));
        }
        log.info("Loaded {} configured agent(s)", entries.size());
    }

    @Override
    public Optional<Agent> resolve(String userId, String agentId) {
        Entry entry = entries.get(agentId);
        if (entry == null || !entry.visibleTo(userId)) {
            return Optional.empty();
        }
        return Optional.of(entry.agent());
    }

    @Override
    public List<Agent> listAgents(String userId) {
        return entries.values().stream()
                .filter(e -> e.visibleTo(userId))
                .map(Entry::agent)
                .toList();
    }

    private static Agent toAgent(AgentProperties.AgentDefinition def) {
        String name = def.getName() != null ? def.getName() : def.getId();
        return new Agent(
                def.getId(),
                name,
                def.getPrompt(),
                def.getCharacteristics(),
                new AiConfig(def.getProvider(), def.getModel(), def.getCredentialRef()),
                new ChatStyle(def.getFriendliness(), def.getResponseLength(), def.getPersonality(),
                        def.getHumor(), def.getExpertiseLevel()),
                def.getMaxTokens());
    }

    private record Entry(String owner, Agent agent) {
        boolean visibleTo(String userId) {
            return owner == null || owner.isBlank() || owner.equals(userId);
        }
    }
}
