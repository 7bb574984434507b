package com.colloquy.core.agent;

import com.colloquy.core.model.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory agent lookup for one conversation run.
 * <p>
 * A fresh registry is created for every run and handed to it explicitly, so two runs
 * that share an agent id never evict each other's registration.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> order = new ConcurrentLinkedDeque<>();

    public void register(Agent agent) {
        if (agents.put(agent.agentId(), agent) == null) {
            order.addLast(agent.agentId());
        }
        log.debug("Registered agent {} ({})", agent.agentId(), agent.name());
    }

    public void unregister(String agentId) {
        if (agents.remove(agentId) != null) {
            order.remove(agentId);
            log.debug("Unregistered agent {}", agentId);
        }
    }

    /**
     * @throws AgentNotFoundException when no agent is registered under {@code agentId}
     */
    public Agent get(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new AgentNotFoundException(agentId);
        }
        return agent;
    }

    public boolean contains(String agentId) {
        return agents.containsKey(agentId);
    }

    /** Registered agents in registration order. */
    public List<Agent> list() {
        return order.stream()
                .map(agents::get)
                .filter(a -> a != null)
                .toList();
    }

    public int size() {
        return agents.size();
    }
}
