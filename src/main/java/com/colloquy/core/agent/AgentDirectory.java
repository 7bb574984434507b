package com.colloquy.core.agent;

import com.colloquy.core.model.Agent;

import java.util.List;
import java.util.Optional;

/**
 * Resolves durable agent ids to {@link Agent} values for a user.
 */
public interface AgentDirectory {

    /**
     * @param userId  owner of the agent, may be null for unauthenticated callers
     * @param agentId durable agent id
     * @return the agent, or empty when it does not exist or is not visible to the user
     */
    Optional<Agent> resolve(String userId, String agentId);

    List<Agent> listAgents(String userId);

    /**
     * Resolves every id in order, failing on the first unknown one.
     *
     * @throws AgentNotFoundException for an id that cannot be resolved
     */
    default List<Agent> resolveAll(String userId, List<String> agentIds) {
        return agentIds.stream()
                .map(id -> resolve(userId, id).orElseThrow(() -> new AgentNotFoundException(id)))
                .toList();
    }
}
