package com.colloquy.dispatch.cli;

import com.colloquy.core.agent.AgentDirectory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: colloquy agents
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List the agents available to a user")
@Component
public class AgentsCommand implements Runnable {

    @Option(names = {"--user", "-u"}, description = "Only agents visible to this user")
    private String userId;

    private final AgentDirectory agentDirectory;

    public AgentsCommand(AgentDirectory agentDirectory) {
        this.agentDirectory = agentDirectory;
    }

    @Override
    public void run() {
        var agents = agentDirectory.listAgents(userId);
        if (agents.isEmpty()) {
            ConsoleOutput.info("No agents configured.");
            return;
        }
        for (var agent : agents) {
            System.out.printf("  %-16s %-20s %s/%s%n", agent.agentId(), agent.name(),
                    agent.aiConfig().provider(), agent.aiConfig().model());
        }
    }
}
