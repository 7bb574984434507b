package com.colloquy.dispatch.cli;

import com.colloquy.core.agent.AgentNotFoundException;
import com.colloquy.core.credit.InsufficientCreditsException;
import com.colloquy.core.events.EventBus;
import com.colloquy.core.model.ConversationStatus;
import com.colloquy.core.stream.ConversationHandle;
import com.colloquy.core.stream.ConversationLaunch;
import com.colloquy.core.stream.ConversationNotFoundException;
import com.colloquy.core.stream.ConversationStreamService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: colloquy converse -a &lt;agent&gt; [-a &lt;agent&gt;...] "&lt;message&gt;"
 * <p>
 * Runs one conversation on the calling thread and prints its events as they arrive.
 * Exit codes follow {@link ExitCodes}.
 */
@Command(name = "converse", mixinStandardHelpOptions = true, description = "Start or continue a group conversation")
@Component
public class ConverseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Message to open the conversation with")
    private String message;

    @Option(names = {"--agent", "-a"}, required = true, description = "Participating agent id (repeatable)")
    private List<String> agentIds;

    @Option(names = {"--user", "-u"}, description = "User to charge for the conversation")
    private String userId;

    @Option(names = {"--max-turns", "-n"}, description = "Maximum number of agent replies")
    private Integer maxTurns;

    @Option(names = {"--conversation", "-c"}, description = "Continue a stored conversation")
    private String conversationId;

    private final ConversationStreamService conversationService;
    private final EventBus eventBus;

    public ConverseCommand(ConversationStreamService conversationService, EventBus eventBus) {
        this.conversationService = conversationService;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var launch = new ConversationLaunch(userId, message, agentIds, maxTurns);
        ConversationHandle handle;
        try {
            handle = conversationId != null
                    ? conversationService.resume(conversationId, launch)
                    : conversationService.open(launch);
        } catch (IllegalArgumentException | IllegalStateException | AgentNotFoundException
                 | ConversationNotFoundException | InsufficientCreditsException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.forException(e);
        }

        ConsoleOutput.info("Conversation " + handle.conversationId());
        System.out.println();
        var subscription = eventBus.subscribe(handle.conversationId(), ConsoleOutput::event);
        ConversationStatus status;
        try {
            status = conversationService.run(handle);
        } finally {
            subscription.unsubscribe();
        }
        return ExitCodes.forStatus(status);
    }
}
