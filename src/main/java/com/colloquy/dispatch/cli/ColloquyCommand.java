package com.colloquy.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Colloquy.
 * Routes to subcommands: converse, agents, credits, serve.
 */
@Command(
        name = "colloquy",
        mixinStandardHelpOptions = true,
        version = "Colloquy 0.1.0",
        description = "Supervised group chat between AI agents",
        subcommands = {
                ConverseCommand.class,
                AgentsCommand.class,
                CreditsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ColloquyCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
