package com.colloquy.dispatch.cli;

import com.colloquy.core.agent.AgentNotFoundException;
import com.colloquy.core.credit.InsufficientCreditsException;
import com.colloquy.core.model.ConversationStatus;
import com.colloquy.core.stream.ConversationNotFoundException;
import picocli.CommandLine;

/**
 * Process exit codes of the CLI.
 * <p>
 * A conversation that completed or was paused by the supervisor exits with 0. A stopped one
 * exits with 130, the shell convention for an interrupted command.
 */
final class ExitCodes {

    static final int OK = CommandLine.ExitCode.OK;
    static final int FAILED = CommandLine.ExitCode.SOFTWARE;
    static final int REJECTED = CommandLine.ExitCode.USAGE;
    static final int NO_CREDITS = 3;
    static final int STOPPED = 130;

    private ExitCodes() {}

    static int forStatus(ConversationStatus status) {
        return switch (status) {
            case COMPLETED, PAUSED -> OK;
            case STOPPED -> STOPPED;
            case FAILED, RUNNING -> FAILED;
        };
    }

    /** Used for rejected requests and as picocli's mapper for exceptions escaping a command. */
    static int forException(Throwable e) {
        if (e instanceof InsufficientCreditsException) {
            return NO_CREDITS;
        }
        if (e instanceof IllegalArgumentException || e instanceof AgentNotFoundException
                || e instanceof ConversationNotFoundException) {
            return REJECTED;
        }
        return FAILED;
    }
}
