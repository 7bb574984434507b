package com.colloquy.dispatch.cli;

import com.colloquy.core.events.StreamEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Colloquy CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) COLLOQUY v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [COLLOQUY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String name, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) " + name + ":|@ ") + message);
        System.out.println();
    }

    public static void credits(Object used, Object remaining) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|faint credits used " + used + ", remaining " + remaining + "|@"));
    }

    /**
     * Prints one stream event. Content is printed outside the markup so braces or pipes in a
     * reply are shown literally.
     */
    public static void event(StreamEvent event) {
        var data = event.data();
        switch (event.type()) {
            case "status" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|faint ... |@") + data.get("message"));
            case "agent_response" -> agent(String.valueOf(data.get("agentName")), String.valueOf(data.get("content")));
            case "credit_update" -> credits(data.get("creditsUsed"), data.get("remainingCredits"));
            case "conversation_complete" -> success(data.get("message") + " (" + data.get("totalCreditsUsed") + " credits)");
            case "conversation_paused" -> info(data.get("message") + " (" + data.get("totalCreditsUsed") + " credits)");
            case "error" -> error(String.valueOf(data.get("error")));
            default -> System.out.println("[" + event.type() + "] " + data);
        }
    }
}
