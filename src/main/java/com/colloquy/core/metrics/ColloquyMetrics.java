package com.colloquy.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for conversation runs.
 */
@Service
public class ColloquyMetrics {

    private final MeterRegistry registry;

    public ColloquyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTurn(String provider, long ms) {
        Timer.builder("colloquy.turn.duration")
                .tag("provider", provider != null ? provider : "unknown")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "model", "override" or "fallback"
     */
    public void recordSelection(String outcome) {
        Counter.builder("colloquy.selection.total")
                .description("Speaker selections by how the speaker was chosen")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordTerminationCheck(boolean terminate) {
        Counter.builder("colloquy.termination.checks")
                .tag("result", terminate ? "stop" : "continue")
                .register(registry)
                .increment();
    }

    public void recordEmptyReply(boolean recovered) {
        Counter.builder("colloquy.generation.empty_replies")
                .description("Blank model replies and whether the retry recovered them")
                .tag("recovered", String.valueOf(recovered))
                .register(registry)
                .increment();
    }

    /**
     * @param outcome terminal event of the run, e.g. "completed", "paused", "failed", "stopped"
     */
    public void recordConversationResult(String outcome) {
        Counter.builder("colloquy.conversations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordTurnsPerConversation(int turns) {
        DistributionSummary.builder("colloquy.conversation.turns")
                .description("Agent turns produced per conversation run")
                .register(registry)
                .record(turns);
    }

    public void recordCreditsCharged(long credits) {
        DistributionSummary.builder("colloquy.credits.charged")
                .baseUnit("credits")
                .register(registry)
                .record(credits);
    }

    public void recordInsufficientCredits() {
        Counter.builder("colloquy.credits.insufficient")
                .description("Debits refused because the balance was too low")
                .register(registry)
                .increment();
    }
}
