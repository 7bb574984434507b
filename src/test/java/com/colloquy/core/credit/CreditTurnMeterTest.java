package com.colloquy.core.credit;

import com.colloquy.core.engine.TurnCharge;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.Agent;
import com.colloquy.core.model.AiConfig;
import com.colloquy.core.model.Message;
import com.colloquy.core.state.ConversationState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreditTurnMeterTest {

    private CreditProperties properties;
    private CostAccountant accountant;
    private CreditTurnMeter meter;

    @BeforeEach
    void setUp() {
        properties = new CreditProperties();
        accountant = new CostAccountant(new DefaultPricingCatalog(), new InMemoryCreditLedger(), properties,
                new ColloquyMetrics(new SimpleMeterRegistry()));
        meter = new CreditTurnMeter(accountant, TokenEstimator.charactersPerToken(),
                InputLengthEstimator.fixed(100), properties);
    }

    private static Agent agent(String provider, String model) {
        return new Agent("alice", "Alice", "", "", new AiConfig(provider, model, null), null, null);
    }

    private static ConversationState state(String userId) {
        return new ConversationState("conv-1", userId, List.of(Message.user("Hi")), List.of(), 5);
    }

    @Test
    @DisplayName("unmetered run is not charged")
    void noUser() {
        assertTrue(meter.charge(state(null), agent("openai", "gpt-4"), "Hello").isEmpty());
    }

    @Test
    @DisplayName("charges one message plus estimated tokens and records metadata")
    void chargesMessageAndTokens() {
        accountant.ensureAccount("u1");

        // 100 input chars -> 25 tokens, 8 reply chars -> 2 tokens; one started block at 30 per 1k
        TurnCharge charge = meter.charge(state("u1"), agent("openai", "gpt-4"), "Hi there").orElseThrow();

        assertEquals(60, charge.credits());
        assertEquals(10_000 - 60, charge.remainingCredits());
        var tx = accountant.history("u1", 1).get(0);
        assertEquals("Multi-agent message from Alice", tx.reason());
        assertEquals("conv-1", tx.metadata().get("conversationId"));
        assertEquals("openai/gpt-4", tx.metadata().get("model"));
    }

    @Test
    @DisplayName("unpriced model is charged the fallback cost")
    void fallbackCost() {
        accountant.ensureAccount("u1");

        TurnCharge charge = meter.charge(state("u1"), agent("acme", "mystery"), "Hi").orElseThrow();

        assertEquals(properties.getFallbackCost(), charge.credits());
    }

    @Test
    @DisplayName("insufficient balance throws with the required and available amounts")
    void insufficient() {
        properties.setWelcomeBonus(10);
        accountant.ensureAccount("u1");

        var ex = assertThrows(InsufficientCreditsException.class,
                () -> meter.charge(state("u1"), agent("openai", "gpt-4"), "Hi"));

        assertEquals(60, ex.getRequired());
        assertEquals(10, ex.getAvailable());
        assertEquals(10L, accountant.balance("u1").orElseThrow());
    }
}
