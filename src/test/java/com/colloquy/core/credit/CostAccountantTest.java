package com.colloquy.core.credit;

import com.colloquy.core.metrics.ColloquyMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CostAccountantTest {

    private InMemoryCreditLedger ledger;
    private CreditProperties properties;
    private SimpleMeterRegistry registry;
    private CostAccountant accountant;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryCreditLedger();
        properties = new CreditProperties();
        registry = new SimpleMeterRegistry();
        accountant = new CostAccountant(new DefaultPricingCatalog(), ledger, properties, new ColloquyMetrics(registry));
    }

    @Nested
    @DisplayName("Pricing")
    class Pricing {

        @Test
        @DisplayName("exact row is used when present")
        void exactRow() {
            ModelPricing pricing = accountant.resolvePricing("openai", "gpt-3.5-turbo");

            assertEquals("gpt-3.5-turbo", pricing.model());
            assertEquals(1, pricing.costPerMessage());
        }

        @Test
        @DisplayName("unknown model falls back to the provider default under the requested name")
        void providerDefault() {
            ModelPricing pricing = accountant.resolvePricing("openai", "gpt-4o-mini");

            assertEquals("gpt-4o-mini", pricing.model());
            assertEquals(10, pricing.costPerMessage());
            assertFalse(pricing.defaultModel());
        }

        @Test
        @DisplayName("unknown provider has no pricing")
        void unknownProvider() {
            assertThrows(PricingNotFoundException.class, () -> accountant.resolvePricing("acme", "x"));
        }

        @Test
        @DisplayName("inactive row is rejected")
        void inactiveRow() {
            var catalog = new DefaultPricingCatalog(List.of(
                    new ModelPricing("openai", "gpt-4", 30, 30.0, false, false)));
            var acc = new CostAccountant(catalog, ledger, properties, new ColloquyMetrics(registry));

            assertThrows(PricingNotFoundException.class, () -> acc.resolvePricing("openai", "gpt-4"));
        }

        @Test
        @DisplayName("messages and started token blocks are both charged")
        void priceOfMessagesAndTokens() {
            // gpt-4: 30 per message, 30 per 1k tokens
            assertEquals(30 + 60, accountant.priceOf("openai", "gpt-4", 1, 1001L));
            assertEquals(30, accountant.priceOf("openai", "gpt-4", null, null));
            assertEquals(30, accountant.priceOf("openai", "gpt-4", null, 1L));
        }

        @Test
        @DisplayName("models without token pricing are charged per message only")
        void perMessageOnly() {
            assertEquals(2, accountant.priceOf("ollama", "llama2", 2, 50_000L));
        }

        @Test
        @DisplayName("resolved rows are cached until the TTL expires")
        void pricingCache() {
            PricingCatalog catalog = mock(PricingCatalog.class);
            when(catalog.find("openai", "gpt-4"))
                    .thenReturn(Optional.of(new ModelPricing("openai", "gpt-4", 30, 30.0, false, true)));
            var clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
            var acc = new CostAccountant(catalog, ledger, properties, new ColloquyMetrics(registry), clock);

            acc.resolvePricing("openai", "gpt-4");
            acc.resolvePricing("OpenAI", "GPT-4");
            verify(catalog, times(1)).find(anyString(), anyString());

            clock.advance(Duration.ofMinutes(6));
            acc.resolvePricing("openai", "gpt-4");
            verify(catalog, times(2)).find(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("Balances")
    class Balances {

        @Test
        @DisplayName("ensureAccount opens the account once with the welcome bonus")
        void welcomeBonus() {
            assertTrue(accountant.ensureAccount("u1"));
            assertFalse(accountant.ensureAccount("u1"));

            assertEquals(Optional.of(10_000L), accountant.balance("u1"));
            List<CreditTransaction> history = accountant.history("u1", 10);
            assertEquals(1, history.size());
            assertEquals(TransactionType.BONUS, history.get(0).type());
        }

        @Test
        @DisplayName("debit refuses to overdraw and records a metric")
        void debitRefused() {
            properties.setWelcomeBonus(5);
            accountant.ensureAccount("u1");

            TransactionResult result = accountant.debit("u1", 6, "reply", Map.of());

            assertEquals(TransactionResult.Outcome.INSUFFICIENT_FUNDS, result.outcome());
            assertEquals(5, result.balance());
            assertEquals(1.0, registry.find("colloquy.credits.insufficient").counter().count());
        }

        @Test
        @DisplayName("debit to exactly zero succeeds")
        void debitToZero() {
            properties.setWelcomeBonus(5);
            accountant.ensureAccount("u1");

            TransactionResult result = accountant.debit("u1", 5, "reply", Map.of("agentId", "alice"));

            assertTrue(result.succeeded());
            assertEquals(0, result.balance());
            assertEquals(-5, result.transaction().amount());
            assertEquals("alice", result.transaction().metadata().get("agentId"));
            assertFalse(accountant.hasCredits("u1", 1));
        }

        @Test
        @DisplayName("debit against a missing account reports ACCOUNT_NOT_FOUND")
        void debitMissingAccount() {
            assertEquals(TransactionResult.Outcome.ACCOUNT_NOT_FOUND,
                    accountant.debit("ghost", 1, "reply", Map.of()).outcome());
        }

        @Test
        @DisplayName("negative debits and non-positive or usage credits are rejected")
        void invalidAmounts() {
            accountant.ensureAccount("u1");

            assertThrows(IllegalArgumentException.class, () -> accountant.debit("u1", -1, "x", Map.of()));
            assertThrows(IllegalArgumentException.class,
                    () -> accountant.credit("u1", 0, TransactionType.PURCHASE, "x"));
            assertThrows(IllegalArgumentException.class,
                    () -> accountant.credit("u1", 10, TransactionType.USAGE, "x"));
        }

        @Test
        @DisplayName("statistics sum usage and additions")
        void statistics() {
            properties.setWelcomeBonus(100);
            accountant.ensureAccount("u1");
            accountant.debit("u1", 30, "reply", Map.of());
            accountant.credit("u1", 50, TransactionType.PURCHASE, "top-up");

            CreditStatistics stats = accountant.statistics("u1").orElseThrow();

            assertEquals(120, stats.balance());
            assertEquals(30, stats.totalUsed());
            assertEquals(150, stats.totalAdded());
            assertEquals(3, stats.transactionCount());
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
