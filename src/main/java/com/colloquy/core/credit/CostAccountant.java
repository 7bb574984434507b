package com.colloquy.core.credit;

import com.colloquy.core.metrics.ColloquyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prices model usage and moves credits in and out of user balances.
 * <p>
 * Pricing falls back from the exact provider/model row to the provider's default row,
 * presented under the requested model name. Resolved rows are cached for a configurable time.
 */
@Service
public class CostAccountant {

    private static final Logger log = LoggerFactory.getLogger(CostAccountant.class);

    private final PricingCatalog catalog;
    private final CreditLedger ledger;
    private final CreditProperties properties;
    private final ColloquyMetrics metrics;
    private final Clock clock;
    private final ConcurrentHashMap<String, CachedPricing> pricingCache = new ConcurrentHashMap<>();

    @Autowired
    public CostAccountant(PricingCatalog catalog, CreditLedger ledger, CreditProperties properties,
                          ColloquyMetrics metrics) {
        this(catalog, ledger, properties, metrics, Clock.systemUTC());
    }

    CostAccountant(PricingCatalog catalog, CreditLedger ledger, CreditProperties properties,
                   ColloquyMetrics metrics, Clock clock) {
        this.catalog = catalog;
        this.ledger = ledger;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws PricingNotFoundException when neither an exact nor an active default row exists,
     *                                  or the matching row is inactive
     */
    public ModelPricing resolvePricing(String provider, String model) {
        String key = provider.toLowerCase() + "/" + model.toLowerCase();
        Instant now = clock.instant();
        CachedPricing cached = pricingCache.get(key);
        if (cached != null && cached.expiresAt().isAfter(now)) {
            return cached.pricing();
        }

        ModelPricing pricing = catalog.find(provider, model)
                .or(() -> catalog.findDefault(provider).map(p -> p.relabel(model)))
                .orElseThrow(() -> new PricingNotFoundException(provider, model));
        if (!pricing.active()) {
            throw new PricingNotFoundException(provider, model);
        }
        pricingCache.put(key, new CachedPricing(pricing, now.plus(cacheTtl())));
        return pricing;
    }

    /**
     * Credits charged for the given volume. With neither count supplied, one message is charged.
     * Token usage is billed per started block of 1000 tokens.
     */
    public long priceOf(String provider, String model, Integer messageCount, Long tokenCount) {
        ModelPricing pricing = resolvePricing(provider, model);
        double messageCost;
        if (messageCount == null && tokenCount == null) {
            messageCost = pricing.costPerMessage();
        } else {
            messageCost = messageCount != null ? messageCount * pricing.costPerMessage() : 0;
        }
        double tokenCost = 0;
        if (tokenCount != null && pricing.costPer1kTokens() != null) {
            tokenCost = Math.ceil(tokenCount / 1000.0) * pricing.costPer1kTokens();
        }
        return (long) Math.ceil(messageCost + tokenCost);
    }

    /**
     * Takes {@code amount} credits from the user. A debit that would leave a negative
     * balance is refused with {@code INSUFFICIENT_FUNDS}.
     */
    public TransactionResult debit(String userId, long amount, String reason, Map<String, String> metadata) {
        if (amount < 0) {
            throw new IllegalArgumentException("Debit amount must not be negative: " + amount);
        }
        TransactionResult result = ledger.apply(userId, -amount, TransactionType.USAGE, reason, metadata);
        if (result.succeeded()) {
            metrics.recordCreditsCharged(amount);
            log.debug("Debited {} credits from {}, balance {}", amount, userId, result.balance());
        } else if (result.outcome() == TransactionResult.Outcome.INSUFFICIENT_FUNDS) {
            metrics.recordInsufficientCredits();
            log.info("Debit of {} refused for {}: {}", amount, userId, result.message());
        }
        return result;
    }

    public TransactionResult credit(String userId, long amount, TransactionType type, String reason) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive: " + amount);
        }
        if (type == TransactionType.USAGE) {
            throw new IllegalArgumentException("Usage transactions are debits");
        }
        TransactionResult result = ledger.apply(userId, amount, type, reason, Map.of());
        if (result.succeeded()) {
            log.info("Added {} credits ({}) for {}, balance {}", amount, type, userId, result.balance());
        }
        return result;
    }

    /**
     * Opens an account for the user on first use and grants the welcome bonus.
     *
     * @return true when a new account was opened
     */
    public boolean ensureAccount(String userId) {
        if (!ledger.openAccount(userId)) {
            return false;
        }
        if (properties.getWelcomeBonus() > 0) {
            credit(userId, properties.getWelcomeBonus(), TransactionType.BONUS, "Welcome bonus");
        }
        return true;
    }

    public Optional<Long> balance(String userId) {
        return ledger.balance(userId);
    }

    public boolean hasCredits(String userId, long required) {
        return ledger.balance(userId).map(b -> b >= required).orElse(false);
    }

    public List<CreditTransaction> history(String userId, int limit) {
        return ledger.history(userId, limit);
    }

    public Optional<CreditStatistics> statistics(String userId) {
        return ledger.statistics(userId);
    }

    private Duration cacheTtl() {
        return properties.getPricingCacheTtl() != null ? properties.getPricingCacheTtl() : Duration.ZERO;
    }

    private record CachedPricing(ModelPricing pricing, Instant expiresAt) {}
}
