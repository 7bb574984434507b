package com.colloquy.core.credit;

import com.colloquy.core.engine.TurnCharge;
import com.colloquy.core.engine.TurnMeter;
import com.colloquy.core.model.Agent;
import com.colloquy.core.state.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Debits the conversation owner for every generated reply.
 * Runs without a user id are not metered.
 */
@Component
public class CreditTurnMeter implements TurnMeter {

    private static final Logger log = LoggerFactory.getLogger(CreditTurnMeter.class);

    private final CostAccountant accountant;
    private final TokenEstimator tokenEstimator;
    private final InputLengthEstimator inputLengthEstimator;
    private final CreditProperties properties;

    public CreditTurnMeter(CostAccountant accountant, TokenEstimator tokenEstimator,
                           InputLengthEstimator inputLengthEstimator, CreditProperties properties) {
        this.accountant = accountant;
        this.tokenEstimator = tokenEstimator;
        this.inputLengthEstimator = inputLengthEstimator;
        this.properties = properties;
    }

    /**
     * @throws InsufficientCreditsException when the balance cannot cover the reply
     */
    @Override
    public Optional<TurnCharge> charge(ConversationState state, Agent agent, String reply) {
        String userId = state.userId();
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }

        String provider = agent.aiConfig().provider();
        String model = agent.aiConfig().model();
        long tokens = tokenEstimator.estimateTokens(inputLengthEstimator.inputCharacters(state.messages()))
                + tokenEstimator.estimateTokens(reply.length());
        long cost;
        try {
            cost = accountant.priceOf(provider, model, 1, tokens);
        } catch (PricingNotFoundException e) {
            log.warn("{}; charging fallback cost of {}", e.getMessage(), properties.getFallbackCost());
            cost = properties.getFallbackCost();
        }

        Map<String, String> metadata = Map.of(
                "conversationId", state.conversationId(),
                "agentId", agent.agentId(),
                "model", provider + "/" + model);
        TransactionResult result = accountant.debit(userId, cost, "Multi-agent message from " + agent.name(), metadata);
        return switch (result.outcome()) {
            case SUCCESS -> Optional.of(new TurnCharge(cost, result.balance()));
            case INSUFFICIENT_FUNDS -> throw new InsufficientCreditsException(cost, result.balance());
            case ACCOUNT_NOT_FOUND -> throw new IllegalStateException(result.message());
        };
    }
}
