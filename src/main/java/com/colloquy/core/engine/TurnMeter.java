package com.colloquy.core.engine;

import com.colloquy.core.model.Agent;
import com.colloquy.core.state.ConversationState;

import java.util.Optional;

/**
 * Charges for a generated reply before it joins the transcript.
 * Throwing aborts the run with an error event and the reply is discarded.
 */
@FunctionalInterface
public interface TurnMeter {

    TurnMeter NONE = (state, agent, reply) -> Optional.empty();

    /**
     * @return the charge, or empty when the run is not metered
     */
    Optional<TurnCharge> charge(ConversationState state, Agent agent, String reply);
}
