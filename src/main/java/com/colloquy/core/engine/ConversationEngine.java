package com.colloquy.core.engine;

import com.colloquy.core.agent.AgentRegistry;
import com.colloquy.core.generation.ResponseGenerator;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.Agent;
import com.colloquy.core.model.Message;
import com.colloquy.core.state.ConversationState;
import com.colloquy.core.supervisor.SpeakerSelector;
import com.colloquy.core.supervisor.TerminationEvaluator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Creates {@link ConversationRun}s. Each run gets its own {@link AgentRegistry} and
 * {@link ConversationState}; nothing mutable is shared between runs.
 */
@Service
public class ConversationEngine {

    private final SpeakerSelector speakerSelector;
    private final ResponseGenerator responseGenerator;
    private final TerminationEvaluator terminationEvaluator;
    private final TurnMeter turnMeter;
    private final TurnPacer pacer;
    private final ConversationProperties properties;
    private final ColloquyMetrics metrics;

    @Autowired
    public ConversationEngine(SpeakerSelector speakerSelector, ResponseGenerator responseGenerator,
                              TerminationEvaluator terminationEvaluator, TurnMeter turnMeter,
                              ConversationProperties properties, ColloquyMetrics metrics) {
        this(speakerSelector, responseGenerator, terminationEvaluator, turnMeter,
                TurnPacer.sleeping(), properties, metrics);
    }

    ConversationEngine(SpeakerSelector speakerSelector, ResponseGenerator responseGenerator,
                       TerminationEvaluator terminationEvaluator, TurnMeter turnMeter, TurnPacer pacer,
                       ConversationProperties properties, ColloquyMetrics metrics) {
        this.speakerSelector = speakerSelector;
        this.responseGenerator = responseGenerator;
        this.terminationEvaluator = terminationEvaluator;
        this.turnMeter = turnMeter;
        this.pacer = pacer;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Prepares a run over {@code transcript}. Nothing happens until the run is iterated.
     *
     * @param conversationId conversation the run belongs to
     * @param userId         owner to charge, null for an unmetered run
     * @param transcript     messages so far, ending with the user's latest message
     * @param agents         roster in priority order; the first agent is the selection fallback
     * @param maxTurns       ceiling on agent replies for this run
     * @param liveness       read before every step; false ends the run silently
     */
    public ConversationRun start(String conversationId, String userId, List<Message> transcript,
                                 List<Agent> agents, int maxTurns, BooleanSupplier liveness) {
        var state = new ConversationState(conversationId, userId, transcript,
                agents.stream().map(Agent::toRosterEntry).toList(), maxTurns);
        return new ConversationRun(state, agents, new AgentRegistry(), speakerSelector, responseGenerator,
                terminationEvaluator, turnMeter, pacer, properties, metrics, liveness);
    }

    /**
     * Run over a caller-built state and registry.
     */
    ConversationRun start(ConversationState state, List<Agent> agents, AgentRegistry registry,
                          BooleanSupplier liveness) {
        return new ConversationRun(state, agents, registry, speakerSelector, responseGenerator,
                terminationEvaluator, turnMeter, pacer, properties, metrics, liveness);
    }
}
