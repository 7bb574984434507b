package com.colloquy.core.engine;

import com.colloquy.core.agent.AgentRegistry;
import com.colloquy.core.generation.ResponseGenerator;
import com.colloquy.core.logging.MdcContext;
import com.colloquy.core.metrics.ColloquyMetrics;
import com.colloquy.core.model.Agent;
import com.colloquy.core.model.AgentSelection;
import com.colloquy.core.model.ConversationStatus;
import com.colloquy.core.model.Message;
import com.colloquy.core.model.TerminationDecision;
import com.colloquy.core.model.WorkflowEvent;
import com.colloquy.core.state.ConversationState;
import com.colloquy.core.supervisor.SpeakerSelector;
import com.colloquy.core.supervisor.TerminationEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One conversation run, driven as an explicit state machine.
 * <p>
 * The run does no work on its own: every call to {@link #hasNext()} advances the machine
 * just far enough to produce the next {@link WorkflowEvent}, so model calls and backoff
 * pauses happen on the consumer's thread, one step at a time. Before each transition the
 * liveness flag is consulted; once it reads false the run ends without emitting anything else.
 * <p>
 * Whichever way the run ends, the roster is unregistered exactly once. Closing the run
 * early has the same effect.
 */
public class ConversationRun implements Iterator<WorkflowEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConversationRun.class);

    static final String INITIALIZED_MESSAGE = "Conversation initialized";
    static final String COMPLETE_MESSAGE = "Conversation has reached a natural conclusion";
    static final String TURN_LIMIT_MESSAGE = "Conversation reached the maximum number of turns";
    static final String PAUSED_MESSAGE = "Waiting for the user to continue the conversation";

    private final ConversationState state;
    private final List<Agent> roster;
    private final AgentRegistry registry;
    private final SpeakerSelector speakerSelector;
    private final ResponseGenerator responseGenerator;
    private final TerminationEvaluator terminationEvaluator;
    private final TurnMeter turnMeter;
    private final TurnPacer pacer;
    private final ConversationProperties properties;
    private final ColloquyMetrics metrics;
    private final BooleanSupplier liveness;

    private final ArrayDeque<WorkflowEvent> pending = new ArrayDeque<>();
    private final AtomicBoolean cleanedUp = new AtomicBoolean();

    private TurnPhase phase = TurnPhase.INITIALIZING;
    private ConversationStatus outcome = ConversationStatus.RUNNING;
    private Agent speaker;
    private int turnsRemaining;
    private boolean announced;

    ConversationRun(ConversationState state, List<Agent> roster, AgentRegistry registry,
                    SpeakerSelector speakerSelector, ResponseGenerator responseGenerator,
                    TerminationEvaluator terminationEvaluator, TurnMeter turnMeter, TurnPacer pacer,
                    ConversationProperties properties, ColloquyMetrics metrics, BooleanSupplier liveness) {
        this.state = state;
        this.roster = List.copyOf(roster);
        this.registry = registry;
        this.speakerSelector = speakerSelector;
        this.responseGenerator = responseGenerator;
        this.terminationEvaluator = terminationEvaluator;
        this.turnMeter = turnMeter;
        this.pacer = pacer;
        this.properties = properties;
        this.metrics = metrics;
        this.liveness = liveness;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && phase != TurnPhase.COMPLETED) {
            advance();
        }
        return !pending.isEmpty();
    }

    @Override
    public WorkflowEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Conversation " + state.conversationId() + " has ended");
        }
        return pending.poll();
    }

    /**
     * Sequential stream over the remaining events. Closing the stream closes the run.
     */
    public Stream<WorkflowEvent> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    /**
     * Ends the run without further events. Safe to call more than once.
     */
    @Override
    public void close() {
        pending.clear();
        if (phase != TurnPhase.COMPLETED) {
            log.info("Conversation {} closed by consumer in phase {}", state.conversationId(), phase);
            finish(ConversationStatus.STOPPED);
        }
    }

    public ConversationState state() {
        return state;
    }

    public TurnPhase phase() {
        return phase;
    }

    public ConversationStatus outcome() {
        return outcome;
    }

    private void advance() {
        if (!liveness.getAsBoolean()) {
            log.info("Conversation {} no longer active, stopping in phase {}", state.conversationId(), phase);
            finish(ConversationStatus.STOPPED);
            return;
        }
        MdcContext.setConversation(state.conversationId());
        try {
            switch (phase) {
                case INITIALIZING -> initialize();
                case SELECTING_SPEAKER -> selectSpeaker();
                case GENERATING_TURN -> generateTurn();
                case EVALUATING_TERMINATION -> evaluateTermination();
                case COMPLETED -> { }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Conversation {} interrupted while pacing, stopping", state.conversationId());
            finish(ConversationStatus.STOPPED);
        } catch (RuntimeException e) {
            log.error("Conversation {} failed in phase {}: {}", state.conversationId(), phase, e.getMessage(), e);
            pending.add(WorkflowEvent.error("Conversation error: " + e.getMessage()));
            finish(ConversationStatus.FAILED);
        } finally {
            MdcContext.clear();
        }
    }

    private void initialize() {
        roster.forEach(registry::register);
        log.info("Conversation {} started with {} agent(s), max {} turns",
                state.conversationId(), roster.size(), state.maxTurns());
        pending.add(WorkflowEvent.status(INITIALIZED_MESSAGE));
        phase = TurnPhase.SELECTING_SPEAKER;
    }

    private void selectSpeaker() {
        if (state.turnBudgetExhausted()) {
            pending.add(WorkflowEvent.complete(TURN_LIMIT_MESSAGE));
            finish(ConversationStatus.COMPLETED);
            return;
        }

        Optional<AgentSelection> selection = speakerSelector.selectNext(state);
        if (selection.isEmpty() || selection.get().isPause()) {
            log.info("Supervisor paused conversation {} after {} turn(s)", state.conversationId(), state.turnCount());
            pending.add(WorkflowEvent.paused(PAUSED_MESSAGE));
            finish(ConversationStatus.PAUSED);
            return;
        }

        speaker = registry.get(selection.get().agentId());
        turnsRemaining = selection.get().turnsOrDefault();
        announced = false;
        phase = TurnPhase.GENERATING_TURN;
    }

    private void generateTurn() throws InterruptedException {
        if (!announced) {
            if (state.turnCount() > 0) {
                Duration delay = properties.backoffFor(state.turnCount());
                log.debug("Pacing {}ms before turn {}", delay.toMillis(), state.turnCount() + 1);
                pacer.pause(delay);
            }
            pending.add(WorkflowEvent.status(speaker.name() + " is thinking..."));
            announced = true;
            return;
        }

        MdcContext.setTurn(state.conversationId(), speaker.agentId(), state.turnCount() + 1);
        long start = System.currentTimeMillis();
        String reply = responseGenerator.generate(speaker, state.messages());
        metrics.recordTurn(speaker.aiConfig().provider(), System.currentTimeMillis() - start);

        Optional<TurnCharge> charge = turnMeter.charge(state, speaker, reply);

        Message message = Message.assistant(speaker, reply);
        state.recordTurn(message);
        log.info("Turn {}/{} by {} ({} chars)", state.turnCount(), state.maxTurns(), speaker.name(), reply.length());
        pending.add(WorkflowEvent.agentResponse(message));
        charge.ifPresent(c -> pending.add(WorkflowEvent.creditUpdate(speaker.agentId(), c.credits(), c.remainingCredits())));

        turnsRemaining--;
        announced = false;
        if (turnsRemaining <= 0 || state.turnBudgetExhausted()) {
            phase = TurnPhase.EVALUATING_TERMINATION;
        }
    }

    private void evaluateTermination() {
        if (state.messages().size() >= 3) {
            TerminationDecision decision = terminationEvaluator.shouldStop(state);
            if (decision.shouldTerminate()) {
                log.info("Conversation {} concluded: {}", state.conversationId(), decision.reason());
                pending.add(WorkflowEvent.complete(COMPLETE_MESSAGE));
                finish(ConversationStatus.COMPLETED);
                return;
            }
        }
        phase = TurnPhase.SELECTING_SPEAKER;
    }

    private void finish(ConversationStatus status) {
        phase = TurnPhase.COMPLETED;
        state.markComplete();
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        outcome = status;
        roster.forEach(agent -> registry.unregister(agent.agentId()));
        metrics.recordConversationResult(status.name().toLowerCase());
        metrics.recordTurnsPerConversation(state.turnCount());
        log.info("Conversation {} ended: {} after {} turn(s)", state.conversationId(), status, state.turnCount());
    }
}
