package com.colloquy.core.engine;

/**
 * States of a conversation run. {@link #COMPLETED} is terminal.
 */
public enum TurnPhase {
    INITIALIZING,
    SELECTING_SPEAKER,
    GENERATING_TURN,
    EVALUATING_TERMINATION,
    COMPLETED
}
