package com.colloquy.core.model;

import java.io.Serializable;

/**
 * Supervisor verdict on whether the group conversation reached a natural end.
 */
public record TerminationDecision(
    boolean shouldTerminate,
    String reason
) implements Serializable {}
