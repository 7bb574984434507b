package com.colloquy.core.model;

import java.io.Serializable;

/**
 * Read-only view of a participating agent used when building supervisor prompts.
 */
public record RosterEntry(
    String agentId,
    String name,
    String characteristics
) implements Serializable {}
