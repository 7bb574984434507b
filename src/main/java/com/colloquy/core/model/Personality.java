package com.colloquy.core.model;

public enum Personality {
    ENTHUSIASTIC("Show enthusiasm and energy in your responses."),
    RESERVED("Be thoughtful and measured in your responses."),
    BALANCED("Maintain a balanced, engaging but not overwhelming personality.");

    private final String instruction;

    Personality(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }
}
