package com.colloquy.core.model;

public enum Humor {
    WITTY("Feel free to include appropriate humor and wit."),
    LIGHT("Occasionally use light humor when appropriate."),
    NONE("Keep responses serious and focused.");

    private final String instruction;

    Humor(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }
}
