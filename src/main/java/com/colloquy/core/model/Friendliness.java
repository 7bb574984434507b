package com.colloquy.core.model;

public enum Friendliness {
    FRIENDLY("Be warm, approachable, and friendly in your responses."),
    FORMAL("Maintain a professional and formal tone."),
    BALANCED("Use a balanced, neither too casual nor too formal tone.");

    private final String instruction;

    Friendliness(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }
}
