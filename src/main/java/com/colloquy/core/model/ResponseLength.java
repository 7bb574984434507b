package com.colloquy.core.model;

public enum ResponseLength {
    SHORT("Keep your responses brief and concise (1-2 sentences when possible)."),
    MEDIUM("Keep responses moderate in length - informative but not overly long."),
    LONG("Provide detailed, comprehensive responses with explanations.");

    private final String instruction;

    ResponseLength(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }
}
