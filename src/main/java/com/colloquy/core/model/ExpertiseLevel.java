package com.colloquy.core.model;

public enum ExpertiseLevel {
    BEGINNER("Explain concepts simply, as if speaking to a beginner."),
    INTERMEDIATE("Use moderate technical language appropriate for someone with some experience."),
    EXPERT("You can use technical language and assume advanced knowledge.");

    private final String instruction;

    ExpertiseLevel(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }
}
