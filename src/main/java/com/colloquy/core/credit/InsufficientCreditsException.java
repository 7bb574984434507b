package com.colloquy.core.credit;

/**
 * A reply could not be paid for. Ends the conversation run with an error event.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final long required;
    private final long available;

    public InsufficientCreditsException(long required, long available) {
        super("Insufficient credits. Required: " + required + ", Available: " + available);
        this.required = required;
        this.available = available;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}
