package com.colloquy.core.credit;

/**
 * Converts text volume to an approximate token count.
 */
@FunctionalInterface
public interface TokenEstimator {

    long estimateTokens(int characters);

    /** Roughly four characters per token. */
    static TokenEstimator charactersPerToken() {
        return characters -> (long) Math.ceil(characters / 4.0);
    }
}
