package com.colloquy.core.engine;

import java.time.Duration;

/**
 * Waits out the delay between agent turns.
 */
@FunctionalInterface
public interface TurnPacer {

    TurnPacer NONE = delay -> {};

    void pause(Duration delay) throws InterruptedException;

    static TurnPacer sleeping() {
        return delay -> Thread.sleep(delay.toMillis());
    }
}
