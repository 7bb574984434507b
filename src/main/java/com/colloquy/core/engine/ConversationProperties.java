package com.colloquy.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "colloquy.conversation")
public class ConversationProperties {

    private int defaultMaxTurns = 10;

    /** Fixed part of the pause before every turn but the first. */
    private Duration backoffBase = Duration.ofMillis(1000);

    /** Added per turn already taken, up to {@link #backoffCap}. */
    private Duration backoffStep = Duration.ofMillis(200);

    private Duration backoffCap = Duration.ofMillis(2000);

    private int workerThreads = 8;

    public int getDefaultMaxTurns() {
        return defaultMaxTurns;
    }

    public void setDefaultMaxTurns(int defaultMaxTurns) {
        this.defaultMaxTurns = defaultMaxTurns;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffStep() {
        return backoffStep;
    }

    public void setBackoffStep(Duration backoffStep) {
        this.backoffStep = backoffStep;
    }

    public Duration getBackoffCap() {
        return backoffCap;
    }

    public void setBackoffCap(Duration backoffCap) {
        this.backoffCap = backoffCap;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    /** {@code min(turnCount * step, cap) + base} */
    public Duration backoffFor(int turnCount) {
        Duration progressive = backoffStep.multipliedBy(turnCount);
        if (progressive.compareTo(backoffCap) > 0) {
            progressive = backoffCap;
        }
        return progressive.plus(backoffBase);
    }
}
