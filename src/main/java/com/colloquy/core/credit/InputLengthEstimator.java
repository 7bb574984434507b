package com.colloquy.core.credit;

import com.colloquy.core.model.Message;

import java.util.List;

/**
 * Estimates how many prompt characters a multi-agent turn sends to the model.
 * The real prompt length is not tracked inside the loop, so the default is a fixed figure.
 */
@FunctionalInterface
public interface InputLengthEstimator {

    int inputCharacters(List<Message> transcript);

    static InputLengthEstimator fixed(int characters) {
        return transcript -> characters;
    }
}
