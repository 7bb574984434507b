package com.colloquy.core.credit;

import java.io.Serializable;

/**
 * Price of one model.
 *
 * @param costPer1kTokens credits per started block of 1000 tokens, null when the model is billed per message only
 * @param defaultModel    whether this row prices unknown models of the same provider
 */
public record ModelPricing(
    String provider,
    String model,
    double costPerMessage,
    Double costPer1kTokens,
    boolean defaultModel,
    boolean active
) implements Serializable {

    /** Copy of this row presented under another model name. Never flagged as default. */
    public ModelPricing relabel(String modelName) {
        return new ModelPricing(provider, modelName, costPerMessage, costPer1kTokens, false, active);
    }
}
