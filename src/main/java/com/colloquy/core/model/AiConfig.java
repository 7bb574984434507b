package com.colloquy.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Model reference of an agent: which provider, which model and which stored credential to use.
 *
 * @param provider      provider key, e.g. "openai", "anthropic", "vertex_ai"
 * @param model         provider-specific model name
 * @param credentialRef opaque reference to the credential, resolved outside the engine
 */
public record AiConfig(
    String provider,
    String model,
    String credentialRef
) implements Serializable {

    private static final Set<String> GOOGLE_FAMILY = Set.of("google", "vertex_ai");

    /**
     * Google-hosted models ignore trailing system messages, so nudges for them go in as user turns.
     */
    public boolean isGoogleFamily() {
        return provider != null && GOOGLE_FAMILY.contains(provider.toLowerCase());
    }
}
