package com.colloquy.core.llm;

/**
 * Thrown when an agent or the supervisor names a provider that has no configured chat client.
 */
public class UnsupportedProviderException extends RuntimeException {

    private final String provider;

    public UnsupportedProviderException(String provider) {
        super("No chat client configured for provider " + provider);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
