package com.colloquy.core.llm;

import org.springframework.ai.chat.client.ChatClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps provider keys to {@link ChatClient}s. The default provider uses the auto-configured
 * client; every other provider needs a dedicated client or it is rejected.
 */
public class ChatClientRegistry {

    private final String defaultProvider;
    private final ChatClient defaultClient;
    private final Map<String, ChatClient> byProvider = new LinkedHashMap<>();

    public ChatClientRegistry(String defaultProvider, ChatClient defaultClient, Map<String, ChatClient> dedicated) {
        this.defaultProvider = defaultProvider.toLowerCase();
        this.defaultClient = defaultClient;
        dedicated.forEach((provider, client) -> byProvider.put(provider.toLowerCase(), client));
    }

    /**
     * @throws UnsupportedProviderException when no client serves {@code provider}
     */
    public ChatClient clientFor(String provider) {
        if (provider == null || defaultProvider.equalsIgnoreCase(provider)) {
            return defaultClient;
        }
        ChatClient client = byProvider.get(provider.toLowerCase());
        if (client == null) {
            throw new UnsupportedProviderException(provider);
        }
        return client;
    }

    public boolean supports(String provider) {
        return provider == null || defaultProvider.equalsIgnoreCase(provider)
                || byProvider.containsKey(provider.toLowerCase());
    }

    /** Providers with a client of their own, in configuration order. */
    public Set<String> dedicatedProviders() {
        return byProvider.keySet();
    }
}
