package com.colloquy.core.credit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-memory pricing table. Starts from the built-in defaults; rows supplied through
 * configuration replace built-in rows with the same provider and model.
 */
public class DefaultPricingCatalog implements PricingCatalog {

    static final List<ModelPricing> BUILT_IN = List.of(
            new ModelPricing("openai", "gpt-4", 30, 30.0, false, true),
            new ModelPricing("openai", "gpt-4-turbo", 10, 10.0, true, true),
            new ModelPricing("openai", "gpt-3.5-turbo", 1, 1.0, false, true),
            new ModelPricing("anthropic", "claude-3-opus", 60, 60.0, false, true),
            new ModelPricing("anthropic", "claude-3-sonnet", 15, 15.0, true, true),
            new ModelPricing("anthropic", "claude-3-haiku", 1, 1.0, false, true),
            new ModelPricing("google", "gemini-pro", 5, 5.0, true, true),
            new ModelPricing("google", "gemini-pro-vision", 10, 10.0, false, true),
            new ModelPricing("groq", "mixtral-8x7b", 1, 1.0, true, true),
            new ModelPricing("groq", "llama2-70b", 1, 1.0, false, true),
            new ModelPricing("ollama", "llama2", 1, null, true, true),
            new ModelPricing("ollama", "mistral", 1, null, false, true)
    );

    private final List<ModelPricing> rows;

    public DefaultPricingCatalog() {
        this(List.of());
    }

    public DefaultPricingCatalog(List<ModelPricing> overrides) {
        List<ModelPricing> merged = new ArrayList<>();
        for (ModelPricing row : BUILT_IN) {
            boolean replaced = overrides.stream().anyMatch(o -> sameModel(o, row.provider(), row.model()));
            if (!replaced) {
                merged.add(row);
            }
        }
        merged.addAll(overrides);
        this.rows = List.copyOf(merged);
    }

    @Override
    public Optional<ModelPricing> find(String provider, String model) {
        return rows.stream().filter(r -> sameModel(r, provider, model)).findFirst();
    }

    @Override
    public Optional<ModelPricing> findDefault(String provider) {
        return rows.stream()
                .filter(r -> r.provider().equalsIgnoreCase(provider) && r.defaultModel() && r.active())
                .findFirst();
    }

    @Override
    public List<ModelPricing> all() {
        return rows;
    }

    private static boolean sameModel(ModelPricing row, String provider, String model) {
        return row.provider().equalsIgnoreCase(provider) && row.model().equalsIgnoreCase(model);
    }
}
