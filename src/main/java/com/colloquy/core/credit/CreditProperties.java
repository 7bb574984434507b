package com.colloquy.core.credit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "colloquy.credits")
public class CreditProperties {

    /** Credits granted when an account is opened. */
    private long welcomeBonus = 10_000;

    /** Charged per reply when no pricing row matches the agent's model. */
    private long fallbackCost = 1;

    /** Prompt size assumed for every multi-agent turn. */
    private int estimatedInputCharacters = 100;

    private Duration pricingCacheTtl = Duration.ofMinutes(5);

    private List<PricingDefinition> pricing = new ArrayList<>();

    public long getWelcomeBonus() {
        return welcomeBonus;
    }

    public void setWelcomeBonus(long welcomeBonus) {
        this.welcomeBonus = welcomeBonus;
    }

    public long getFallbackCost() {
        return fallbackCost;
    }

    public void setFallbackCost(long fallbackCost) {
        this.fallbackCost = fallbackCost;
    }

    public int getEstimatedInputCharacters() {
        return estimatedInputCharacters;
    }

    public void setEstimatedInputCharacters(int estimatedInputCharacters) {
        this.estimatedInputCharacters = estimatedInputCharacters;
    }

    public Duration getPricingCacheTtl() {
        return pricingCacheTtl;
    }

    public void setPricingCacheTtl(Duration pricingCacheTtl) {
        this.pricingCacheTtl = pricingCacheTtl;
    }

    public List<PricingDefinition> getPricing() {
        return pricing;
    }

    public void setPricing(List<PricingDefinition> pricing) {
        this.pricing = pricing;
    }

    public List<ModelPricing> pricingOverrides() {
        return pricing.stream()
                .map(p -> new ModelPricing(p.getProvider(), p.getModel(), p.getCostPerMessage(),
                        p.getCostPer1kTokens(), p.isDefaultModel(), p.isActive()))
                .toList();
    }

    public static class PricingDefinition {

        private String provider;
        private String model;
        private double costPerMessage;
        private Double costPer1kTokens;
        private boolean defaultModel;
        private boolean active = true;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getCostPerMessage() {
            return costPerMessage;
        }

        public void setCostPerMessage(double costPerMessage) {
            this.costPerMessage = costPerMessage;
        }

        public Double getCostPer1kTokens() {
            return costPer1kTokens;
        }

        public void setCostPer1kTokens(Double costPer1kTokens) {
            this.costPer1kTokens = costPer1kTokens;
        }

        public boolean isDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(boolean defaultModel) {
            this.defaultModel = defaultModel;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }
}
