package com.colloquy.core.credit;

import java.util.List;
import java.util.Optional;

/**
 * Source of {@link ModelPricing} rows.
 */
public interface PricingCatalog {

    Optional<ModelPricing> find(String provider, String model);

    /** The active row flagged as default for the provider. */
    Optional<ModelPricing> findDefault(String provider);

    List<ModelPricing> all();
}
