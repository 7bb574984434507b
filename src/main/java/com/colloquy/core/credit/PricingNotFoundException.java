package com.colloquy.core.credit;

public class PricingNotFoundException extends RuntimeException {

    public PricingNotFoundException(String provider, String model) {
        super("No active pricing for " + provider + "/" + model);
    }
}
