package com.firesim.core.cost;

/**
 * Per-image list prices in USD.
 */
public enum PricingTier {
    STANDARD(0.040),
    HD(0.080),
    STABLE_IMAGE_CORE(0.033);

    private final double pricePerImage;

    PricingTier(double pricePerImage) {
        this.pricePerImage = pricePerImage;
    }

    public double pricePerImage() {
        return pricePerImage;
    }

    /** {@code hd} quality maps to HD, anything else to STANDARD; placeholder output is priced as image core. */
    public static PricingTier forGeneration(String modelId, String quality) {
        if (modelId != null && modelId.startsWith("placeholder")) {
            return STABLE_IMAGE_CORE;
        }
        return "hd".equalsIgnoreCase(quality) ? HD : STANDARD;
    }
}
