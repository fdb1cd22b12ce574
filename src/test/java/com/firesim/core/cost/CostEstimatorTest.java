package com.firesim.core.cost;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostEstimatorTest {

    private final CostEstimator estimator = new CostEstimator();

    @Test
    @DisplayName("image cost is count times tier price, storage is prorated per GB")
    void estimate() {
        var breakdown = estimator.estimate(5, PricingTier.HD, 1024L * 1024 * 1024);

        assertEquals(5, breakdown.images().count());
        assertEquals(0.40, breakdown.images().totalCost(), 1e-9);
        assertEquals(0.020, breakdown.storage().totalCost(), 1e-9);
        assertEquals(0.42, breakdown.totalCost(), 1e-9);
    }

    @Test
    @DisplayName("tier follows model and quality")
    void tierSelection() {
        assertEquals(PricingTier.STABLE_IMAGE_CORE, PricingTier.forGeneration("placeholder-renderer-1.0", "hd"));
        assertEquals(PricingTier.HD, PricingTier.forGeneration("flux-1.1-pro", "HD"));
        assertEquals(PricingTier.STANDARD, PricingTier.forGeneration("flux-1.1-pro", "high"));
        assertEquals(PricingTier.STANDARD, PricingTier.forGeneration(null, null));
    }

    @Test
    @DisplayName("format renders one line per component")
    void format() {
        var text = estimator.format(estimator.estimate(2, PricingTier.STANDARD, 0));

        assertTrue(text.contains("Images: 2 x $0.0400 = $0.0800"));
        assertTrue(text.contains("Storage: 0.00 MB"));
        assertTrue(text.endsWith("Total: $0.0800"));
    }
}
