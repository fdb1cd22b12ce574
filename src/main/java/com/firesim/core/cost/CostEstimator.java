package com.firesim.core.cost;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Rough cost estimate for one run. Storage is a monthly price prorated by size.
 */
@Component
public class CostEstimator {

    public static final double STORAGE_PER_GB = 0.020;

    private static final double BYTES_PER_GB = 1024d * 1024 * 1024;

    public CostBreakdown estimate(int imageCount, PricingTier tier, long storageBytes) {
        double imageCost = imageCount * tier.pricePerImage();
        double storageCost = storageBytes / BYTES_PER_GB * STORAGE_PER_GB;
        return new CostBreakdown(
                new CostBreakdown.Images(imageCount, tier.pricePerImage(), imageCost),
                new CostBreakdown.Storage(storageBytes, STORAGE_PER_GB, storageCost),
                imageCost + storageCost);
    }

    public String format(CostBreakdown breakdown) {
        return String.join("\n",
                String.format(Locale.ROOT, "Images: %d x $%.4f = $%.4f", breakdown.images().count(),
                        breakdown.images().costPerImage(), breakdown.images().totalCost()),
                String.format(Locale.ROOT, "Storage: %.2f MB x $%.4f/GB = $%.4f",
                        breakdown.storage().sizeBytes() / (1024d * 1024), breakdown.storage().costPerGb(),
                        breakdown.storage().totalCost()),
                String.format(Locale.ROOT, "Total: $%.4f", breakdown.totalCost()));
    }
}
