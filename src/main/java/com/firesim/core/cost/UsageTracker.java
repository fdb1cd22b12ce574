package com.firesim.core.cost;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local record of estimated run costs, aggregated per UTC day.
 */
@Component
public class UsageTracker {

    private record Entry(Instant recordedAt, CostBreakdown breakdown) {}

    public record DailySummary(LocalDate date, int totalRuns, int totalImages, double totalCost,
                               CostBreakdown costBreakdown) {}

    private final ConcurrentHashMap<String, Entry> runs = new ConcurrentHashMap<>();
    private final Clock clock;

    public UsageTracker(Clock clock) {
        this.clock = clock;
    }

    /** Re-recording a run replaces its earlier estimate. */
    public void record(String runId, CostBreakdown breakdown) {
        runs.put(runId, new Entry(clock.instant(), breakdown));
    }

    public DailySummary dailySummary() {
        return dailySummary(LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    }

    public DailySummary dailySummary(LocalDate date) {
        int totalRuns = 0;
        int totalImages = 0;
        double imageCost = 0;
        double storageCost = 0;
        long storageBytes = 0;

        for (var entry : runs.values()) {
            if (!entry.recordedAt().atZone(ZoneOffset.UTC).toLocalDate().equals(date)) {
                continue;
            }
            var b = entry.breakdown();
            totalRuns++;
            totalImages += b.images().count();
            imageCost += b.images().totalCost();
            storageCost += b.storage().totalCost();
            storageBytes += b.storage().sizeBytes();
        }

        double total = imageCost + storageCost;
        var breakdown = new CostBreakdown(
                new CostBreakdown.Images(totalImages, totalImages > 0 ? imageCost / totalImages : 0, imageCost),
                new CostBreakdown.Storage(storageBytes, CostEstimator.STORAGE_PER_GB, storageCost),
                total);
        return new DailySummary(date, totalRuns, totalImages, total, breakdown);
    }

    public void clear() {
        runs.clear();
    }
}
