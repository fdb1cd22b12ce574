package com.firesim.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for generation runs.
 */
@Service
public class GenerationMetrics {

    private final MeterRegistry registry;

    public GenerationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunDuration(long ms) {
        Timer.builder("firesim.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunResult(String status) {
        Counter.builder("firesim.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success" or "failure"
     */
    public void recordImage(String outcome, boolean anchor) {
        Counter.builder("firesim.images.total")
                .tag("outcome", outcome)
                .tag("anchor", String.valueOf(anchor))
                .register(registry)
                .increment();
    }

    public void recordViewpointError(String viewpoint) {
        Counter.builder("firesim.viewpoint.errors")
                .description("Generation failures per viewpoint after retries")
                .tag("viewpoint", viewpoint)
                .register(registry)
                .increment();
    }

    public void recordRetry(String model) {
        Counter.builder("firesim.generation.retries")
                .description("Provider attempts that failed and were retried")
                .tag("model", model)
                .register(registry)
                .increment();
    }

    public void recordConsistencyScore(int score) {
        DistributionSummary.builder("firesim.consistency.score")
                .register(registry)
                .record(score);
    }

    public void recordPersistFailure() {
        Counter.builder("firesim.progress.persist_failures")
                .register(registry)
                .increment();
    }
}
