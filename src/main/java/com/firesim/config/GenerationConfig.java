package com.firesim.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared thread pools and clock for the generation pipeline.
 */
@Configuration
public class GenerationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Detached run execution and per-task fan-out. */
    @Bean(destroyMethod = "shutdownNow")
    @Primary
    public ExecutorService generationExecutor() {
        return Executors.newCachedThreadPool(namedDaemon("firesim-gen-"));
    }

    /** Debounced progress writes. */
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService progressScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedDaemon("firesim-progress-"));
    }

    private static ThreadFactory namedDaemon(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
