package com.firesim.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Per-key coalescing of writes. Each {@link #schedule} restarts the key's quiet-period
 * timer, so a burst of calls produces one write after the burst settles.
 * {@link #flush} cancels any pending timer and writes immediately.
 */
public class DebouncedWriter {

    private static final Logger log = LoggerFactory.getLogger(DebouncedWriter.class);

    private final DelayScheduler scheduler;
    private final long quietPeriodMs;
    private final Consumer<String> writer;
    private final ConcurrentHashMap<String, Pending> pending = new ConcurrentHashMap<>();

    private record Pending(Object token, DelayScheduler.Cancellable handle) {}

    /**
     * @param writer performs the durable write for a key; exceptions are logged and dropped
     */
    public DebouncedWriter(DelayScheduler scheduler, long quietPeriodMs, Consumer<String> writer) {
        this.scheduler = scheduler;
        this.quietPeriodMs = quietPeriodMs;
        this.writer = writer;
    }

    public void schedule(String key) {
        pending.compute(key, (k, existing) -> {
            if (existing != null) {
                existing.handle().cancel();
            }
            var token = new Object();
            return new Pending(token, scheduler.schedule(() -> fire(k, token), quietPeriodMs));
        });
    }

    public void flush(String key) {
        var existing = pending.remove(key);
        if (existing != null) {
            existing.handle().cancel();
        }
        write(key);
    }

    public boolean hasPending(String key) {
        return pending.containsKey(key);
    }

    private void fire(String key, Object token) {
        var current = pending.get(key);
        // a newer schedule() superseded this timer; its own timer will write
        if (current == null || current.token() != token || !pending.remove(key, current)) {
            return;
        }
        write(key);
    }

    private void write(String key) {
        try {
            writer.accept(key);
        } catch (RuntimeException e) {
            log.warn("Durable write for {} failed: {}", key, e.getMessage());
        }
    }
}
