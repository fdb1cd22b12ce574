package com.firesim.core.progress;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Schedules a delayed action. Tests substitute a manually advanced implementation.
 */
@FunctionalInterface
public interface DelayScheduler {

    /** Handle to a pending action. */
    interface Cancellable {
        void cancel();
    }

    Cancellable schedule(Runnable action, long delayMs);

    static DelayScheduler of(ScheduledExecutorService executor) {
        return (action, delayMs) -> {
            ScheduledFuture<?> future = executor.schedule(action, delayMs, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        };
    }
}
