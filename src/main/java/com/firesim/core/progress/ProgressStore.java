package com.firesim.core.progress;

import com.firesim.core.model.RunProgress;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Authoritative record of run lifecycles.
 * <p>
 * Exactly one logical writer (the orchestrator executing the run) calls {@link #mutate};
 * everyone else only reads snapshots.
 */
public interface ProgressStore {

    void create(String runId, RunProgress initial);

    /** A detached copy of the run, rehydrated from durable storage if not held in memory. */
    Optional<RunProgress> get(String runId);

    /**
     * Applies {@code update} to the live record and schedules a debounced durable write.
     *
     * @return a snapshot taken right after the update
     * @throws IllegalStateException if the run is unknown
     */
    RunProgress mutate(String runId, Consumer<RunProgress> update);

    /**
     * Writes the current record to durable storage, now if {@code immediate}, otherwise after
     * the debounce window. Failures are logged, never thrown.
     */
    void persist(String runId, boolean immediate);
}
