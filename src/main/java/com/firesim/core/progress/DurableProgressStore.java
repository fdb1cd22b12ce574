package com.firesim.core.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firesim.config.FiresimProperties;
import com.firesim.core.metrics.GenerationMetrics;
import com.firesim.core.model.RunProgress;
import com.firesim.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * In-memory progress map mirrored to the artifact store under {@code progress/{runId}.json}.
 *
 * <p>The in-memory copy is the source of truth for the life of the process. After a restart,
 * runs are rehydrated lazily, one run id at a time, on first access.
 */
@Component
public class DurableProgressStore implements ProgressStore {

    private static final Logger log = LoggerFactory.getLogger(DurableProgressStore.class);

    private final ConcurrentHashMap<String, RunProgress> runs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> writeLocks = new ConcurrentHashMap<>();
    private final ArtifactStore artifactStore;
    private final ObjectMapper objectMapper;
    private final DebouncedWriter writer;
    private final GenerationMetrics metrics;

    @Autowired
    public DurableProgressStore(ArtifactStore artifactStore, ObjectMapper objectMapper,
                                ScheduledExecutorService progressScheduler, FiresimProperties properties,
                                @Autowired(required = false) GenerationMetrics metrics) {
        this(artifactStore, objectMapper, DelayScheduler.of(progressScheduler),
                properties.getProgress().getDebounceMs(), metrics);
    }

    public DurableProgressStore(ArtifactStore artifactStore, ObjectMapper objectMapper,
                                DelayScheduler scheduler, long debounceMs, GenerationMetrics metrics) {
        this.artifactStore = artifactStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.writer = new DebouncedWriter(scheduler, debounceMs, this::writeNow);
    }

    public static String progressKey(String runId) {
        return "progress/" + runId + ".json";
    }

    @Override
    public void create(String runId, RunProgress initial) {
        runs.put(runId, initial.copy());
    }

    @Override
    public Optional<RunProgress> get(String runId) {
        return live(runId).map(progress -> {
            synchronized (progress) {
                return progress.copy();
            }
        });
    }

    @Override
    public RunProgress mutate(String runId, Consumer<RunProgress> update) {
        var progress = live(runId)
                .orElseThrow(() -> new IllegalStateException("Unknown run " + runId));
        RunProgress snapshot;
        synchronized (progress) {
            update.accept(progress);
            snapshot = progress.copy();
        }
        writer.schedule(runId);
        return snapshot;
    }

    @Override
    public void persist(String runId, boolean immediate) {
        if (immediate) {
            writer.flush(runId);
        } else {
            writer.schedule(runId);
        }
    }

    private Optional<RunProgress> live(String runId) {
        var progress = runs.get(runId);
        if (progress != null) {
            return Optional.of(progress);
        }
        return rehydrate(runId);
    }

    private Optional<RunProgress> rehydrate(String runId) {
        try {
            var stored = artifactStore.load(progressKey(runId));
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            var progress = objectMapper.readValue(stored.get(), RunProgress.class);
            log.info("Rehydrated run {} ({}) from durable storage", runId, progress.getStatus().wireValue());
            // another reader may have rehydrated concurrently; keep whichever landed first
            return Optional.of(runs.computeIfAbsent(runId, id -> progress));
        } catch (Exception e) {
            log.warn("Failed to load progress for run {}: {}", runId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Snapshot and upload happen under one per-run lock, so writes land in snapshot order and an
     * older snapshot can never overwrite a newer one, terminal state included.
     */
    private void writeNow(String runId) {
        var progress = runs.get(runId);
        if (progress == null) {
            return;
        }
        synchronized (writeLocks.computeIfAbsent(runId, id -> new Object())) {
            byte[] json;
            synchronized (progress) {
                try {
                    json = objectMapper.writeValueAsBytes(progress);
                } catch (JsonProcessingException e) {
                    recordFailure(runId, e);
                    return;
                }
            }
            try {
                artifactStore.upload(progressKey(runId), json, "application/json", Map.of("runId", runId));
            } catch (RuntimeException e) {
                recordFailure(runId, e);
            }
        }
    }

    private void recordFailure(String runId, Exception e) {
        log.warn("Failed to persist progress for run {}: {}", runId, e.getMessage());
        if (metrics != null) {
            metrics.recordPersistFailure();
        }
    }
}
