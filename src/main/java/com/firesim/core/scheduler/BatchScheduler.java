package com.firesim.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Runs independent tasks in consecutive fixed-size chunks.
 *
 * <p>Each chunk is dispatched fully in parallel and must settle completely before the
 * next one starts; a slot freed early is not refilled. A failing task never cancels its
 * siblings or later chunks. Completion order within a chunk is unspecified, but the
 * returned list is in submission order.
 */
@Component
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    /** Notified once per chunk after every task in it has settled. */
    @FunctionalInterface
    public interface ChunkListener<T, R> {
        void onChunkSettled(int chunkIndex, List<TaskOutcome<T, R>> outcomes);
    }

    private final ExecutorService executor;

    public BatchScheduler(ExecutorService executor) {
        this.executor = executor;
    }

    public <T, R> List<TaskOutcome<T, R>> runBatch(List<T> tasks, int concurrencyLimit, Function<T, R> work) {
        return runBatch(tasks, concurrencyLimit, work, (chunk, outcomes) -> { });
    }

    public <T, R> List<TaskOutcome<T, R>> runBatch(List<T> tasks, int concurrencyLimit,
                                                   Function<T, R> work, ChunkListener<T, R> listener) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1, got " + concurrencyLimit);
        }
        var results = new ArrayList<TaskOutcome<T, R>>(tasks.size());
        int chunkIndex = 0;

        for (int start = 0; start < tasks.size(); start += concurrencyLimit) {
            int end = Math.min(start + concurrencyLimit, tasks.size());
            var futures = new ArrayList<CompletableFuture<TaskOutcome<T, R>>>(end - start);

            for (int i = start; i < end; i++) {
                final int index = i;
                final T task = tasks.get(i);
                futures.add(CompletableFuture
                        .supplyAsync(() -> work.apply(task), executor)
                        .handle((value, error) -> error == null
                                ? TaskOutcome.success(index, task, value)
                                : TaskOutcome.<T, R>failure(index, task, unwrap(error))));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            var chunkOutcomes = futures.stream().map(CompletableFuture::join).toList();
            long failed = chunkOutcomes.stream().filter(o -> !o.isSuccess()).count();
            log.info("Chunk {} settled: {} succeeded, {} failed", chunkIndex + 1,
                    chunkOutcomes.size() - failed, failed);

            listener.onChunkSettled(chunkIndex, chunkOutcomes);
            results.addAll(chunkOutcomes);
            chunkIndex++;
        }
        return results;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
