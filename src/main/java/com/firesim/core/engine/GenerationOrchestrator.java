package com.firesim.core.engine;

import com.firesim.config.FiresimProperties;
import com.firesim.core.consistency.ConsistencyScorer;
import com.firesim.core.enrichment.VegetationLookup;
import com.firesim.core.generation.RetryingImageGenerator;
import com.firesim.core.logging.MdcContext;
import com.firesim.core.metrics.GenerationMetrics;
import com.firesim.core.model.GeneratedImage;
import com.firesim.core.model.GenerationRequest;
import com.firesim.core.model.GenerationResult;
import com.firesim.core.model.RunProgress;
import com.firesim.core.model.RunStatus;
import com.firesim.core.model.VegetationContext;
import com.firesim.core.model.ViewPoint;
import com.firesim.core.postprocess.CompletedRun;
import com.firesim.core.postprocess.PostProcessor;
import com.firesim.core.progress.ProgressStore;
import com.firesim.core.prompt.PromptBuilder;
import com.firesim.core.prompt.PromptSet;
import com.firesim.core.scheduler.BatchScheduler;
import com.firesim.core.scheduler.TaskOutcome;
import com.firesim.provider.ImageGenOptions;
import com.firesim.provider.ImageGenResult;
import com.firesim.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the anchor-then-derived-views generation pipeline.
 *
 * <p>{@link #start} returns a run id immediately and executes the run on a detached
 * task. The anchor view is generated alone first; every remaining view is then
 * generated in concurrency-limited chunks, conditioned on the anchor's bytes. Individual
 * view failures are counted, not escalated: a run fails only when every view failed or
 * when the pipeline itself throws.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    public static final int MAX_SEED_VALUE = 1_000_000;

    private final PromptBuilder promptBuilder;
    private final RetryingImageGenerator generator;
    private final BatchScheduler batchScheduler;
    private final ProgressStore progressStore;
    private final ArtifactStore artifactStore;
    private final ConsistencyScorer consistencyScorer;
    private final PostProcessor postProcessor;
    private final VegetationLookup vegetationLookup;
    private final GenerationMetrics metrics;
    private final ExecutorService executor;
    private final Clock clock;
    private final int maxViewpoints;
    private final double referenceStrength;
    private final Duration accessUrlTtl;
    private final String quality;

    public GenerationOrchestrator(PromptBuilder promptBuilder,
                                  RetryingImageGenerator generator,
                                  BatchScheduler batchScheduler,
                                  ProgressStore progressStore,
                                  ArtifactStore artifactStore,
                                  ConsistencyScorer consistencyScorer,
                                  PostProcessor postProcessor,
                                  VegetationLookup vegetationLookup,
                                  @Autowired(required = false) GenerationMetrics metrics,
                                  ExecutorService executor,
                                  Clock clock,
                                  FiresimProperties properties) {
        this.promptBuilder = promptBuilder;
        this.generator = generator;
        this.batchScheduler = batchScheduler;
        this.progressStore = progressStore;
        this.artifactStore = artifactStore;
        this.consistencyScorer = consistencyScorer;
        this.postProcessor = postProcessor;
        this.vegetationLookup = vegetationLookup;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        this.maxViewpoints = properties.getRun().getMaxViewpoints();
        this.referenceStrength = properties.getRun().getReferenceStrength();
        this.accessUrlTtl = Duration.ofHours(properties.getStorage().getAccessUrlTtlHours());
        this.quality = properties.getGenerator().getDefaultQuality();
    }

    /**
     * Accepts a request and launches it without blocking.
     *
     * @return the run id
     * @throws IllegalArgumentException if the request names no viewpoints
     */
    public String start(GenerationRequest request) {
        if (request == null || request.requestedViews().isEmpty()) {
            throw new IllegalArgumentException("At least one viewpoint must be requested");
        }
        String runId = UUID.randomUUID().toString();
        int seed = request.seed() != null ? request.seed() : ThreadLocalRandom.current().nextInt(MAX_SEED_VALUE);
        var views = request.cappedViews(maxViewpoints);
        if (views.size() < request.requestedViews().size()) {
            log.info("Run {}: dropping {} viewpoints beyond the limit of {}", runId,
                    request.requestedViews().size() - views.size(), maxViewpoints);
        }
        var resolved = request.withRequestedViews(views).withSeed(seed);

        progressStore.create(runId, RunProgress.pending(runId, views.size(), seed, clock.instant()));
        progressStore.persist(runId, true);
        log.info("Accepted run {} ({} viewpoints, seed {}), launching async execution", runId, views.size(), seed);

        executor.execute(() -> runDetached(runId, resolved));
        return runId;
    }

    public Optional<RunProgress> getStatus(String runId) {
        return progressStore.get(runId);
    }

    /** Pending and in-progress runs come back with a non-terminal status, meaning "not ready yet". */
    public Optional<GenerationResult> getResults(String runId) {
        return progressStore.get(runId).map(GenerationResult::from);
    }

    /** Error boundary of the detached task: anything escaping the pipeline fails the run. */
    private void runDetached(String runId, GenerationRequest request) {
        MdcContext.setRun(runId);
        try {
            execute(runId, request);
        } catch (Exception e) {
            log.error("Run {} failed", runId, e);
            markFailed(runId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            MdcContext.clear();
        }
    }

    void execute(String runId, GenerationRequest request) {
        long startMs = clock.millis();
        progressStore.mutate(runId, p -> p.transitionTo(RunStatus.IN_PROGRESS, clock.instant()));

        PromptSet promptSet = promptBuilder.build(request);
        VegetationContext vegetation = enrichVegetation(runId, request);
        String vegetationText = vegetation != null ? vegetation.toPromptText() : null;

        var views = request.requestedViews();
        int anchorPosition = selectAnchor(views);
        var anchorView = views.get(anchorPosition);
        var provider = generator.provider();
        boolean imageInput = provider.supportsReferenceImage();
        var baseOptions = ImageGenOptions.empty()
                .withSeed(request.seed())
                .withVegetationPromptText(vegetationText);
        if (provider.supportsStreaming()) {
            baseOptions = baseOptions.withThinkingCallback(text -> recordThinking(runId, text));
        }
        if (!imageInput) {
            log.info("Run {}: {} takes no image input; views are generated from prompts alone",
                    runId, provider.modelId());
        }

        var modelResponses = Collections.synchronizedList(new ArrayList<CompletedRun.ModelResponse>());
        var uploadedBytes = new AtomicLong();

        // Pass 1: the anchor, alone
        byte[] anchorBytes = null;
        log.info("Run {}: generating anchor view {}", runId, anchorView);
        var anchorTask = new GenerationTask(anchorPosition, anchorView,
                promptSet.promptAt(anchorPosition, anchorView).orElse(null),
                imageInput ? baseOptions.withMapScreenshot(request.screenshotFor(anchorView).orElse(null)) : baseOptions);
        try {
            var generated = generateAndUpload(runId, anchorTask, true);
            anchorBytes = generated.bytes();
            uploadedBytes.addAndGet(generated.bytes().length);
            collectResponse(modelResponses, anchorView, generated.modelTextResponse());
            progressStore.mutate(runId, p -> p.recordImage(generated.image(), true, clock.instant()));
            progressStore.persist(runId, true);
            recordImageMetric("success", true);
            log.info("Run {}: anchor {} ready at {}", runId, anchorView, generated.image().url());
        } catch (Exception e) {
            log.warn("Run {}: anchor {} failed, continuing without reference image: {}", runId, anchorView, e.getMessage());
            progressStore.mutate(runId, p -> {
                p.recordFailure(clock.instant());
                p.appendError("Anchor image (" + anchorView.id() + ") failed: " + e.getMessage(), clock.instant());
            });
            recordImageMetric("failure", true);
            if (metrics != null) {
                metrics.recordViewpointError(anchorView.id());
            }
        }

        // Pass 2: everything else, conditioned on the anchor
        var tasks = new ArrayList<GenerationTask>();
        for (int i = 0; i < views.size(); i++) {
            if (i == anchorPosition) {
                continue;
            }
            var view = views.get(i);
            var options = baseOptions;
            if (imageInput) {
                var screenshot = request.screenshotFor(view);
                if (screenshot.isPresent()) {
                    options = baseOptions.withMapScreenshot(screenshot.get());
                } else if (anchorBytes != null) {
                    options = baseOptions.withReference(anchorBytes, referenceStrength);
                }
            }
            tasks.add(new GenerationTask(i, view, promptSet.promptAt(i, view).orElse(null), options));
        }

        if (!tasks.isEmpty()) {
            int concurrency = Math.max(1, provider.maxConcurrent());
            log.info("Run {}: generating {} derived views, {} at a time", runId, tasks.size(), concurrency);
            batchScheduler.<GenerationTask, Generated>runBatch(tasks, concurrency,
                    task -> generateAndUpload(runId, task, false),
                    (chunk, outcomes) -> {
                        for (var outcome : outcomes) {
                            fold(runId, outcome, modelResponses, uploadedBytes);
                        }
                    });
        }

        // Score, then settle the terminal state
        var snapshot = progressStore.get(runId).orElseThrow();
        String reportText = null;
        if (snapshot.getImages().size() > 1) {
            var report = consistencyScorer.score(snapshot.getImages(), request.inputs(), snapshot.getAnchorImage());
            reportText = consistencyScorer.generateReport(report);
            if (metrics != null) {
                metrics.recordConsistencyScore(report.score());
            }
            log.info("Run {}: consistency score {}/100 ({})", runId, report.score(), report.passed() ? "passed" : "failed");
            if (!report.passed()) {
                log.warn("Run {}: low consistency score {}: {}", runId, report.score(), report.warnings());
                progressStore.mutate(runId, p -> p.appendError(
                        "Consistency warnings: " + String.join("; ", report.warnings()), clock.instant()));
            }
        }

        var terminal = progressStore.mutate(runId, p -> {
            var now = clock.instant();
            if (p.allFailed()) {
                if (p.getError() == null || p.getError().isBlank()) {
                    p.appendError("All " + p.getTotalImages() + " image generations failed", now);
                }
                p.transitionTo(RunStatus.FAILED, now);
            } else {
                if (p.isPartialSuccess()) {
                    p.appendError("Partial success: " + p.getCompletedImages() + " succeeded, "
                            + p.getFailedImages() + " failed", now);
                }
                p.transitionTo(RunStatus.COMPLETED, now);
            }
        });
        progressStore.persist(runId, true);

        long elapsed = clock.millis() - startMs;
        if (metrics != null) {
            metrics.recordRunResult(terminal.getStatus().wireValue());
            metrics.recordRunDuration(elapsed);
        }
        log.info("Run {} {}: {} succeeded, {} failed in {}ms", runId, terminal.getStatus().wireValue(),
                terminal.getCompletedImages(), terminal.getFailedImages(), elapsed);

        // Terminal state is durable; nothing below may change it
        try {
            postProcessor.process(new CompletedRun(runId, request, promptSet, terminal, generator.provider().modelId(),
                    quality, List.copyOf(modelResponses), vegetation, reportText, uploadedBytes.get(), clock.instant()));
        } catch (Exception e) {
            log.warn("Run {}: post-processing failed (non-fatal): {}", runId, e.getMessage());
        }
    }

    /**
     * First ground-level view, else the overhead helicopter view, else the aerial view,
     * else the first requested view.
     */
    static int selectAnchor(List<ViewPoint> views) {
        for (int i = 0; i < views.size(); i++) {
            if (views.get(i).isGroundLevel()) {
                return i;
            }
        }
        int overhead = views.indexOf(ViewPoint.HELICOPTER_ABOVE);
        if (overhead >= 0) {
            return overhead;
        }
        int aerial = views.indexOf(ViewPoint.AERIAL);
        return aerial >= 0 ? aerial : 0;
    }

    public static String imageKey(String runId, ViewPoint viewPoint, int position) {
        return runId + "/" + viewPoint.id() + "-" + position + ".png";
    }

    private record Generated(GeneratedImage image, byte[] bytes, String modelTextResponse) {}

    private Generated generateAndUpload(String runId, GenerationTask task, boolean anchor) {
        MdcContext.setViewpoint(runId, task.viewPoint().id());
        try {
            if (task.promptText() == null) {
                throw new IllegalStateException("No prompt was built for viewpoint " + task.viewPoint().id());
            }
            ImageGenResult result = generator.generateImage(task.promptText(), task.options());
            var locator = artifactStore.upload(imageKey(runId, task.viewPoint(), task.position()),
                    result.imageData(), "image/" + result.format(),
                    Map.of("runId", runId, "viewpoint", task.viewPoint().id()));
            var url = artifactStore.mintAccessUrl(locator, accessUrlTtl);
            var meta = result.metadata();
            var image = new GeneratedImage(task.viewPoint(), url, new GeneratedImage.Metadata(
                    meta.width(), meta.height(), task.promptText(), meta.model(),
                    task.options().seed(), clock.instant(), anchor, task.options().hasConditioningImage()));
            return new Generated(image, result.imageData(), result.modelTextResponse());
        } finally {
            if (anchor) {
                MdcContext.clearViewpoint();
            } else {
                MdcContext.clear();
            }
        }
    }

    private void fold(String runId, TaskOutcome<GenerationTask, Generated> outcome,
                      List<CompletedRun.ModelResponse> modelResponses, AtomicLong uploadedBytes) {
        var view = outcome.task().viewPoint();
        if (outcome.isSuccess()) {
            var generated = outcome.value();
            uploadedBytes.addAndGet(generated.bytes().length);
            collectResponse(modelResponses, view, generated.modelTextResponse());
            progressStore.mutate(runId, p -> p.recordImage(generated.image(), false, clock.instant()));
            recordImageMetric("success", false);
        } else {
            log.warn("Run {}: view {} failed: {}", runId, view, outcome.errorMessage());
            progressStore.mutate(runId, p -> p.recordFailure(clock.instant()));
            recordImageMetric("failure", false);
            if (metrics != null) {
                metrics.recordViewpointError(view.id());
            }
        }
    }

    private VegetationContext enrichVegetation(String runId, GenerationRequest request) {
        if (request.perimeter() == null) {
            return null;
        }
        try {
            var context = vegetationLookup.lookup(request.perimeter().centroid(), request.perimeter().boundingBox());
            context.ifPresent(c -> log.info("Run {}: vegetation context {} ({} formations)", runId,
                    c.centerFormation(), c.uniqueFormations().size()));
            return context.orElse(null);
        } catch (Exception e) {
            log.warn("Run {}: vegetation lookup failed, continuing without it: {}", runId, e.getMessage());
            return null;
        }
    }

    private void recordThinking(String runId, String text) {
        progressStore.mutate(runId, p -> {
            if (!p.getStatus().isTerminal()) {
                p.updateThinking(text, clock.instant());
            }
        });
    }

    private void markFailed(String runId, String message) {
        try {
            progressStore.mutate(runId, p -> {
                var now = clock.instant();
                if (p.getStatus().isTerminal()) {
                    return;
                }
                if (p.getStatus() == RunStatus.PENDING) {
                    p.transitionTo(RunStatus.IN_PROGRESS, now);
                }
                p.appendError(message, now);
                p.transitionTo(RunStatus.FAILED, now);
            });
            progressStore.persist(runId, true);
            if (metrics != null) {
                metrics.recordRunResult(RunStatus.FAILED.wireValue());
            }
        } catch (RuntimeException e) {
            log.error("Run {}: could not record failure state", runId, e);
        }
    }

    private static void collectResponse(List<CompletedRun.ModelResponse> responses, ViewPoint view, String text) {
        if (text != null && !text.isBlank()) {
            responses.add(new CompletedRun.ModelResponse(view.id(), text));
        }
    }

    private void recordImageMetric(String outcome, boolean anchor) {
        if (metrics != null) {
            metrics.recordImage(outcome, anchor);
        }
    }
}
