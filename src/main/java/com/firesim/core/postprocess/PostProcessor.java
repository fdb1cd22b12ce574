package com.firesim.core.postprocess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firesim.core.cost.CostEstimator;
import com.firesim.core.cost.PricingTier;
import com.firesim.core.cost.UsageTracker;
import com.firesim.core.model.GenerationResult;
import com.firesim.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-critical work done after a run's terminal state is durable: scenario metadata,
 * the markdown generation log and the cost estimate. Each step fails independently
 * and never affects the run.
 */
@Service
public class PostProcessor {

    private static final Logger log = LoggerFactory.getLogger(PostProcessor.class);

    private final ArtifactStore artifactStore;
    private final ObjectMapper objectMapper;
    private final GenerationLogWriter logWriter;
    private final CostEstimator costEstimator;
    private final UsageTracker usageTracker;

    public PostProcessor(ArtifactStore artifactStore, ObjectMapper objectMapper,
                         GenerationLogWriter logWriter, CostEstimator costEstimator,
                         UsageTracker usageTracker) {
        this.artifactStore = artifactStore;
        this.objectMapper = objectMapper;
        this.logWriter = logWriter;
        this.costEstimator = costEstimator;
        this.usageTracker = usageTracker;
    }

    public static String metadataKey(String runId) {
        return runId + "/metadata.json";
    }

    public static String generationLogKey(String runId) {
        return runId + "/generation-log.md";
    }

    public void process(CompletedRun run) {
        storeMetadata(run);
        storeGenerationLog(run);
        recordCost(run);
    }

    private void storeMetadata(CompletedRun run) {
        try {
            var request = run.request();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("id", run.runId());
            metadata.put("perimeter", request.perimeter());
            metadata.put("inputs", request.inputs());
            metadata.put("geoContext", request.geoContext());
            metadata.put("requestedViews", request.requestedViews());
            metadata.put("result", GenerationResult.from(run.progress()));
            metadata.put("promptVersion", run.promptSet() != null ? run.promptSet().templateVersion() : null);
            artifactStore.upload(metadataKey(run.runId()), objectMapper.writeValueAsBytes(metadata),
                    "application/json", Map.of("runId", run.runId()));
            log.info("Scenario metadata saved for run {}", run.runId());
        } catch (Exception e) {
            log.warn("Failed to save scenario metadata for run {} (non-fatal): {}", run.runId(), e.getMessage());
        }
    }

    private void storeGenerationLog(CompletedRun run) {
        try {
            var markdown = logWriter.render(run);
            artifactStore.upload(generationLogKey(run.runId()), markdown.getBytes(StandardCharsets.UTF_8),
                    "text/markdown", Map.of("runId", run.runId()));
            log.info("Generation log saved for run {}", run.runId());
        } catch (Exception e) {
            log.warn("Failed to save generation log for run {} (non-fatal): {}", run.runId(), e.getMessage());
        }
    }

    private void recordCost(CompletedRun run) {
        try {
            var tier = PricingTier.forGeneration(run.modelId(), run.quality());
            var breakdown = costEstimator.estimate(run.progress().getCompletedImages(), tier, run.uploadedBytes());
            usageTracker.record(run.runId(), breakdown);
            log.info("Cost estimated for run {}: ${} ({} images at ${})", run.runId(),
                    String.format("%.4f", breakdown.totalCost()), breakdown.images().count(),
                    breakdown.images().costPerImage());
        } catch (Exception e) {
            log.warn("Cost tracking failed for run {} (non-fatal): {}", run.runId(), e.getMessage());
        }
    }
}
