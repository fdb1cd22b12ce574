package com.firesim.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.firesim.core.model.GeneratedImage;
import com.firesim.core.model.RunProgress;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for the run status endpoint.
 */
public record GenerationStatusResponse(
    @JsonProperty("run_id") String runId,
    String status,
    String progress,
    @JsonProperty("total_images") int totalImages,
    @JsonProperty("completed_images") int completedImages,
    @JsonProperty("failed_images") int failedImages,
    List<GeneratedImage> images,
    @JsonProperty("anchor_image") GeneratedImage anchorImage,
    Integer seed,
    String error,
    @JsonProperty("thinking_text") String thinkingText,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public static GenerationStatusResponse from(RunProgress p) {
        return new GenerationStatusResponse(
                p.getRunId(),
                p.getStatus().wireValue(),
                p.getCompletedImages() + "/" + p.getTotalImages() + " images",
                p.getTotalImages(),
                p.getCompletedImages(),
                p.getFailedImages(),
                List.copyOf(p.getImages()),
                p.getAnchorImage(),
                p.getSeed(),
                p.getError(),
                p.getThinkingText(),
                p.getCreatedAt(),
                p.getUpdatedAt());
    }
}
