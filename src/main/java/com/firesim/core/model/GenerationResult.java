package com.firesim.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Caller-facing projection of a run. Pending and in-progress runs mean "not ready yet".
 */
public record GenerationResult(
    String id,
    RunStatus status,
    List<GeneratedImage> images,
    GeneratedImage anchorImage,
    Integer seed,
    Instant createdAt,
    Instant completedAt,
    String error,
    String thinkingText
) {

    public static GenerationResult from(RunProgress progress) {
        return new GenerationResult(
                progress.getRunId(),
                progress.getStatus(),
                List.copyOf(progress.getImages()),
                progress.getAnchorImage(),
                progress.getSeed(),
                progress.getCreatedAt(),
                progress.getCompletedAt(),
                progress.getError(),
                progress.getThinkingText());
    }
}
