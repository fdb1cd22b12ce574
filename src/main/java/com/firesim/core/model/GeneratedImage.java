package com.firesim.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One uploaded image. Immutable once created.
 */
public record GeneratedImage(
    ViewPoint viewPoint,
    String url,
    Metadata metadata
) {

    /**
     * @param prompt             exact prompt text sent to the provider
     * @param model              provider/model identifier
     * @param seed               seed used; nullable
     * @param isAnchor           true for the anchor view
     * @param usedReferenceImage true when the anchor bytes conditioned this view
     */
    public record Metadata(
        int width,
        int height,
        String prompt,
        String model,
        Integer seed,
        Instant generatedAt,
        @JsonProperty("isAnchor") boolean isAnchor,
        boolean usedReferenceImage
    ) {}
}
