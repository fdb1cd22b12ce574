package com.firesim.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inbound scenario description for one run.
 *
 * @param perimeter               fire perimeter polygon
 * @param inputs                  weather and fire-behaviour parameters
 * @param geoContext              geospatial context for the perimeter; nullable
 * @param requestedViews          ordered viewpoints; duplicates are kept
 * @param seed                    fixed seed; nullable, drawn at start when absent
 * @param mapScreenshots          viewpoint id to base64 (or data URL) map screenshot; nullable
 * @param vegetationMapScreenshot base64 vegetation overlay screenshot; nullable
 */
public record GenerationRequest(
    FirePerimeter perimeter,
    ScenarioInputs inputs,
    GeoContext geoContext,
    List<ViewPoint> requestedViews,
    Integer seed,
    Map<String, String> mapScreenshots,
    String vegetationMapScreenshot
) {

    public GenerationRequest {
        requestedViews = requestedViews != null ? List.copyOf(requestedViews) : List.of();
        mapScreenshots = mapScreenshots != null ? Map.copyOf(mapScreenshots) : Map.of();
    }

    public Optional<String> screenshotFor(ViewPoint viewPoint) {
        var shot = mapScreenshots.get(viewPoint.id());
        return shot == null || shot.isBlank() ? Optional.empty() : Optional.of(shot);
    }

    /** First {@code max} requested views, in request order. */
    public List<ViewPoint> cappedViews(int max) {
        return requestedViews.size() <= max ? requestedViews : requestedViews.subList(0, max);
    }

    public GenerationRequest withRequestedViews(List<ViewPoint> views) {
        return new GenerationRequest(perimeter, inputs, geoContext, views, seed,
                mapScreenshots, vegetationMapScreenshot);
    }

    public GenerationRequest withSeed(int newSeed) {
        return new GenerationRequest(perimeter, inputs, geoContext, requestedViews, newSeed,
                mapScreenshots, vegetationMapScreenshot);
    }
}
