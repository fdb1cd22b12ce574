package com.firesim.core.enrichment;

import com.firesim.core.model.VegetationContext;

import java.util.Optional;

/**
 * Geospatial vegetation dataset query around a fire perimeter.
 */
public interface VegetationLookup {

    /**
     * @param centroid    {@code [lng, lat]}
     * @param boundingBox {@code [minLng, minLat, maxLng, maxLat]}
     * @return formations around the perimeter, or empty where the dataset has no coverage
     */
    Optional<VegetationContext> lookup(double[] centroid, double[] boundingBox);
}
