package com.firesim.core.model;

import java.util.List;

/**
 * Geographic context derived from geospatial datasets for the perimeter.
 */
public record GeoContext(
    String vegetationType,
    String manualVegetationType,
    Range elevation,
    Range slope,
    String aspect,
    List<String> nearbyFeatures,
    String locality,
    String dataSource,
    String confidence
) {

    public record Range(double min, double max, double mean) {}

    /** Manual override wins over the detected vegetation type. */
    public String effectiveVegetationType() {
        if (manualVegetationType != null && !manualVegetationType.isBlank()) {
            return manualVegetationType;
        }
        return vegetationType;
    }
}
