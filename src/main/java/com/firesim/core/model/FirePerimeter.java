package com.firesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * GeoJSON polygon feature drawn around the fire.
 * Coordinates are {@code [ring][point][lng, lat]}; only the outer ring is used.
 */
public record FirePerimeter(
    String type,
    Geometry geometry,
    Map<String, Object> properties
) {

    public record Geometry(String type, List<List<List<Double>>> coordinates) {}

    @JsonIgnore
    public List<List<Double>> outerRing() {
        if (geometry == null || geometry.coordinates() == null || geometry.coordinates().isEmpty()) {
            return List.of();
        }
        return geometry.coordinates().get(0);
    }

    /**
     * Arithmetic mean of the distinct outer ring vertices as {@code [lng, lat]}.
     * A closing point that repeats the first vertex is counted once.
     */
    public double[] centroid() {
        var ring = outerRing();
        if (ring.isEmpty()) {
            throw new IllegalStateException("Perimeter has no coordinates");
        }
        int count = ring.size();
        if (count > 1 && samePoint(ring.get(0), ring.get(count - 1))) {
            count--;
        }
        double lng = 0;
        double lat = 0;
        for (int i = 0; i < count; i++) {
            lng += ring.get(i).get(0);
            lat += ring.get(i).get(1);
        }
        return new double[]{lng / count, lat / count};
    }

    private static boolean samePoint(List<Double> a, List<Double> b) {
        return a.get(0).equals(b.get(0)) && a.get(1).equals(b.get(1));
    }

    /** {@code [minLng, minLat, maxLng, maxLat]} of the outer ring. */
    public double[] boundingBox() {
        var ring = outerRing();
        if (ring.isEmpty()) {
            throw new IllegalStateException("Perimeter has no coordinates");
        }
        double minLng = Double.POSITIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLng = Double.NEGATIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (var point : ring) {
            minLng = Math.min(minLng, point.get(0));
            minLat = Math.min(minLat, point.get(1));
            maxLng = Math.max(maxLng, point.get(0));
            maxLat = Math.max(maxLat, point.get(1));
        }
        return new double[]{minLng, minLat, maxLng, maxLat};
    }
}
