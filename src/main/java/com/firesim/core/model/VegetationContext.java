package com.firesim.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Vegetation formations sampled around the fire perimeter.
 *
 * @param centerFormation  formation at the perimeter centroid
 * @param centerClassName  finer vegetation class at the centroid; nullable
 * @param surrounding      compass point (north, southeast, ...) to formation name
 * @param uniqueFormations distinct formations across all sample points
 * @param dataSource       dataset identifier
 */
public record VegetationContext(
    String centerFormation,
    String centerClassName,
    Map<String, String> surrounding,
    List<String> uniqueFormations,
    String dataSource
) {

    public VegetationContext {
        surrounding = surrounding != null ? Map.copyOf(surrounding) : Map.of();
        uniqueFormations = uniqueFormations != null ? List.copyOf(uniqueFormations) : List.of();
    }

    /**
     * Renders the context as a sentence sequence suitable for appending to an image prompt.
     */
    public String toPromptText() {
        var lines = new ArrayList<String>();
        lines.add("Vegetation at the fire location: " + centerFormation);
        if (centerClassName != null && !centerClassName.equals(centerFormation)) {
            lines.add("(specifically: " + centerClassName + ")");
        }

        if (!surrounding.isEmpty()) {
            var differing = surrounding.entrySet().stream()
                    .filter(e -> !e.getValue().equals(centerFormation))
                    .sorted(Map.Entry.comparingByKey())
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("; "));
            if (differing.isEmpty()) {
                lines.add("Vegetation is uniformly " + centerFormation + " in all directions.");
            } else {
                lines.add("Surrounding vegetation varies: " + differing + ".");
            }
        }

        if (uniqueFormations.size() > 1) {
            lines.add("This area contains a mix of " + uniqueFormations.size()
                    + " vegetation formations: " + String.join(", ", uniqueFormations) + ".");
            lines.add("Show the correct vegetation type in each part of the landscape: "
                    + "ridgelines may have drier forest, gullies wetter forest, and flat areas grassland or cleared land.");
        }
        return String.join(" ", lines);
    }
}
