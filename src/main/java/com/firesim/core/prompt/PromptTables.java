package com.firesim.core.prompt;

import com.firesim.core.model.ViewPoint;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables mapping scenario vocabulary onto photographic language.
 */
final class PromptTables {

    private PromptTables() {}

    record IntensityVisuals(String flameHeight, String smoke, String crownInvolvement,
                            String spotting, String descriptor) {}

    static final Map<String, IntensityVisuals> INTENSITY_VISUALS = Map.of(
            "low", new IntensityVisuals("0.5 to 1.5 metres", "light grey smoke drifting upward",
                    "surface fire only, no crown involvement", "no spotting activity",
                    "Low intensity surface fire"),
            "moderate", new IntensityVisuals("1.5 to 3 metres", "grey-white smoke columns rising steadily",
                    "occasional torching of individual trees", "minimal short-range spotting",
                    "Moderate intensity with occasional tree torching"),
            "high", new IntensityVisuals("3 to 10 metres", "dense grey-black smoke columns",
                    "intermittent crown fire with active runs", "short-range spotting occurring",
                    "High intensity with intermittent crown fire"),
            "veryHigh", new IntensityVisuals("10 to 20 metres",
                    "massive dark smoke columns forming pyrocumulus cloud",
                    "active crown fire with sustained crowning", "medium-range spotting ahead of the head fire",
                    "Very high intensity, active crown fire"),
            "extreme", new IntensityVisuals("20+ metres",
                    "towering pyrocumulonimbus cloud with dense ember rain",
                    "full crown fire with complete canopy involvement",
                    "long-range spotting creating spot fires kilometres ahead",
                    "Extreme intensity, full crown fire with ember attack"),
            "catastrophic", new IntensityVisuals("30+ metres",
                    "massive pyrocumulonimbus system with severe turbulence and ember storms",
                    "total canopy consumption with erratic fire behaviour",
                    "extensive long-range mass spotting overwhelming suppression capacity",
                    "Catastrophic intensity, erratic fire behaviour"));

    static final Map<String, String> TIME_OF_DAY_LIGHTING = Map.of(
            "dawn", "Soft golden light from the east, long shadows across the landscape, cool blue sky transitioning to warm tones",
            "morning", "Bright morning sun from the east, clear visibility, crisp natural lighting",
            "midday", "Harsh overhead sun, short shadows, washed-out pale sky above the smoke",
            "afternoon", "Warm afternoon light from the west, golden-orange tones, lengthening shadows",
            "dusk", "Deep orange and red sunset sky, fire glow visible against fading light, dramatic contrast",
            "night", "Dark scene lit primarily by the fire itself, intense orange glow reflecting off smoke, dark sky above");

    static final Map<ViewPoint, String> VIEWPOINT_PERSPECTIVES = new EnumMap<>(Map.ofEntries(
            Map.entry(ViewPoint.AERIAL, "Aerial photograph taken from a helicopter or drone at 300 metres altitude, looking straight down at the fire"),
            Map.entry(ViewPoint.HELICOPTER_NORTH, "Elevated wide-angle photograph from a helicopter north of the fire at 150 metres altitude, looking south at the fire front from an oblique angle"),
            Map.entry(ViewPoint.HELICOPTER_SOUTH, "Elevated wide-angle photograph from a helicopter south of the fire at 150 metres altitude, looking north across the burned area and active fire"),
            Map.entry(ViewPoint.HELICOPTER_EAST, "Elevated wide-angle photograph from a helicopter east of the fire at 150 metres altitude, looking west at the flank of the fire"),
            Map.entry(ViewPoint.HELICOPTER_WEST, "Elevated wide-angle photograph from a helicopter west of the fire at 150 metres altitude, looking east at the flank of the fire"),
            Map.entry(ViewPoint.HELICOPTER_ABOVE, "Elevated aerial photograph from directly above the fire at 200 metres altitude, capturing the full extent of the fire perimeter and smoke plume"),
            Map.entry(ViewPoint.GROUND_NORTH, "Ground-level photograph taken from the north side of the fire, approximately 500 metres away, looking south towards the flame front at eye level"),
            Map.entry(ViewPoint.GROUND_SOUTH, "Ground-level photograph taken from the south side looking north, showing the burned area with fire visible in the distance"),
            Map.entry(ViewPoint.GROUND_EAST, "Ground-level photograph taken from the east looking west towards the fire, capturing the flank of the fire at eye level"),
            Map.entry(ViewPoint.GROUND_WEST, "Ground-level photograph taken from the west looking east towards the fire, capturing the flank of the fire at eye level"),
            Map.entry(ViewPoint.GROUND_ABOVE, "Ground-level photograph from slightly elevated terrain looking across the fire area, showing the full fire perimeter and smoke column"),
            Map.entry(ViewPoint.RIDGE, "Wide-angle photograph from a ridgeline overlooking the fire area, approximately 300 metres above the fire, capturing the broader landscape context")));

    static final Map<String, String> FIRE_STAGES = Map.of(
            "spotFire", "spot fire",
            "developing", "developing bushfire",
            "established", "established bushfire",
            "major", "major bushfire campaign fire");

    static final Map<String, String> VEGETATION_DESCRIPTORS = Map.ofEntries(
            Map.entry("Dry Sclerophyll Forest", "dry eucalyptus forest with sparse understorey and leaf litter"),
            Map.entry("Wet Sclerophyll Forest", "tall wet eucalyptus forest with dense fern understorey"),
            Map.entry("Grassland", "open grassland with cured dry grass"),
            Map.entry("Heath", "low dense coastal heath and scrubland"),
            Map.entry("Rainforest", "subtropical rainforest with dense canopy"),
            Map.entry("Grassy Woodland", "open woodland with scattered eucalypts over native grasses"),
            Map.entry("Cumberland Plain Woodland", "dry woodland on shale with sparse canopy and grassy groundlayer"),
            Map.entry("Riverine Forest", "eucalypt forest along waterways with moist understorey"),
            Map.entry("Swamp Sclerophyll Forest", "wet sclerophyll forest on poorly drained soils with paperbark and swamp mahogany"),
            Map.entry("Coastal Sand Heath", "wind-shaped coastal heath on sandy ridges with banksia and tea-tree"),
            Map.entry("Alpine Complex", "alpine heath and grass mosaic with stunted shrubs and herbfields"),
            Map.entry("Plantation Forest", "structured plantation rows with dense fuel between tree lines"),
            Map.entry("Cleared/Urban", "cleared land or urban area with minimal vegetation and structures"));

    static final Map<String, String> NEARBY_FEATURES = Map.of(
            "road", "A road runs nearby",
            "escarpment", "A steep escarpment lies to one side",
            "river", "A river valley is visible in the landscape",
            "residential_area", "Residential areas are visible in the distance",
            "rural_residential", "Rural properties are scattered through the area");

    /** Wind blows from the key; the head fire runs toward the value. */
    static final Map<String, String> DOWNWIND = Map.of(
            "N", "south", "NE", "southwest", "E", "west", "SE", "northwest",
            "S", "north", "SW", "northeast", "W", "east", "NW", "southeast");

    static final List<String> BLOCKED_TERMS = List.of(
            "explosion", "destruction", "casualties", "violence", "death", "people", "human",
            "person", "animal", "wildlife", "injury", "victim", "destroy", "devastation");
}
