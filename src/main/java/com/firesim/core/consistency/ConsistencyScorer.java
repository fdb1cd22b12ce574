package com.firesim.core.consistency;

import com.firesim.core.model.GeneratedImage;
import com.firesim.core.model.ScenarioInputs;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based consistency scoring over image metadata and prompt text.
 * Pixels are never inspected; every check is a heuristic over what was asked for.
 */
@Component
public class ConsistencyScorer {

    public static final int PASS_THRESHOLD = 70;

    static final String SMOKE_DIRECTION = "Smoke Direction Consistency";
    static final String FIRE_SIZE = "Fire Size Proportionality";
    static final String LIGHTING = "Lighting Consistency";
    static final String COLOR_PALETTE = "Color Palette Similarity";

    private static final Map<String, Double> WEIGHTS = Map.of(
            SMOKE_DIRECTION, 0.30,
            FIRE_SIZE, 0.20,
            LIGHTING, 0.25,
            COLOR_PALETTE, 0.25);

    private static final Map<String, List<String>> COMPASS_SYNONYMS = Map.of(
            "N", List.of("n", "north", "northerly"),
            "NE", List.of("ne", "northeast", "north-east", "north east", "northeasterly"),
            "E", List.of("e", "east", "easterly"),
            "SE", List.of("se", "southeast", "south-east", "south east", "southeasterly"),
            "S", List.of("s", "south", "southerly"),
            "SW", List.of("sw", "southwest", "south-west", "south west", "southwesterly"),
            "W", List.of("w", "west", "westerly"),
            "NW", List.of("nw", "northwest", "north-west", "north west", "northwesterly"));

    private static final Map<String, List<String>> LIGHTING_KEYWORDS = Map.of(
            "dawn", List.of("dawn", "sunrise", "golden", "first light"),
            "morning", List.of("morning", "bright", "east"),
            "midday", List.of("midday", "noon", "overhead"),
            "afternoon", List.of("afternoon", "golden", "west"),
            "dusk", List.of("dusk", "sunset", "twilight", "golden"),
            "night", List.of("night", "dark", "glow"));

    public ConsistencyReport score(List<GeneratedImage> images, ScenarioInputs inputs, GeneratedImage anchorImage) {
        var checks = List.of(
                smokeDirection(images, inputs),
                fireSize(images, anchorImage),
                lighting(images, inputs),
                colorPalette(images));

        var warnings = checks.stream()
                .filter(c -> !c.passed())
                .map(ConsistencyCheck::message)
                .toList();

        int overall = overallScore(checks);
        boolean passed = overall >= PASS_THRESHOLD;

        var recommendations = new ArrayList<String>();
        if (!passed) {
            recommendations.add("Consider regenerating images with a different seed for better consistency");
            for (var check : checks) {
                if (check.passed()) {
                    continue;
                }
                switch (check.name()) {
                    case SMOKE_DIRECTION -> recommendations.add(
                            "Include the wind direction in all prompts so smoke drift is specified consistently");
                    case LIGHTING -> recommendations.add(
                            "State the time of day and its lighting in every prompt");
                    case COLOR_PALETTE -> recommendations.add(
                            "Generate every view with the same model and seed, or colour-grade the set afterwards");
                    case FIRE_SIZE -> recommendations.add(
                            "Request views from more than one vantage type (aerial, helicopter, ground)");
                    default -> { }
                }
            }
        }
        return new ConsistencyReport(overall, passed, checks, warnings, recommendations);
    }

    ConsistencyCheck smokeDirection(List<GeneratedImage> images, ScenarioInputs inputs) {
        var label = inputs.windDirection() != null ? inputs.windDirection().toUpperCase(Locale.ROOT) : "";
        var terms = COMPASS_SYNONYMS.getOrDefault(label, label.isEmpty() ? List.of() : List.of(label.toLowerCase(Locale.ROOT)));
        var pattern = wordPattern(terms);
        boolean mentioned = pattern != null && images.stream().anyMatch(img -> pattern.matcher(promptOf(img)).find());
        return mentioned
                ? new ConsistencyCheck(SMOKE_DIRECTION, true, 100,
                        "Smoke direction aligned with wind (" + inputs.windDirection() + ")")
                : new ConsistencyCheck(SMOKE_DIRECTION, false, 0,
                        "Inconsistent smoke direction: no prompt mentions the " + inputs.windDirection() + " wind");
    }

    ConsistencyCheck fireSize(List<GeneratedImage> images, GeneratedImage anchorImage) {
        var categories = images.stream()
                .map(img -> img.viewPoint().category())
                .collect(Collectors.toSet());
        boolean multiple = categories.size() > 1;
        int score = multiple && anchorImage != null ? 100 : multiple ? 70 : 50;
        boolean passed = score >= PASS_THRESHOLD;
        return new ConsistencyCheck(FIRE_SIZE, passed, score, passed
                ? "Fire scale appears consistent across viewpoint types"
                : "Limited viewpoint variety: unable to verify fire size consistency");
    }

    ConsistencyCheck lighting(List<GeneratedImage> images, ScenarioInputs inputs) {
        var timeOfDay = inputs.timeOfDay() != null ? inputs.timeOfDay().toLowerCase(Locale.ROOT) : "";
        var terms = new ArrayList<String>();
        if (!timeOfDay.isEmpty()) {
            terms.add(timeOfDay);
        }
        terms.addAll(LIGHTING_KEYWORDS.getOrDefault(timeOfDay, List.of()));
        var pattern = wordPattern(terms);

        long matching = pattern == null ? 0 : images.stream()
                .filter(img -> pattern.matcher(promptOf(img)).find())
                .count();
        int score = images.isEmpty() ? 0 : (int) Math.round(matching * 100.0 / images.size());
        boolean passed = score == 100;
        return new ConsistencyCheck(LIGHTING, passed, score, passed
                ? "Lighting consistent with " + inputs.timeOfDay() + " conditions"
                : "Inconsistent lighting: " + (images.size() - matching) + " of " + images.size()
                        + " prompts do not describe " + inputs.timeOfDay() + " conditions");
    }

    ConsistencyCheck colorPalette(List<GeneratedImage> images) {
        var models = new HashSet<String>();
        var seeds = new HashSet<Integer>();
        for (var img : images) {
            models.add(img.metadata().model());
            if (img.metadata().seed() != null) {
                seeds.add(img.metadata().seed());
            }
        }
        boolean sameModel = models.size() <= 1;
        boolean sameSeed = seeds.size() <= 1;
        int score = sameModel && sameSeed ? 100 : sameModel ? 80 : sameSeed ? 60 : 40;
        boolean passed = score == 100;

        String message;
        if (passed) {
            message = "Color palette likely consistent (same model and seed)";
        } else if (!sameModel && !sameSeed) {
            message = "Color palette may vary: images came from " + models.size() + " models with "
                    + seeds.size() + " seeds";
        } else if (!sameModel) {
            message = "Color palette may vary: images came from " + models.size() + " models";
        } else {
            message = "Color palette may vary: images used " + seeds.size() + " different seeds";
        }
        return new ConsistencyCheck(COLOR_PALETTE, passed, score, message);
    }

    static int overallScore(List<ConsistencyCheck> checks) {
        double weighted = 0;
        double total = 0;
        for (var check : checks) {
            double weight = WEIGHTS.getOrDefault(check.name(), 0.25);
            weighted += check.score() * weight;
            total += weight;
        }
        return total > 0 ? (int) Math.round(weighted / total) : 0;
    }

    /**
     * Renders a fixed-section plain text report for logs and the generation log.
     */
    public String generateReport(ConsistencyReport report) {
        var lines = new ArrayList<String>();
        lines.add("=== Visual Consistency Validation Report ===");
        lines.add("");
        lines.add("Overall Score: " + report.score() + "/100 " + (report.passed() ? "✓ PASSED" : "✗ FAILED"));
        lines.add("");
        lines.add("Individual Checks:");
        for (var check : report.checks()) {
            lines.add("  " + (check.passed() ? "✓" : "✗") + " " + check.name() + ": "
                    + check.score() + "/100 - " + check.message());
        }
        if (!report.warnings().isEmpty()) {
            lines.add("");
            lines.add("Warnings:");
            report.warnings().forEach(w -> lines.add("  ⚠ " + w));
        }
        if (!report.recommendations().isEmpty()) {
            lines.add("");
            lines.add("Recommendations:");
            report.recommendations().forEach(r -> lines.add("  → " + r));
        }
        lines.add("");
        lines.add("=== End of Report ===");
        return String.join("\n", lines);
    }

    private static String promptOf(GeneratedImage image) {
        return image.metadata() != null ? Objects.requireNonNullElse(image.metadata().prompt(), "") : "";
    }

    private static Pattern wordPattern(List<String> terms) {
        if (terms.isEmpty()) {
            return null;
        }
        var alternation = terms.stream()
                .distinct()
                .map(t -> Pattern.quote(t).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\w-])(?:" + alternation + ")(?![\\w-])", Pattern.CASE_INSENSITIVE);
    }
}
