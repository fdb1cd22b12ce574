package com.firesim.core.prompt;

import com.firesim.core.model.GenerationRequest;
import com.firesim.core.model.GeoContext;
import com.firesim.core.model.ScenarioInputs;
import com.firesim.core.model.ViewPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Photorealistic bushfire prompt template.
 *
 * <p>Each prompt is the style line, scene, fire behaviour, weather and lighting, camera
 * perspective and a fixed safety clause, joined into a single whitespace-normalised sentence
 * sequence. Everything except the safety clause is screened against a blocked-term list.
 */
@Component
public class TemplatePromptBuilder implements PromptBuilder {

    public static final String TEMPLATE_VERSION = "1.0.0";

    static final String STYLE = "A photorealistic photograph of an Australian bushfire. DSLR quality, natural lighting.";
    static final String SAFETY = "No people, no animals, no text, no watermarks. No fantasy elements.";

    private static final Pattern BLOCKED = Pattern.compile(
            "\\b(" + String.join("|", PromptTables.BLOCKED_TERMS) + ")s?\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public PromptSet build(GenerationRequest request) {
        var inputs = request.inputs();
        if (inputs == null) {
            throw new PromptBuildException("Scenario inputs are required to build prompts");
        }
        var geo = request.geoContext();

        String scenario = String.join(" ", scene(geo), fire(inputs), weather(inputs));

        var prompts = new ArrayList<PromptSet.ViewpointPrompt>();
        for (var viewpoint : request.requestedViews()) {
            String content = normalise(String.join(" ", STYLE, scenario, perspective(viewpoint)));
            var blocked = blockedTerms(content);
            if (!blocked.isEmpty()) {
                throw new PromptBuildException("Prompt contains blocked terms: " + String.join(", ", blocked)
                        + ". Check the scenario inputs and geographic context.");
            }
            prompts.add(new PromptSet.ViewpointPrompt(viewpoint, content + " " + SAFETY));
        }
        return new PromptSet(prompts, TEMPLATE_VERSION);
    }

    static List<String> blockedTerms(String text) {
        var matcher = BLOCKED.matcher(text);
        var found = new ArrayList<String>();
        while (matcher.find()) {
            var term = matcher.group(1).toLowerCase(Locale.ROOT);
            if (!found.contains(term)) {
                found.add(term);
            }
        }
        return found;
    }

    private static String scene(GeoContext geo) {
        if (geo == null) {
            return "Eucalypt bushland in New South Wales, Australia. Remote bushland area.";
        }
        var vegetation = vegetationDescriptor(geo.effectiveVegetationType());
        var terrain = geo.slope() != null ? terrainDescription(geo.slope().mean()) : "undulating terrain";
        var sb = new StringBuilder();
        sb.append(capitalise(vegetation)).append(" on ").append(terrain).append(" in New South Wales, Australia. ");
        if (geo.elevation() != null) {
            sb.append("Elevation approximately ").append(Math.round(geo.elevation().mean())).append(" metres. ");
        }
        sb.append(nearbyFeatures(geo.nearbyFeatures()));
        return sb.toString();
    }

    private static String fire(ScenarioInputs inputs) {
        var visuals = PromptTables.INTENSITY_VISUALS.getOrDefault(inputs.intensity(),
                PromptTables.INTENSITY_VISUALS.get("moderate"));
        var stage = PromptTables.FIRE_STAGES.getOrDefault(inputs.fireStage(), "bushfire");
        var flameHeight = inputs.flameHeightM() != null
                ? "approximately " + number(inputs.flameHeightM()) + " metres"
                : visuals.flameHeight();

        var sb = new StringBuilder();
        sb.append("A ").append(stage).append(" burning through the vegetation. ")
                .append(visuals.descriptor()).append(", ").append(visuals.crownInvolvement()).append(". ")
                .append("Flames are ").append(flameHeight).append(" high with ").append(visuals.smoke()).append(". ")
                .append("The head fire is spreading ").append(spreadDirection(inputs.windDirection()))
                .append(" driven by ").append(windDescription(inputs.windSpeed(), inputs.windDirection()));
        if (inputs.rateOfSpreadKmh() != null) {
            sb.append(" at about ").append(number(inputs.rateOfSpreadKmh())).append(" km/h");
        }
        sb.append(", with ").append(visuals.spotting()).append('.');
        return sb.toString();
    }

    private static String weather(ScenarioInputs inputs) {
        var lighting = PromptTables.TIME_OF_DAY_LIGHTING.getOrDefault(inputs.timeOfDay(),
                PromptTables.TIME_OF_DAY_LIGHTING.get("afternoon"));
        return "Temperature is " + number(inputs.temperature()) + "°C with " + number(inputs.humidity())
                + "% relative humidity. " + number(inputs.windSpeed()) + " km/h " + inputs.windDirection()
                + " wind. " + lighting + ".";
    }

    private static String perspective(ViewPoint viewpoint) {
        return PromptTables.VIEWPOINT_PERSPECTIVES.get(viewpoint) + ".";
    }

    static String terrainDescription(double meanSlope) {
        if (meanSlope < 5) return "flat terrain";
        if (meanSlope < 15) return "gently sloping terrain";
        if (meanSlope < 25) return "moderate slopes";
        if (meanSlope < 35) return "steep slopes";
        return "very steep escarpment";
    }

    static String windDescription(double windSpeed, String windDirection) {
        String strength;
        if (windSpeed < 10) strength = "light";
        else if (windSpeed < 30) strength = "moderate";
        else if (windSpeed < 50) strength = "strong";
        else if (windSpeed < 70) strength = "very strong";
        else strength = "extreme";
        return strength + " " + (windDirection != null ? windDirection.toLowerCase(Locale.ROOT) : "variable") + " winds";
    }

    static String spreadDirection(String windDirection) {
        var downwind = windDirection != null
                ? PromptTables.DOWNWIND.get(windDirection.toUpperCase(Locale.ROOT))
                : null;
        return "to the " + (downwind != null ? downwind : "leeward direction");
    }

    private static String vegetationDescriptor(String vegetationType) {
        if (vegetationType == null || vegetationType.isBlank()) {
            return "eucalypt bushland";
        }
        return PromptTables.VEGETATION_DESCRIPTORS.getOrDefault(vegetationType,
                vegetationType.toLowerCase(Locale.ROOT));
    }

    private static String nearbyFeatures(List<String> features) {
        if (features == null || features.isEmpty()) {
            return "Remote bushland area.";
        }
        return features.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(f -> PromptTables.NEARBY_FEATURES.getOrDefault(f, f))
                .collect(Collectors.joining(". ")) + ".";
    }

    private static String number(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static String capitalise(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String normalise(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
