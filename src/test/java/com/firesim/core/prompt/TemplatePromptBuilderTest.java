package com.firesim.core.prompt;

import com.firesim.TestScenarios;
import com.firesim.core.model.GenerationRequest;
import com.firesim.core.model.GeoContext;
import com.firesim.core.model.ScenarioInputs;
import com.firesim.core.model.ViewPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplatePromptBuilderTest {

    private final TemplatePromptBuilder builder = new TemplatePromptBuilder();

    @Nested
    @DisplayName("Prompt content")
    class Content {

        @Test
        @DisplayName("one prompt per requested view, in request order")
        void onePromptPerView() {
            var set = builder.build(TestScenarios.request(ViewPoint.GROUND_NORTH, ViewPoint.AERIAL,
                    ViewPoint.GROUND_NORTH));

            assertEquals(3, set.prompts().size());
            assertEquals(List.of(ViewPoint.GROUND_NORTH, ViewPoint.AERIAL, ViewPoint.GROUND_NORTH),
                    set.prompts().stream().map(PromptSet.ViewpointPrompt::viewpoint).toList());
            assertEquals(TemplatePromptBuilder.TEMPLATE_VERSION, set.templateVersion());
        }

        @Test
        @DisplayName("prompt carries style, scene, fire behaviour, weather, perspective and safety clause")
        void sections() {
            var prompt = builder.build(TestScenarios.request(ViewPoint.GROUND_NORTH))
                    .promptFor(ViewPoint.GROUND_NORTH).orElseThrow();

            assertTrue(prompt.startsWith(TemplatePromptBuilder.STYLE));
            assertTrue(prompt.contains("Dry eucalyptus forest with sparse understorey"));
            assertTrue(prompt.contains("moderate slopes"));
            assertTrue(prompt.contains("Elevation approximately 310 metres."));
            assertTrue(prompt.contains("A road runs nearby"));
            assertTrue(prompt.contains("established bushfire"));
            assertTrue(prompt.contains("3 to 10 metres"));
            assertTrue(prompt.contains("spreading to the southeast driven by strong nw winds"));
            assertTrue(prompt.contains("45 km/h NW wind."));
            assertTrue(prompt.contains("Warm afternoon light from the west"));
            assertTrue(prompt.contains("north side of the fire"));
            assertTrue(prompt.endsWith(TemplatePromptBuilder.SAFETY));
            assertFalse(prompt.contains("  "));
        }

        @Test
        @DisplayName("explicit flame height and rate of spread override intensity defaults")
        void explicitFireBehaviour() {
            var inputs = new ScenarioInputs("high", 20, "S", 30, 25, "dusk", "moderate", "developing", 12.5, 4.0);
            var request = new GenerationRequest(TestScenarios.perimeter(), inputs, null,
                    List.of(ViewPoint.RIDGE), 1, null, null);

            var prompt = builder.build(request).promptFor(ViewPoint.RIDGE).orElseThrow();

            assertTrue(prompt.contains("Flames are approximately 12.5 metres high"));
            assertTrue(prompt.contains("at about 4 km/h"));
            assertFalse(prompt.contains("1.5 to 3 metres"));
        }

        @Test
        @DisplayName("missing geographic context falls back to generic bushland")
        void defaultScene() {
            var request = new GenerationRequest(TestScenarios.perimeter(), TestScenarios.inputs(), null,
                    List.of(ViewPoint.AERIAL), 1, null, null);

            var prompt = builder.build(request).promptFor(ViewPoint.AERIAL).orElseThrow();

            assertTrue(prompt.contains("Eucalypt bushland in New South Wales, Australia."));
            assertTrue(prompt.contains("looking straight down"));
        }

        @Test
        @DisplayName("manual vegetation override beats detected vegetation")
        void manualVegetationOverride() {
            var geo = new GeoContext("Dry Sclerophyll Forest", "Grassland", null, null, null,
                    List.of(), null, null, null);
            var request = new GenerationRequest(TestScenarios.perimeter(), TestScenarios.inputs(), geo,
                    List.of(ViewPoint.AERIAL), 1, null, null);

            var prompt = builder.build(request).promptFor(ViewPoint.AERIAL).orElseThrow();

            assertTrue(prompt.contains("Open grassland with cured dry grass"));
            assertTrue(prompt.contains("undulating terrain"));
        }
    }

    @Nested
    @DisplayName("Blocked terms")
    class Blocked {

        @Test
        @DisplayName("blocked terms in scenario text stop the build")
        void blockedFeatureRejected() {
            var geo = new GeoContext("Heath", null, null, null, null,
                    List.of("wildlife corridor"), null, null, null);
            var request = new GenerationRequest(TestScenarios.perimeter(), TestScenarios.inputs(), geo,
                    List.of(ViewPoint.AERIAL), 1, null, null);

            var ex = assertThrows(PromptBuildException.class, () -> builder.build(request));
            assertTrue(ex.getMessage().contains("wildlife"));
        }

        @Test
        @DisplayName("plural forms are caught, substrings of other words are not")
        void wordBoundaries() {
            assertEquals(List.of("animal"), TemplatePromptBuilder.blockedTerms("Animals grazing nearby"));
            assertTrue(TemplatePromptBuilder.blockedTerms("personal protective gear, humanitarian").isEmpty());
        }

        @Test
        @DisplayName("the safety clause itself never trips the screen")
        void safetyClauseAllowed() {
            assertDoesNotThrow(() -> builder.build(TestScenarios.request(ViewPoint.values())));
        }
    }

    @Test
    @DisplayName("scenario inputs are required")
    void inputsRequired() {
        var request = new GenerationRequest(TestScenarios.perimeter(), null, null,
                List.of(ViewPoint.AERIAL), 1, null, null);
        assertThrows(PromptBuildException.class, () -> builder.build(request));
    }

    @ParameterizedTest
    @CsvSource({"2, flat terrain", "10, gently sloping terrain", "20, moderate slopes",
            "30, steep slopes", "40, very steep escarpment"})
    @DisplayName("slope bands map to terrain wording")
    void terrainBands(double slope, String expected) {
        assertEquals(expected, TemplatePromptBuilder.terrainDescription(slope));
    }

    @Test
    @DisplayName("wind strength bands and downwind spread")
    void windWording() {
        assertEquals("light n winds", TemplatePromptBuilder.windDescription(5, "N"));
        assertEquals("extreme sw winds", TemplatePromptBuilder.windDescription(90, "SW"));
        assertEquals("to the northeast", TemplatePromptBuilder.spreadDirection("SW"));
        assertEquals("to the leeward direction", TemplatePromptBuilder.spreadDirection("variable"));
    }

    @Test
    @DisplayName("promptAt falls back to the first prompt for the viewpoint")
    void promptAtFallback() {
        var set = new PromptSet(List.of(new PromptSet.ViewpointPrompt(ViewPoint.AERIAL, "aerial prompt")), "1.0.0");
        assertEquals("aerial prompt", set.promptAt(0, ViewPoint.AERIAL).orElseThrow());
        assertEquals("aerial prompt", set.promptAt(5, ViewPoint.AERIAL).orElseThrow());
        assertTrue(set.promptAt(0, ViewPoint.RIDGE).isEmpty());
    }
}
