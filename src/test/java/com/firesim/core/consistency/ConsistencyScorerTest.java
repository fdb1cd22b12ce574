package com.firesim.core.consistency;

import com.firesim.TestScenarios;
import com.firesim.core.model.GeneratedImage;
import com.firesim.core.model.ScenarioInputs;
import com.firesim.core.model.ViewPoint;
import com.firesim.core.prompt.TemplatePromptBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyScorerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T03:00:00Z");

    private final ConsistencyScorer scorer = new ConsistencyScorer();

    private static GeneratedImage image(ViewPoint vp, String prompt, String model, Integer seed, boolean anchor) {
        return new GeneratedImage(vp, "http://localhost/" + vp.id(),
                new GeneratedImage.Metadata(64, 64, prompt, model, seed, NOW, anchor, !anchor));
    }

    private static ScenarioInputs inputs(String windDirection, String timeOfDay) {
        return new ScenarioInputs("high", 30, windDirection, 35, 15, timeOfDay, "high", "established");
    }

    @Nested
    @DisplayName("Whole-set scoring")
    class WholeSet {

        @Test
        @DisplayName("prompts from the template score a clean pass")
        void templatePromptsPass() {
            var request = TestScenarios.request(ViewPoint.GROUND_NORTH, ViewPoint.HELICOPTER_EAST, ViewPoint.AERIAL);
            var prompts = new TemplatePromptBuilder().build(request);
            var anchor = image(ViewPoint.GROUND_NORTH, prompts.promptFor(ViewPoint.GROUND_NORTH).orElseThrow(),
                    "m", 42, true);
            var images = List.of(anchor,
                    image(ViewPoint.HELICOPTER_EAST, prompts.promptFor(ViewPoint.HELICOPTER_EAST).orElseThrow(), "m", 42, false),
                    image(ViewPoint.AERIAL, prompts.promptFor(ViewPoint.AERIAL).orElseThrow(), "m", 42, false));

            var report = scorer.score(images, request.inputs(), anchor);

            assertEquals(100, report.score());
            assertTrue(report.passed());
            assertEquals(4, report.checks().size());
            assertTrue(report.warnings().isEmpty());
            assertTrue(report.recommendations().isEmpty());
        }

        @Test
        @DisplayName("a poorly specified set fails with warnings and recommendations")
        void poorSetFails() {
            var images = List.of(
                    image(ViewPoint.GROUND_NORTH, "A fire.", "model-a", 1, false),
                    image(ViewPoint.GROUND_SOUTH, "Another fire.", "model-b", 2, false));

            var report = scorer.score(images, inputs("NW", "night"), null);

            // smoke 0, size 50, lighting 0, colour 40
            assertEquals(20, report.score());
            assertFalse(report.passed());
            assertEquals(4, report.warnings().size());
            assertEquals("Consider regenerating images with a different seed for better consistency",
                    report.recommendations().get(0));
            assertEquals(5, report.recommendations().size());
        }

        @Test
        @DisplayName("recommendations are only given below the pass threshold")
        void noRecommendationsWhenPassing() {
            var images = List.of(
                    image(ViewPoint.GROUND_NORTH, "Smoke drifts on a northwest wind this afternoon.", "m", 1, true),
                    image(ViewPoint.AERIAL, "Aerial view, northwest wind, afternoon haze.", "m", 2, false));

            var report = scorer.score(images, inputs("NW", "afternoon"), images.get(0));

            // smoke 100, size 100, lighting 100, colour 80 -> 95
            assertEquals(95, report.score());
            assertTrue(report.passed());
            assertEquals(1, report.warnings().size());
            assertTrue(report.recommendations().isEmpty());
        }
    }

    @Nested
    @DisplayName("Individual checks")
    class Checks {

        @Test
        @DisplayName("smoke direction matches compass synonyms as whole words")
        void smokeSynonyms() {
            var inputs = inputs("SE", "midday");
            assertTrue(scorer.smokeDirection(List.of(image(ViewPoint.AERIAL, "a south-east wind", "m", 1, false)),
                    inputs).passed());
            assertTrue(scorer.smokeDirection(List.of(image(ViewPoint.AERIAL, "a SOUTH EAST breeze", "m", 1, false)),
                    inputs).passed());
            assertFalse(scorer.smokeDirection(List.of(image(ViewPoint.AERIAL, "smoke over the sea", "m", 1, false)),
                    inputs).passed());
            assertFalse(scorer.smokeDirection(List.of(image(ViewPoint.AERIAL, "a north-south road", "m", 1, false)),
                    inputs("N", "midday")).passed());
        }

        @Test
        @DisplayName("fire size scores 100, 70 or 50 by vantage variety and anchor")
        void fireSizeBands() {
            var ground = image(ViewPoint.GROUND_NORTH, "", "m", 1, true);
            var heli = image(ViewPoint.HELICOPTER_NORTH, "", "m", 1, false);
            var ground2 = image(ViewPoint.GROUND_WEST, "", "m", 1, false);

            assertEquals(100, scorer.fireSize(List.of(ground, heli), ground).score());
            var noAnchor = scorer.fireSize(List.of(ground, heli), null);
            assertEquals(70, noAnchor.score());
            assertTrue(noAnchor.passed());
            var single = scorer.fireSize(List.of(ground, ground2), ground);
            assertEquals(50, single.score());
            assertFalse(single.passed());
        }

        @Test
        @DisplayName("lighting score is the share of prompts describing the time of day")
        void lightingShare() {
            var images = List.of(
                    image(ViewPoint.AERIAL, "at dusk", "m", 1, false),
                    image(ViewPoint.RIDGE, "noon glare", "m", 1, false),
                    image(ViewPoint.GROUND_EAST, "twilight glow", "m", 1, false),
                    image(ViewPoint.GROUND_WEST, "nothing here", "m", 1, false));

            var check = scorer.lighting(images, inputs("N", "dusk"));

            assertEquals(50, check.score());
            assertFalse(check.passed());
        }

        @Test
        @DisplayName("colour palette scores by shared model and seed")
        void colorBands() {
            var a = image(ViewPoint.AERIAL, "", "m1", 1, false);
            assertEquals(100, scorer.colorPalette(List.of(a, image(ViewPoint.RIDGE, "", "m1", 1, false))).score());
            assertEquals(80, scorer.colorPalette(List.of(a, image(ViewPoint.RIDGE, "", "m1", 2, false))).score());
            assertEquals(60, scorer.colorPalette(List.of(a, image(ViewPoint.RIDGE, "", "m2", 1, false))).score());
            assertEquals(40, scorer.colorPalette(List.of(a, image(ViewPoint.RIDGE, "", "m2", 2, false))).score());
        }
    }

    @Test
    @DisplayName("report text has the fixed sections")
    void reportText() {
        var images = List.of(
                image(ViewPoint.GROUND_NORTH, "A fire.", "model-a", 1, false),
                image(ViewPoint.GROUND_SOUTH, "Another fire.", "model-b", 2, false));
        var report = scorer.score(images, inputs("NW", "night"), null);

        var text = scorer.generateReport(report);

        assertTrue(text.startsWith("=== Visual Consistency Validation Report ==="));
        assertTrue(text.contains("Overall Score: 20/100 ✗ FAILED"));
        assertTrue(text.contains("✗ Smoke Direction Consistency: 0/100"));
        assertTrue(text.contains("Warnings:"));
        assertTrue(text.contains("Recommendations:"));
        assertTrue(text.endsWith("=== End of Report ==="));
    }
}
