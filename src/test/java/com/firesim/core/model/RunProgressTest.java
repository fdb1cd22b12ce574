package com.firesim.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunProgressTest {

    private static final Instant T0 = Instant.parse("2026-01-15T03:00:00Z");
    private static final Instant T1 = Instant.parse("2026-01-15T03:00:05Z");

    private RunProgress progress;

    @BeforeEach
    void setUp() {
        progress = RunProgress.pending("run-1", 2, 42, T0);
    }

    private static GeneratedImage image(ViewPoint vp, boolean anchor) {
        return new GeneratedImage(vp, "http://localhost/" + vp.id(),
                new GeneratedImage.Metadata(64, 64, "prompt", "model", 42, T1, anchor, !anchor));
    }

    @Nested
    @DisplayName("Status transitions")
    class Transitions {

        @Test
        @DisplayName("pending -> in_progress -> completed sets completedAt")
        void happyPath() {
            progress.transitionTo(RunStatus.IN_PROGRESS, T0);
            assertNull(progress.getCompletedAt());
            progress.transitionTo(RunStatus.COMPLETED, T1);
            assertEquals(RunStatus.COMPLETED, progress.getStatus());
            assertEquals(T1, progress.getCompletedAt());
        }

        @Test
        @DisplayName("pending cannot jump straight to completed")
        void pendingToCompletedRejected() {
            assertThrows(IllegalStateException.class, () -> progress.transitionTo(RunStatus.COMPLETED, T1));
        }

        @Test
        @DisplayName("terminal states never move again")
        void terminalIsFinal() {
            progress.transitionTo(RunStatus.IN_PROGRESS, T0);
            progress.transitionTo(RunStatus.FAILED, T1);
            assertThrows(IllegalStateException.class, () -> progress.transitionTo(RunStatus.COMPLETED, T1));
            assertThrows(IllegalStateException.class, () -> progress.transitionTo(RunStatus.IN_PROGRESS, T1));
        }
    }

    @Nested
    @DisplayName("Image accounting")
    class Accounting {

        @Test
        @DisplayName("anchor image is recorded in both images and anchorImage")
        void anchorRecorded() {
            progress.transitionTo(RunStatus.IN_PROGRESS, T0);
            var anchor = image(ViewPoint.GROUND_NORTH, true);
            progress.recordImage(anchor, true, T1);

            assertEquals(1, progress.getCompletedImages());
            assertEquals(anchor, progress.getAnchorImage());
            assertEquals(1, progress.getImages().size());
            assertEquals(T1, progress.getUpdatedAt());
        }

        @Test
        @DisplayName("cannot record more outcomes than the run's total")
        void overflowRejected() {
            progress.transitionTo(RunStatus.IN_PROGRESS, T0);
            progress.recordImage(image(ViewPoint.GROUND_NORTH, true), true, T1);
            progress.recordFailure(T1);
            assertThrows(IllegalStateException.class, () -> progress.recordFailure(T1));
        }

        @Test
        @DisplayName("terminal runs are frozen")
        void frozenAfterTerminal() {
            progress.transitionTo(RunStatus.IN_PROGRESS, T0);
            progress.transitionTo(RunStatus.COMPLETED, T1);
            assertThrows(IllegalStateException.class,
                    () -> progress.recordImage(image(ViewPoint.AERIAL, false), false, T1));
            assertThrows(IllegalStateException.class, () -> progress.updateThinking("late", T1));
        }

        @Test
        @DisplayName("allFailed and isPartialSuccess reflect the counters")
        void outcomeFlags() {
            progress.transitionTo(RunStatus.IN_PROGRESS, T0);
            progress.recordFailure(T1);
            assertFalse(progress.allFailed());
            progress.recordImage(image(ViewPoint.AERIAL, false), false, T1);
            assertTrue(progress.isPartialSuccess());

            var failed = RunProgress.pending("run-2", 2, null, T0);
            failed.transitionTo(RunStatus.IN_PROGRESS, T0);
            failed.recordFailure(T1);
            failed.recordFailure(T1);
            assertTrue(failed.allFailed());
            assertFalse(failed.isPartialSuccess());
        }
    }

    @Test
    @DisplayName("appendError separates messages with a blank line and ignores blanks")
    void appendError() {
        progress.appendError("first", T0);
        progress.appendError("  ", T0);
        progress.appendError("second", T1);
        assertEquals("first\n\nsecond", progress.getError());
    }

    @Test
    @DisplayName("copy is independent of the original")
    void copyIsIndependent() {
        progress.transitionTo(RunStatus.IN_PROGRESS, T0);
        var copy = progress.copy();
        progress.recordImage(image(ViewPoint.AERIAL, false), false, T1);

        assertEquals(0, copy.getCompletedImages());
        assertTrue(copy.getImages().isEmpty());
        assertEquals(RunStatus.IN_PROGRESS, copy.getStatus());
    }

    @Test
    @DisplayName("survives a JSON round trip with derived flags left out")
    void jsonRoundTrip() throws Exception {
        var mapper = new ObjectMapper().findAndRegisterModules();
        progress.transitionTo(RunStatus.IN_PROGRESS, T0);
        progress.recordImage(image(ViewPoint.GROUND_NORTH, true), true, T1);

        var json = mapper.writeValueAsString(progress);
        assertFalse(json.contains("allFailed"));
        assertFalse(json.contains("partialSuccess"));
        assertTrue(json.contains("\"isAnchor\":true"));

        var restored = mapper.readValue(json, RunProgress.class);
        assertEquals(RunStatus.IN_PROGRESS, restored.getStatus());
        assertEquals(progress.getAnchorImage(), restored.getAnchorImage());
        assertEquals(42, restored.getSeed());
    }
}
