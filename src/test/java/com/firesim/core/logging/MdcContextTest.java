package com.firesim.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("run-1");
        assertEquals("run-1", MDC.get("runId"));
    }

    @Test
    @DisplayName("setViewpoint puts runId and viewpoint in MDC")
    void setViewpoint() {
        MdcContext.setViewpoint("run-1", "ground_north");
        assertEquals("run-1", MDC.get("runId"));
        assertEquals("ground_north", MDC.get("viewpoint"));
    }

    @Test
    @DisplayName("clearViewpoint keeps the run id")
    void clearViewpoint() {
        MdcContext.setViewpoint("run-1", "aerial");
        MdcContext.clearViewpoint();
        assertEquals("run-1", MDC.get("runId"));
        assertNull(MDC.get("viewpoint"));
    }

    @Test
    @DisplayName("clear removes all firesim MDC keys")
    void clear() {
        MdcContext.setViewpoint("run-1", "aerial");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("viewpoint"));
    }
}
