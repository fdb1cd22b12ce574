package com.firesim.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing firesim-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setViewpoint(String runId, String viewpoint) {
        MDC.put("runId", runId);
        MDC.put("viewpoint", viewpoint);
    }

    public static void clearViewpoint() {
        MDC.remove("viewpoint");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("viewpoint");
    }
}
