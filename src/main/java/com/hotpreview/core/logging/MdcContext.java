package com.hotpreview.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing HotPreview-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        MDC.put("projectId", projectId);
    }

    public static void setJob(String projectId, String jobId) {
        MDC.put("projectId", projectId);
        MDC.put("jobId", jobId);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("jobId");
    }
}
