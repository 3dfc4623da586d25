package com.teamsmith.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Teamsmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskName) {
        MDC.put("task", taskName);
    }

    public static void setDocument(String path) {
        MDC.put("document", path);
    }

    /** Removes only the task key; the enclosing document stays in place. */
    public static void clearTask() {
        MDC.remove("task");
    }

    public static void clear() {
        MDC.remove("task");
        MDC.remove("document");
    }
}
