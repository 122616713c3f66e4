package com.baton.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Baton-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkItem(String workItemId, String actor) {
        MDC.put("workItemId", workItemId);
        if (actor != null) {
            MDC.put("actor", actor);
        }
    }

    public static void setEpic(String epicId) {
        if (epicId != null) {
            MDC.put("epicId", epicId);
        }
    }

    public static void setWave(String epicId, String wave) {
        setEpic(epicId);
        MDC.put("wave", wave);
    }

    public static void clear() {
        MDC.remove("workItemId");
        MDC.remove("actor");
        MDC.remove("epicId");
        MDC.remove("wave");
    }
}
