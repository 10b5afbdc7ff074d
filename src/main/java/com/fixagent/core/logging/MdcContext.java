package com.fixagent.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing verifier-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTrial(String trialId, String taskId) {
        MDC.put("trialId", trialId);
        MDC.put("taskId", taskId);
    }

    public static void setBatchKey(String batchKey) {
        MDC.put("batchKey", batchKey);
    }

    /** Removes the trial keys, leaving any enclosing batch key in place. */
    public static void clearTrial() {
        MDC.remove("trialId");
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("trialId");
        MDC.remove("taskId");
        MDC.remove("batchKey");
    }
}
