package com.quillmind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Quillmind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setBatch(String batchId) {
        MDC.put("batchId", batchId);
    }

    public static void setConflict(String batchId, String conflictId) {
        MDC.put("batchId", batchId);
        MDC.put("conflictId", conflictId);
    }

    public static void setModule(String batchId, String moduleName) {
        MDC.put("batchId", batchId);
        MDC.put("moduleName", moduleName);
    }

    public static void clearElement() {
        MDC.remove("conflictId");
        MDC.remove("moduleName");
    }

    public static void clear() {
        MDC.remove("batchId");
        MDC.remove("conflictId");
        MDC.remove("moduleName");
    }
}
