package com.shellgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Shellgate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId, String baseCommand) {
        MDC.put("requestId", requestId);
        MDC.put("baseCommand", baseCommand);
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("baseCommand");
    }
}
