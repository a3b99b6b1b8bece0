package com.forgeloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing kernel MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CYCLE = "cycle";
    public static final String ISSUE_ID = "issueId";
    public static final String WORKCELL_ID = "workcellId";
    public static final String TOOLCHAIN = "toolchain";

    private MdcContext() {}

    public static void setCycle(long cycle) {
        MDC.put(CYCLE, String.valueOf(cycle));
    }

    public static void setIssue(String issueId) {
        MDC.put(ISSUE_ID, issueId);
    }

    public static void setWorkcell(String issueId, String workcellId, String toolchain) {
        MDC.put(ISSUE_ID, issueId);
        MDC.put(WORKCELL_ID, workcellId);
        MDC.put(TOOLCHAIN, toolchain);
    }

    public static void clearWorkcell() {
        MDC.remove(WORKCELL_ID);
        MDC.remove(TOOLCHAIN);
    }

    public static void clear() {
        MDC.remove(CYCLE);
        MDC.remove(ISSUE_ID);
        MDC.remove(WORKCELL_ID);
        MDC.remove(TOOLCHAIN);
    }
}
