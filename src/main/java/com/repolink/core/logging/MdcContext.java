package com.repolink.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Repolink-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setContext(String contextId) {
        MDC.put("contextId", contextId);
    }

    public static void setCommit(String repo, String branch, String attemptId) {
        MDC.put("repo", repo);
        MDC.put("branch", branch);
        MDC.put("commitAttempt", attemptId);
    }

    public static void clear() {
        MDC.remove("contextId");
        MDC.remove("repo");
        MDC.remove("branch");
        MDC.remove("commitAttempt");
    }
}
