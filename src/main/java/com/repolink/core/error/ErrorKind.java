package com.repolink.core.error;

/**
 * Machine-readable failure categories. Callers branch on these, e.g. only a
 * {@link #CONFLICT} is worth re-resolving the branch head and retrying.
 */
public enum ErrorKind {
    NOT_FOUND,
    VALIDATION,
    CONFLICT,
    UPSTREAM,
    INTERNAL
}
