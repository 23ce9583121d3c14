package com.repolink.core.context;

import java.time.Instant;

/**
 * Registry of staged-file contexts.
 *
 * <p>Implementations serialize mutations per context id. Operations on
 * different ids must not contend with each other. Unknown ids always fail
 * with a {@code NOT_FOUND} {@link com.repolink.core.error.RepolinkException};
 * an evicted id is never recreated.
 */
public interface ContextStore {

    /** Allocates a fresh, never-reused context id. */
    String create();

    void addFile(String contextId, String path, String content, String repo, String branch);

    void removeFile(String contextId, String path);

    ContextSnapshot getContext(String contextId);

    SearchResult search(String contextId, String query);

    /**
     * Removes every context older than the retention window at {@code now}.
     *
     * @return the number of contexts removed
     */
    int evictExpired(Instant now);

    /** Number of live contexts. */
    int size();
}
