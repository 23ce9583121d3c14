package com.repolink.core.objectstore;

import java.util.List;

/**
 * Low-level object primitives of a remote content-addressed repository.
 *
 * <p>Every method fails with a {@link com.repolink.core.error.RepolinkException}:
 * {@code NOT_FOUND} for a missing repository, branch or object,
 * {@code UPSTREAM} when the backend is unreachable or rejects the call, and
 * {@code CONFLICT} from {@link #updateRef} only.
 */
public interface ObjectStoreClient {

    /** Sha of the commit {@code branch} currently points at. */
    String getBranchHead(String repo, String branch);

    /** Sha of the root tree of {@code commitSha}. */
    String getTree(String repo, String commitSha);

    String createBlob(String repo, byte[] content);

    /**
     * Creates a tree that starts from {@code baseTreeSha} and overlays
     * {@code entries}. Paths of the base tree not named in {@code entries}
     * are kept.
     */
    String createTree(String repo, String baseTreeSha, List<TreeEntry> entries);

    String createCommit(String repo, String message, String treeSha, String parentSha);

    /**
     * Moves {@code branch} to {@code newSha} only if it still points at
     * {@code expectedOldSha}.
     *
     * @throws com.repolink.core.error.RepolinkException {@code CONFLICT} with code
     *         {@code ref_conflict} when the branch moved, or
     *         {@code ref_update_ambiguous} when the outcome is unknown
     */
    void updateRef(String repo, String branch, String newSha, String expectedOldSha);

    /** Short provider name for logs and health output. */
    String name();
}
