package com.repolink.core.commit;

import java.util.List;

/**
 * Input of one {@link AtomicCommitBuilder#commit} call. Exists only for the
 * duration of that call.
 *
 * @param repo    target repository name
 * @param branch  target branch
 * @param files   ordered, non-empty; when a path repeats the last occurrence wins
 * @param message commit message, required
 */
public record CommitRequest(
    String repo,
    String branch,
    List<FileChange> files,
    String message
) {

    public static CommitRequest single(String repo, String branch, String path, String content, String message) {
        return new CommitRequest(repo, branch, List.of(new FileChange(path, content)), message);
    }
}
