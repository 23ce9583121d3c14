package com.repolink.core.objectstore;

import java.util.List;

/**
 * Thin repository operations that map one backend call to one result.
 */
public interface RepositoryGateway {

    List<RepositorySummary> listRepositories();

    /** Creates a repository owned by the authenticated user. */
    RepositorySummary createRepository(String name, String description, boolean isPrivate);

    BranchInfo getBranch(String repo, String branch);

    /** Creates {@code newBranch} at the current head of {@code fromBranch}. */
    BranchInfo createBranch(String repo, String newBranch, String fromBranch);

    void deleteBranch(String repo, String branch);

    List<CommitSummary> listCommits(String repo, String branch);

    /**
     * Lists a directory, or returns the single entry when {@code path} names a file.
     * An empty path lists the repository root.
     */
    List<RepoEntry> listPath(String repo, String branch, String path);

    RepoFile readFile(String repo, String branch, String path);

    /** Decoded text of the repository README on {@code branch}. */
    String readReadme(String repo, String branch);

    /** Opens a pull request from {@code head} into {@code base}. Merging is not offered. */
    PullRequestInfo createPullRequest(String repo, String title, String head, String base, String body);
}
