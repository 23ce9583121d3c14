package com.repolink.dispatch.api;

/**
 * Inbound JSON body for POST /v1/github_files. {@code path} defaults to the root.
 */
public record RepositoryFilesRequest(
    String repo,
    String branch,
    String path
) {}
