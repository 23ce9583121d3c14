package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Inbound JSON body for PUT /commit. {@code repoName} is accepted for {@code repo}.
 */
public record CommitFileRequest(
    @JsonAlias("repoName") String repo,
    String branch,
    String path,
    String content,
    String message
) {}
