package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;

public record CreatePullRequestRequest(
    @JsonAlias("repoName") String repo,
    String title,
    @JsonAlias("headBranch") String head,
    @JsonAlias("baseBranch") String base,
    String body
) {}
