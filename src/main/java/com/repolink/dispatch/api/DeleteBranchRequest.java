package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;

public record DeleteBranchRequest(
    @JsonAlias("repoName") String repo,
    @JsonAlias("branchName") String branch
) {}
