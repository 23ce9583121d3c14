package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateBranchRequest(
    @JsonAlias("repoName") String repo,
    @JsonProperty("new_branch") @JsonAlias("newBranchName") String newBranch,
    @JsonProperty("from_branch") @JsonAlias("fromBranch") String fromBranch
) {}
