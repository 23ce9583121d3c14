package com.repolink.core.objectstore;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BranchInfo(
    String name,
    @JsonProperty("head_sha") String headSha,
    @JsonProperty("protected") boolean isProtected
) {}
