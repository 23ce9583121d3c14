package com.repolink.core.objectstore;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RepositorySummary(
    String name,
    @JsonProperty("full_name") String fullName,
    @JsonProperty("private") boolean isPrivate,
    @JsonProperty("default_branch") String defaultBranch,
    @JsonProperty("html_url") String htmlUrl
) {}
