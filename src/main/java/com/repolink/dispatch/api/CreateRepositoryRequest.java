package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateRepositoryRequest(
    @JsonAlias("repoName") String name,
    String description,
    @JsonProperty("private") boolean isPrivate
) {}
