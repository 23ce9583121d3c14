package com.repolink.core.objectstore;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PullRequestInfo(
    int number,
    String title,
    String state,
    String head,
    String base,
    @JsonProperty("html_url") String htmlUrl
) {}
