package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SearchRequest(
    @JsonProperty("context_id") String contextId,
    String query
) {}
