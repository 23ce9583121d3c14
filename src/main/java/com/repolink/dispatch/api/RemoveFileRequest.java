package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemoveFileRequest(
    @JsonProperty("context_id") String contextId,
    String path
) {}
