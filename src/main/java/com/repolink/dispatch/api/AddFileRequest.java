package com.repolink.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /v1/add_file.
 *
 * @param repo   nullable; when present becomes the context's repo info
 * @param branch nullable; defaults to the configured default branch when {@code repo} is set
 */
public record AddFileRequest(
    @JsonProperty("context_id") String contextId,
    String path,
    String content,
    String repo,
    String branch
) {}
