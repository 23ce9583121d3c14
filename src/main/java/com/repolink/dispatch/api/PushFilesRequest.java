package com.repolink.dispatch.api;

import com.repolink.core.commit.FileChange;

import java.util.List;

/**
 * Inbound JSON body for POST /v1/push_files.
 *
 * @param branch nullable; defaults to the configured default branch
 */
public record PushFilesRequest(
    String repo,
    String branch,
    List<FileChange> files,
    String message
) {}
