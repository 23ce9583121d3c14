package com.repolink.core.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a context with decoded file content.
 */
public record ContextSnapshot(
    @JsonProperty("context_id") String contextId,
    @JsonProperty("created_at") Instant createdAt,
    List<FileView> files,
    @JsonProperty("repo_info") RepoInfo repoInfo,
    @JsonProperty("file_count") int fileCount
) {

    public record FileView(
        String path,
        String content,
        int size,
        @JsonProperty("added_at") Instant addedAt
    ) {}
}
