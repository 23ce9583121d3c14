package com.repolink.core.commit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a successful commit attempt.
 */
public record CommitResult(
    @JsonProperty("commit_sha") String commitSha,
    String message,
    String repo,
    String branch,
    @JsonProperty("parent_sha") String parentSha,
    @JsonProperty("tree_sha") String treeSha,
    List<CommittedFile> files
) {

    public record CommittedFile(
        String path,
        @JsonProperty("blob_sha") String blobSha
    ) {}
}
