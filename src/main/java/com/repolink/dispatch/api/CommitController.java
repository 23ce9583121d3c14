package com.repolink.dispatch.api;

import com.repolink.config.RepolinkProperties;
import com.repolink.core.commit.AtomicCommitBuilder;
import com.repolink.core.commit.CommitRequest;
import com.repolink.core.commit.CommitResult;
import com.repolink.core.error.RepolinkException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import static com.repolink.dispatch.api.RequestValidation.orDefault;
import static com.repolink.dispatch.api.RequestValidation.requireBody;
import static com.repolink.dispatch.api.RequestValidation.requireText;

/**
 * REST controller for atomic commits. Both endpoints go through
 * {@link AtomicCommitBuilder}; a single-file commit is the one-file case.
 */
@RestController
public class CommitController {

    private final AtomicCommitBuilder commitBuilder;
    private final RepolinkProperties properties;

    public CommitController(AtomicCommitBuilder commitBuilder, RepolinkProperties properties) {
        this.commitBuilder = commitBuilder;
        this.properties = properties;
    }

    /**
     * POST /v1/push_files: Commit several files as one commit.
     * Returns 409 when the branch moved while the commit was being built.
     */
    @PostMapping("/v1/push_files")
    public ResponseEntity<CommitResult> pushFiles(@RequestBody(required = false) PushFilesRequest request) {
        requireBody(request);
        requireText(request.repo(), "repo");
        requireText(request.message(), "message");
        if (request.files() == null || request.files().isEmpty()) {
            throw RepolinkException.validation("empty_file_list", "files must contain at least one file");
        }

        var commitRequest = new CommitRequest(request.repo(),
                orDefault(request.branch(), properties.getDefaultBranch()),
                request.files(), request.message());
        return ResponseEntity.ok(commitBuilder.commit(commitRequest));
    }

    /**
     * PUT /commit: Create or update a single file in one commit.
     */
    @PutMapping("/commit")
    public ResponseEntity<CommitResult> commitFile(@RequestBody(required = false) CommitFileRequest request) {
        requireBody(request);
        requireText(request.repo(), "repo");
        requireText(request.path(), "path");
        requireText(request.message(), "message");
        if (request.content() == null) {
            throw RepolinkException.validation("content is required");
        }

        var commitRequest = CommitRequest.single(request.repo(),
                orDefault(request.branch(), properties.getDefaultBranch()),
                request.path(), request.content(), request.message());
        return ResponseEntity.ok(commitBuilder.commit(commitRequest));
    }
}
