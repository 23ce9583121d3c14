package com.repolink.dispatch.api;

import com.repolink.config.RepolinkProperties;
import com.repolink.core.objectstore.BranchInfo;
import com.repolink.core.objectstore.CommitSummary;
import com.repolink.core.objectstore.PullRequestInfo;
import com.repolink.core.objectstore.RepoEntry;
import com.repolink.core.objectstore.RepoFile;
import com.repolink.core.objectstore.RepositoryGateway;
import com.repolink.core.objectstore.RepositorySummary;
import com.repolink.core.repository.RepositoryFilesService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

import static com.repolink.dispatch.api.RequestValidation.orDefault;
import static com.repolink.dispatch.api.RequestValidation.requireBody;
import static com.repolink.dispatch.api.RequestValidation.requireText;

/**
 * REST controller for read-mostly repository operations that pass straight
 * through to the backend.
 */
@RestController
public class RepositoryController {

    private final RepositoryGateway gateway;
    private final RepositoryFilesService filesService;
    private final RepolinkProperties properties;

    public RepositoryController(RepositoryGateway gateway,
                                RepositoryFilesService filesService,
                                RepolinkProperties properties) {
        this.gateway = gateway;
        this.filesService = filesService;
        this.properties = properties;
    }

    /**
     * GET /repos: Repositories of the configured owner.
     */
    @GetMapping("/repos")
    public ResponseEntity<List<RepositorySummary>> listRepositories() {
        return ResponseEntity.ok(gateway.listRepositories());
    }

    /**
     * POST /repo: Create a repository for the authenticated user.
     */
    @PostMapping("/repo")
    public ResponseEntity<RepositorySummary> createRepository(
            @RequestBody(required = false) CreateRepositoryRequest request) {
        requireBody(request);
        requireText(request.name(), "name");
        return ResponseEntity.ok(gateway.createRepository(request.name(), request.description(),
                request.isPrivate()));
    }

    /**
     * GET /branch?repo=...&branch=...: Branch head and protection flag.
     */
    @GetMapping("/branch")
    public ResponseEntity<BranchInfo> getBranch(@RequestParam(required = false) String repo,
                                                @RequestParam(required = false) String branch) {
        requireText(repo, "repo");
        return ResponseEntity.ok(gateway.getBranch(repo, orDefault(branch, properties.getDefaultBranch())));
    }

    /**
     * POST /branch: Create a branch at the head of another branch.
     */
    @PostMapping("/branch")
    public ResponseEntity<BranchInfo> createBranch(@RequestBody(required = false) CreateBranchRequest request) {
        requireBody(request);
        requireText(request.repo(), "repo");
        requireText(request.newBranch(), "new_branch");
        return ResponseEntity.ok(gateway.createBranch(request.repo(), request.newBranch(),
                orDefault(request.fromBranch(), properties.getDefaultBranch())));
    }

    /**
     * DELETE /branch: Delete a branch ref.
     */
    @DeleteMapping("/branch")
    public ResponseEntity<Map<String, String>> deleteBranch(@RequestBody(required = false) DeleteBranchRequest request) {
        requireBody(request);
        requireText(request.repo(), "repo");
        requireText(request.branch(), "branch");
        gateway.deleteBranch(request.repo(), request.branch());
        return ResponseEntity.ok(Map.of("message", "Branch " + request.branch() + " deleted."));
    }

    /**
     * GET /commits?repo=...&branch=...: Recent commits, newest first.
     */
    @GetMapping("/commits")
    public ResponseEntity<List<CommitSummary>> listCommits(@RequestParam(required = false) String repo,
                                                           @RequestParam(required = false) String branch) {
        requireText(repo, "repo");
        return ResponseEntity.ok(gateway.listCommits(repo, orDefault(branch, properties.getDefaultBranch())));
    }

    /**
     * GET /files?repo=...&path=...&branch=...: List a directory or describe one file.
     */
    @GetMapping("/files")
    public ResponseEntity<List<RepoEntry>> listFiles(@RequestParam(required = false) String repo,
                                                     @RequestParam(required = false, defaultValue = "") String path,
                                                     @RequestParam(required = false) String branch) {
        requireText(repo, "repo");
        return ResponseEntity.ok(gateway.listPath(repo, orDefault(branch, properties.getDefaultBranch()), path));
    }

    /**
     * GET /readme?repo=...&branch=...: README as plain text.
     */
    @GetMapping("/readme")
    public ResponseEntity<String> readme(@RequestParam(required = false) String repo,
                                         @RequestParam(required = false) String branch) {
        requireText(repo, "repo");
        return ResponseEntity.ok(gateway.readReadme(repo, orDefault(branch, properties.getDefaultBranch())));
    }

    /**
     * POST /pullrequest: Open a pull request; base falls back to the default branch.
     */
    @PostMapping("/pullrequest")
    public ResponseEntity<PullRequestInfo> createPullRequest(
            @RequestBody(required = false) CreatePullRequestRequest request) {
        requireBody(request);
        requireText(request.repo(), "repo");
        requireText(request.title(), "title");
        requireText(request.head(), "head");
        return ResponseEntity.ok(gateway.createPullRequest(request.repo(), request.title(), request.head(),
                orDefault(request.base(), properties.getDefaultBranch()), request.body()));
    }

    /**
     * POST /v1/github_files: Decoded content of every file under a path.
     */
    @PostMapping("/v1/github_files")
    public ResponseEntity<Map<String, List<FileContent>>> fetchFiles(
            @RequestBody(required = false) RepositoryFilesRequest request) {
        requireBody(request);
        requireText(request.repo(), "repo");
        List<RepoFile> files = filesService.fetchFiles(request.repo(),
                orDefault(request.branch(), properties.getDefaultBranch()),
                request.path() == null ? "" : request.path());
        return ResponseEntity.ok(Map.of("files",
                files.stream().map(f -> new FileContent(f.path(), f.content())).toList()));
    }

    public record FileContent(String path, String content) {}
}
