package com.repolink.core.objectstore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repolink.config.RepolinkProperties;
import com.repolink.core.codec.ContentCodec;
import com.repolink.core.error.ErrorKind;
import com.repolink.core.error.RepolinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * HTTP client for the GitHub REST API (git data, refs, branches, contents).
 *
 * <p>Talks to the API directly over {@link HttpClient} with Jackson for the
 * JSON bodies. Authentication is a bearer token from
 * {@link RepolinkProperties#getToken()}; the token is never logged.
 */
public class GitHubObjectStoreClient implements ObjectStoreClient, RepositoryGateway {

    private static final Logger log = LoggerFactory.getLogger(GitHubObjectStoreClient.class);

    private static final String API_VERSION = "2022-11-28";

    private final RepolinkProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubObjectStoreClient(RepolinkProperties properties) {
        this(properties,
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(properties.getGithub().getConnectTimeoutSeconds()))
                        .build(),
                new ObjectMapper());
    }

    GitHubObjectStoreClient(RepolinkProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "github";
    }

    // -- Object primitives ------------------------------------------------

    @Override
    public String getBranchHead(String repo, String branch) {
        var response = send(get(repoPath(repo) + "/git/ref/heads/" + encodePath(branch)));
        if (response.statusCode() == 404 || response.statusCode() == 409) {
            throw missingRepoOrBranch(repo, branch);
        }
        return requireOk(response, "GET ref heads/" + branch).get("object").get("sha").asText();
    }

    @Override
    public String getTree(String repo, String commitSha) {
        var response = send(get(repoPath(repo) + "/git/commits/" + commitSha));
        if (response.statusCode() == 404) {
            throw RepolinkException.notFound("commit_not_found",
                    "Commit %s not found in %s".formatted(commitSha, repo));
        }
        return requireOk(response, "GET commit " + commitSha).get("tree").get("sha").asText();
    }

    @Override
    public String createBlob(String repo, byte[] content) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("content", Base64.getEncoder().encodeToString(content));
        body.put("encoding", "base64");

        var response = send(post(repoPath(repo) + "/git/blobs", body));
        if (response.statusCode() == 404) {
            throw repoNotFound(repo);
        }
        var sha = requireOk(response, "POST blob").get("sha").asText();
        log.debug("Created blob {} ({} bytes) in {}", sha, content.length, repo);
        return sha;
    }

    @Override
    public String createTree(String repo, String baseTreeSha, List<TreeEntry> entries) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("base_tree", baseTreeSha);
        ArrayNode tree = body.putArray("tree");
        for (TreeEntry entry : entries) {
            tree.addObject()
                    .put("path", entry.path())
                    .put("mode", entry.mode())
                    .put("type", entry.type())
                    .put("sha", entry.sha());
        }

        var response = send(post(repoPath(repo) + "/git/trees", body));
        if (response.statusCode() == 404) {
            throw repoNotFound(repo);
        }
        var sha = requireOk(response, "POST tree").get("sha").asText();
        log.debug("Created tree {} over base {} with {} entries", sha, baseTreeSha, entries.size());
        return sha;
    }

    @Override
    public String createCommit(String repo, String message, String treeSha, String parentSha) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("message", message);
        body.put("tree", treeSha);
        body.putArray("parents").add(parentSha);

        var response = send(post(repoPath(repo) + "/git/commits", body));
        if (response.statusCode() == 404) {
            throw repoNotFound(repo);
        }
        return requireOk(response, "POST commit").get("sha").asText();
    }

    /**
     * Re-reads the head and refuses to proceed when it differs from
     * {@code expectedOldSha}, then sends a non-forced update. GitHub rejects a
     * non-forced update that is not a fast-forward with 422, which covers a
     * writer that lands between the check and the PATCH.
     */
    @Override
    public void updateRef(String repo, String branch, String newSha, String expectedOldSha) {
        String current = getBranchHead(repo, branch);
        if (!current.equals(expectedOldSha)) {
            throw branchMoved(branch, expectedOldSha, current);
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("sha", newSha);
        body.put("force", false);

        HttpResponse<String> response;
        try {
            response = httpClient.send(patch(repoPath(repo) + "/git/refs/heads/" + encodePath(branch), body),
                    HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException | ConnectException e) {
            throw RepolinkException.upstream("GitHub unreachable while updating " + branch, e);
        } catch (HttpTimeoutException e) {
            throw new RepolinkException(ErrorKind.CONFLICT, "ref_update_ambiguous",
                    "Timed out updating %s to %s; re-resolve the branch head before retrying"
                            .formatted(branch, newSha), e);
        } catch (IOException e) {
            throw new RepolinkException(ErrorKind.CONFLICT, "ref_update_ambiguous",
                    "Connection failed while updating %s to %s; the update may have applied"
                            .formatted(branch, newSha), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepolinkException(ErrorKind.CONFLICT, "ref_update_ambiguous",
                    "Interrupted while updating " + branch, e);
        }

        if (response.statusCode() == 422 || response.statusCode() == 409) {
            throw branchMoved(branch, expectedOldSha, "unknown");
        }
        if (response.statusCode() == 404) {
            throw missingRepoOrBranch(repo, branch);
        }
        requireOk(response, "PATCH ref heads/" + branch);
        log.info("Moved {}/{} from {} to {}", repo, branch, expectedOldSha, newSha);
    }

    // -- Repository pass-throughs -----------------------------------------

    @Override
    public List<RepositorySummary> listRepositories() {
        String owner = properties.getOwner();
        String path = owner == null || owner.isBlank()
                ? "/user/repos?per_page=100"
                : "/users/" + encode(owner) + "/repos?per_page=100";

        var json = requireOk(send(get(path)), "GET repos");
        var result = new ArrayList<RepositorySummary>();
        for (JsonNode repo : json) {
            result.add(toSummary(repo));
        }
        return result;
    }

    private static RepositorySummary toSummary(JsonNode repo) {
        return new RepositorySummary(
                repo.path("name").asText(),
                repo.path("full_name").asText(),
                repo.path("private").asBoolean(),
                repo.path("default_branch").asText(null),
                repo.path("html_url").asText(null));
    }

    @Override
    public RepositorySummary createRepository(String name, String description, boolean isPrivate) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", name);
        body.put("description", description == null ? "" : description);
        body.put("private", isPrivate);

        var response = send(post("/user/repos", body));
        if (response.statusCode() == 422) {
            throw RepolinkException.conflict("repo_exists",
                    "Repository %s could not be created: %s".formatted(name, response.body()));
        }
        var json = requireOk(response, "POST user repo");
        log.info("Created repository {}", json.path("full_name").asText(name));
        return toSummary(json);
    }

    @Override
    public BranchInfo getBranch(String repo, String branch) {
        var response = send(get(repoPath(repo) + "/branches/" + encodePath(branch)));
        if (response.statusCode() == 404) {
            throw missingRepoOrBranch(repo, branch);
        }
        var json = requireOk(response, "GET branch " + branch);
        return new BranchInfo(json.path("name").asText(),
                json.path("commit").path("sha").asText(),
                json.path("protected").asBoolean());
    }

    @Override
    public BranchInfo createBranch(String repo, String newBranch, String fromBranch) {
        String sha = getBranchHead(repo, fromBranch);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("ref", "refs/heads/" + newBranch);
        body.put("sha", sha);

        var response = send(post(repoPath(repo) + "/git/refs", body));
        if (response.statusCode() == 422) {
            throw RepolinkException.conflict("branch_exists",
                    "Branch %s already exists in %s".formatted(newBranch, repo));
        }
        requireOk(response, "POST ref " + newBranch);
        log.info("Created branch {} in {} from {} at {}", newBranch, repo, fromBranch, sha);
        return new BranchInfo(newBranch, sha, false);
    }

    @Override
    public void deleteBranch(String repo, String branch) {
        var response = send(delete(repoPath(repo) + "/git/refs/heads/" + encodePath(branch)));
        if (response.statusCode() == 404 || response.statusCode() == 422) {
            throw missingRepoOrBranch(repo, branch);
        }
        requireOk(response, "DELETE ref " + branch);
        log.info("Deleted branch {} in {}", branch, repo);
    }

    @Override
    public List<CommitSummary> listCommits(String repo, String branch) {
        var response = send(get(repoPath(repo) + "/commits?sha=" + encode(branch)));
        if (response.statusCode() == 404 || response.statusCode() == 409) {
            throw missingRepoOrBranch(repo, branch);
        }
        var json = requireOk(response, "GET commits");
        var result = new ArrayList<CommitSummary>();
        for (JsonNode c : json) {
            var commit = c.path("commit");
            result.add(new CommitSummary(
                    c.path("sha").asText(),
                    commit.path("message").asText(),
                    commit.path("author").path("name").asText(null),
                    commit.path("author").path("date").asText(null)));
        }
        return result;
    }

    @Override
    public List<RepoEntry> listPath(String repo, String branch, String path) {
        var json = contents(repo, branch, path);
        var result = new ArrayList<RepoEntry>();
        if (json.isArray()) {
            for (JsonNode item : json) {
                result.add(toEntry(item));
            }
        } else {
            result.add(toEntry(json));
        }
        return result;
    }

    @Override
    public RepoFile readFile(String repo, String branch, String path) {
        var json = contents(repo, branch, path);
        if (json.isArray() || !"file".equals(json.path("type").asText())) {
            throw RepolinkException.validation("not_a_file", "Path is not a file: " + path);
        }
        return new RepoFile(json.path("path").asText(),
                json.path("sha").asText(),
                json.path("size").asLong(),
                ContentCodec.decode(json.path("content").asText("")));
    }

    @Override
    public String readReadme(String repo, String branch) {
        var response = send(get(repoPath(repo) + "/readme?ref=" + encode(branch)));
        if (response.statusCode() == 404) {
            throw RepolinkException.notFound("readme_not_found",
                    "No README in %s on %s".formatted(repo, branch));
        }
        var json = requireOk(response, "GET readme");
        return ContentCodec.decode(json.path("content").asText(""));
    }

    /**
     * GitHub answers 422 both for a missing head or base branch and for a
     * pull request that would be empty or already exists.
     */
    @Override
    public PullRequestInfo createPullRequest(String repo, String title, String head, String base, String body) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("title", title);
        request.put("head", head);
        request.put("base", base);
        request.put("body", body == null ? "" : body);

        var response = send(post(repoPath(repo) + "/pulls", request));
        if (response.statusCode() == 404) {
            throw repoNotFound(repo);
        }
        if (response.statusCode() == 422) {
            throw RepolinkException.validation("pull_request_invalid",
                    "Cannot open pull request %s -> %s in %s: %s".formatted(head, base, repo, response.body()));
        }
        var json = requireOk(response, "POST pull request");
        log.info("Opened pull request #{} in {} ({} -> {})", json.path("number").asInt(), repo, head, base);
        return new PullRequestInfo(json.path("number").asInt(),
                json.path("title").asText(title),
                json.path("state").asText("open"),
                json.path("head").path("ref").asText(head),
                json.path("base").path("ref").asText(base),
                json.path("html_url").asText(null));
    }

    private JsonNode contents(String repo, String branch, String path) {
        String clean = path == null ? "" : stripSlashes(path);
        var response = send(get(repoPath(repo) + "/contents/" + encodePath(clean)
                + "?ref=" + encode(branch)));
        if (response.statusCode() == 404) {
            throw RepolinkException.notFound("path_not_found",
                    "Path '%s' not found in %s on %s".formatted(clean, repo, branch));
        }
        return requireOk(response, "GET contents " + clean);
    }

    private static RepoEntry toEntry(JsonNode item) {
        return new RepoEntry(item.path("name").asText(),
                item.path("path").asText(),
                item.path("type").asText(),
                item.path("sha").asText(),
                item.path("size").asLong());
    }

    // -- Error mapping ----------------------------------------------------

    /**
     * A 404 on a ref does not say whether the repository or the branch is
     * missing; one extra lookup tells them apart.
     */
    private RepolinkException missingRepoOrBranch(String repo, String branch) {
        var repoResponse = send(get(repoPath(repo)));
        if (repoResponse.statusCode() == 404) {
            return repoNotFound(repo);
        }
        return RepolinkException.notFound("branch_not_found",
                "Branch %s not found in %s".formatted(branch, repo));
    }

    private RepolinkException repoNotFound(String repo) {
        return RepolinkException.notFound("repo_not_found",
                "Repository %s/%s not found".formatted(properties.getOwner(), repo));
    }

    private static RepolinkException branchMoved(String branch, String expected, String actual) {
        return RepolinkException.conflict("ref_conflict",
                "Branch %s moved: expected head %s but found %s".formatted(branch, expected, actual));
    }

    private JsonNode requireOk(HttpResponse<String> response, String operation) {
        int status = response.statusCode();
        if (status >= 400) {
            throw RepolinkException.upstream("GitHub %s failed (HTTP %d): %s"
                    .formatted(operation, status, response.body()));
        }
        try {
            String body = response.body();
            return body == null || body.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(body);
        } catch (IOException e) {
            throw RepolinkException.upstream("Unparseable GitHub response for " + operation, e);
        }
    }

    // -- HTTP plumbing ----------------------------------------------------

    HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw RepolinkException.upstream("GitHub request timed out: "
                    + request.method() + " " + request.uri().getPath(), e);
        } catch (IOException e) {
            throw RepolinkException.upstream("GitHub request failed: "
                    + request.method() + " " + request.uri().getPath(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RepolinkException.upstream("Interrupted calling GitHub", e);
        }
    }

    private HttpRequest get(String path) {
        return builder(path).GET().build();
    }

    private HttpRequest delete(String path) {
        return builder(path).DELETE().build();
    }

    private HttpRequest post(String path, JsonNode body) {
        return builder(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
    }

    private HttpRequest patch(String path, JsonNode body) {
        return builder(path)
                .header("Content-Type", "application/json")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
    }

    private HttpRequest.Builder builder(String path) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(properties.getApiUrl()) + path))
                .timeout(Duration.ofSeconds(properties.getGithub().getRequestTimeoutSeconds()))
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("User-Agent", "repolink");
        if (properties.isTokenConfigured()) {
            builder.header("Authorization", "Bearer " + properties.getToken());
        }
        return builder;
    }

    private String repoPath(String repo) {
        String owner = properties.getOwner();
        if (owner == null || owner.isBlank()) {
            throw new RepolinkException(ErrorKind.INTERNAL, "owner_not_configured",
                    "repolink.github.owner is not configured");
        }
        return "/repos/" + encode(owner) + "/" + encode(repo);
    }

    static String encodePath(String path) {
        if (path.isEmpty()) {
            return "";
        }
        var parts = path.split("/");
        var sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append('/');
            sb.append(encode(parts[i]));
        }
        return sb.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripSlashes(String path) {
        String p = path;
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
