package com.repolink.core.objectstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repolink.config.RepolinkProperties;
import com.repolink.core.error.ErrorKind;
import com.repolink.core.error.RepolinkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises the GitHub client against a stubbed {@link HttpClient}. Routes
 * are keyed by "METHOD raw-path" (still percent-encoded, query string excluded).
 */
class GitHubObjectStoreClientTest {

    private HttpClient httpClient;
    private RepolinkProperties properties;
    private GitHubObjectStoreClient client;

    private final Map<String, Object> routes = new HashMap<>();
    private final List<HttpRequest> sent = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        properties = new RepolinkProperties();
        properties.getGithub().setApiUrl("https://api.example.test/");
        properties.getGithub().setOwner("acme");
        properties.getGithub().setToken("tok-123");
        client = new GitHubObjectStoreClient(properties, httpClient, new ObjectMapper());
        HttpResponse<String> notFound = response(404, "{\"message\":\"Not Found\"}");

        when(httpClient.send(any(HttpRequest.class), any())).thenAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            sent.add(request);
            Object outcome = routes.get(request.method() + " " + request.uri().getRawPath());
            if (outcome instanceof IOException e) {
                throw e;
            }
            if (outcome == null) {
                return notFound;
            }
            return outcome;
        });
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    private void route(String key, int status, String body) {
        routes.put(key, response(status, body));
    }

    private static void assertError(ErrorKind kind, String code, RepolinkException e) {
        assertEquals(kind, e.kind());
        assertEquals(code, e.code());
    }

    @Nested
    @DisplayName("Branch resolution")
    class BranchResolution {

        @Test
        @DisplayName("getBranchHead reads the ref sha and sends auth headers")
        void head() {
            route("GET /repos/acme/widgets/git/ref/heads/main", 200,
                    "{\"ref\":\"refs/heads/main\",\"object\":{\"sha\":\"abc123\",\"type\":\"commit\"}}");

            assertEquals("abc123", client.getBranchHead("widgets", "main"));

            HttpRequest request = sent.get(0);
            assertEquals("https://api.example.test/repos/acme/widgets/git/ref/heads/main",
                    request.uri().toString());
            assertEquals("Bearer tok-123", request.headers().firstValue("Authorization").orElseThrow());
            assertEquals("application/vnd.github+json", request.headers().firstValue("Accept").orElseThrow());
        }

        @Test
        @DisplayName("no Authorization header without a token")
        void noToken() {
            properties.getGithub().setToken("");
            route("GET /repos/acme/widgets/git/ref/heads/main", 200, "{\"object\":{\"sha\":\"abc\"}}");

            client.getBranchHead("widgets", "main");

            assertTrue(sent.get(0).headers().firstValue("Authorization").isEmpty());
        }

        @Test
        @DisplayName("missing ref in an existing repository is branch_not_found")
        void branchMissing() {
            route("GET /repos/acme/widgets", 200, "{\"name\":\"widgets\"}");

            var e = assertThrows(RepolinkException.class, () -> client.getBranchHead("widgets", "ghost"));
            assertError(ErrorKind.NOT_FOUND, "branch_not_found", e);
        }

        @Test
        @DisplayName("missing repository is repo_not_found")
        void repoMissing() {
            var e = assertThrows(RepolinkException.class, () -> client.getBranchHead("nothing", "main"));
            assertError(ErrorKind.NOT_FOUND, "repo_not_found", e);
        }

        @Test
        @DisplayName("unset owner fails before any request")
        void ownerNotConfigured() {
            properties.getGithub().setOwner("");
            var e = assertThrows(RepolinkException.class, () -> client.getBranchHead("widgets", "main"));
            assertError(ErrorKind.INTERNAL, "owner_not_configured", e);
            assertTrue(sent.isEmpty());
        }
    }

    @Nested
    @DisplayName("Object creation")
    class ObjectCreation {

        @Test
        @DisplayName("blob, tree and commit return the created shas")
        void createObjects() {
            route("POST /repos/acme/widgets/git/blobs", 201, "{\"sha\":\"blob1\"}");
            route("POST /repos/acme/widgets/git/trees", 201, "{\"sha\":\"tree1\"}");
            route("POST /repos/acme/widgets/git/commits", 201, "{\"sha\":\"commit1\"}");

            assertEquals("blob1", client.createBlob("widgets", "hi".getBytes()));
            assertEquals("tree1", client.createTree("widgets", "base",
                    List.of(TreeEntry.regularFile("a.txt", "blob1"))));
            assertEquals("commit1", client.createCommit("widgets", "msg", "tree1", "parent"));
        }

        @Test
        @DisplayName("server error is UPSTREAM")
        void serverError() {
            route("POST /repos/acme/widgets/git/blobs", 502, "bad gateway");
            var e = assertThrows(RepolinkException.class, () -> client.createBlob("widgets", new byte[0]));
            assertError(ErrorKind.UPSTREAM, "upstream_error", e);
        }

        @Test
        @DisplayName("transport failure outside the ref update is UPSTREAM")
        void transportFailure() {
            routes.put("POST /repos/acme/widgets/git/trees", new IOException("reset"));
            var e = assertThrows(RepolinkException.class, () -> client.createTree("widgets", "base", List.of()));
            assertError(ErrorKind.UPSTREAM, "upstream_error", e);
        }
    }

    @Nested
    @DisplayName("Ref update")
    class RefUpdate {

        private static final String REF = "GET /repos/acme/widgets/git/ref/heads/main";
        private static final String PATCH = "PATCH /repos/acme/widgets/git/refs/heads/main";

        @Test
        @DisplayName("matching head and 200 PATCH succeeds")
        void success() {
            route(REF, 200, "{\"object\":{\"sha\":\"old\"}}");
            route(PATCH, 200, "{\"object\":{\"sha\":\"new\"}}");

            client.updateRef("widgets", "main", "new", "old");

            assertEquals("PATCH", sent.get(sent.size() - 1).method());
        }

        @Test
        @DisplayName("moved head is ref_conflict and no PATCH is sent")
        void headMoved() {
            route(REF, 200, "{\"object\":{\"sha\":\"someone-else\"}}");

            var e = assertThrows(RepolinkException.class,
                    () -> client.updateRef("widgets", "main", "new", "old"));
            assertError(ErrorKind.CONFLICT, "ref_conflict", e);
            assertTrue(sent.stream().noneMatch(r -> r.method().equals("PATCH")));
        }

        @Test
        @DisplayName("422 on a non-forced PATCH is ref_conflict")
        void notFastForward() {
            route(REF, 200, "{\"object\":{\"sha\":\"old\"}}");
            route(PATCH, 422, "{\"message\":\"Update is not a fast forward\"}");

            var e = assertThrows(RepolinkException.class,
                    () -> client.updateRef("widgets", "main", "new", "old"));
            assertError(ErrorKind.CONFLICT, "ref_conflict", e);
        }

        @Test
        @DisplayName("timeout on PATCH is ref_update_ambiguous")
        void timeoutIsAmbiguous() {
            route(REF, 200, "{\"object\":{\"sha\":\"old\"}}");
            routes.put(PATCH, new HttpTimeoutException("request timed out"));

            var e = assertThrows(RepolinkException.class,
                    () -> client.updateRef("widgets", "main", "new", "old"));
            assertError(ErrorKind.CONFLICT, "ref_update_ambiguous", e);
        }

        @Test
        @DisplayName("branch names are escaped per segment so '#' and '%' stay in the path")
        void escapesBranchName() {
            route("GET /repos/acme/widgets/git/ref/heads/fix%2312", 200, "{\"object\":{\"sha\":\"old\"}}");
            route("PATCH /repos/acme/widgets/git/refs/heads/fix%2312", 200, "{\"object\":{\"sha\":\"new\"}}");

            client.updateRef("widgets", "fix#12", "new", "old");

            assertEquals(2, sent.size());
            for (HttpRequest request : sent) {
                assertNull(request.uri().getRawFragment());
                assertTrue(request.uri().getRawPath().endsWith("/heads/fix%2312"), request.uri().toString());
            }
        }

        @Test
        @DisplayName("slashes in a branch name are kept as path separators")
        void nestedBranchName() {
            route("GET /repos/acme/widgets/git/ref/heads/release/50%25-off", 200,
                    "{\"object\":{\"sha\":\"abc\"}}");

            assertEquals("abc", client.getBranchHead("widgets", "release/50%-off"));
        }

        @Test
        @DisplayName("connect failure on PATCH is UPSTREAM")
        void connectFailure() {
            route(REF, 200, "{\"object\":{\"sha\":\"old\"}}");
            routes.put(PATCH, new ConnectException("refused"));

            var e = assertThrows(RepolinkException.class,
                    () -> client.updateRef("widgets", "main", "new", "old"));
            assertError(ErrorKind.UPSTREAM, "upstream_error", e);
        }
    }

    @Nested
    @DisplayName("Repository pass-throughs")
    class PassThroughs {

        @Test
        @DisplayName("readFile decodes wrapped base64 content")
        void readFile() {
            route("GET /repos/acme/widgets/contents/docs/intro.md", 200,
                    "{\"type\":\"file\",\"path\":\"docs/intro.md\",\"sha\":\"s1\",\"size\":5,"
                            + "\"content\":\"aGVs\\nbG8=\\n\",\"encoding\":\"base64\"}");

            var file = client.readFile("widgets", "main", "docs/intro.md");
            assertEquals("hello", file.content());
            assertEquals("s1", file.sha());
        }

        @Test
        @DisplayName("readFile on a directory is not_a_file")
        void readDirectory() {
            route("GET /repos/acme/widgets/contents/docs", 200,
                    "[{\"type\":\"file\",\"name\":\"a.md\",\"path\":\"docs/a.md\",\"sha\":\"x\",\"size\":1}]");

            var e = assertThrows(RepolinkException.class, () -> client.readFile("widgets", "main", "docs"));
            assertError(ErrorKind.VALIDATION, "not_a_file", e);
        }

        @Test
        @DisplayName("createBranch on an existing name is branch_exists")
        void branchExists() {
            route("GET /repos/acme/widgets/git/ref/heads/main", 200, "{\"object\":{\"sha\":\"abc\"}}");
            route("POST /repos/acme/widgets/git/refs", 422, "{\"message\":\"Reference already exists\"}");

            var e = assertThrows(RepolinkException.class,
                    () -> client.createBranch("widgets", "feature", "main"));
            assertError(ErrorKind.CONFLICT, "branch_exists", e);
        }

        @Test
        @DisplayName("listRepositories uses the owner's repository listing")
        void listRepositories() {
            route("GET /users/acme/repos", 200,
                    "[{\"name\":\"widgets\",\"full_name\":\"acme/widgets\",\"private\":false,"
                            + "\"default_branch\":\"main\",\"html_url\":\"https://github.com/acme/widgets\"}]");

            var repos = client.listRepositories();
            assertEquals(1, repos.size());
            assertEquals("acme/widgets", repos.get(0).fullName());
            assertEquals("main", repos.get(0).defaultBranch());
        }

        @Test
        @DisplayName("deleteBranch escapes the branch name")
        void deleteEscapedBranch() {
            route("DELETE /repos/acme/widgets/git/refs/heads/wip%23draft", 204, "");

            client.deleteBranch("widgets", "wip#draft");

            assertEquals(1, sent.size());
        }

        @Test
        @DisplayName("createRepository posts to the authenticated user's repositories")
        void createRepository() {
            route("POST /user/repos", 201,
                    "{\"name\":\"gadgets\",\"full_name\":\"acme/gadgets\",\"private\":true,"
                            + "\"default_branch\":\"main\",\"html_url\":\"https://github.com/acme/gadgets\"}");

            var repo = client.createRepository("gadgets", null, true);

            assertEquals("acme/gadgets", repo.fullName());
            assertTrue(repo.isPrivate());
            assertEquals("POST", sent.get(0).method());
        }

        @Test
        @DisplayName("createRepository on a taken name is repo_exists")
        void createExistingRepository() {
            route("POST /user/repos", 422, "{\"message\":\"Repository creation failed.\"}");

            var e = assertThrows(RepolinkException.class, () -> client.createRepository("widgets", "", false));
            assertError(ErrorKind.CONFLICT, "repo_exists", e);
        }

        @Test
        @DisplayName("createPullRequest returns the number and branch refs")
        void createPullRequest() {
            route("POST /repos/acme/widgets/pulls", 201,
                    "{\"number\":7,\"title\":\"Add gears\",\"state\":\"open\","
                            + "\"head\":{\"ref\":\"feature\"},\"base\":{\"ref\":\"main\"},"
                            + "\"html_url\":\"https://github.com/acme/widgets/pull/7\"}");

            var pull = client.createPullRequest("widgets", "Add gears", "feature", "main", null);

            assertEquals(7, pull.number());
            assertEquals("feature", pull.head());
            assertEquals("main", pull.base());
            assertEquals("https://github.com/acme/widgets/pull/7", pull.htmlUrl());
        }

        @Test
        @DisplayName("createPullRequest rejected with 422 is pull_request_invalid")
        void pullRequestRejected() {
            route("POST /repos/acme/widgets/pulls", 422, "{\"message\":\"No commits between main and main\"}");

            var e = assertThrows(RepolinkException.class,
                    () -> client.createPullRequest("widgets", "Nothing", "main", "main", ""));
            assertError(ErrorKind.VALIDATION, "pull_request_invalid", e);
        }

        @Test
        @DisplayName("missing README is readme_not_found")
        void readmeMissing() {
            var e = assertThrows(RepolinkException.class, () -> client.readReadme("widgets", "main"));
            assertError(ErrorKind.NOT_FOUND, "readme_not_found", e);
        }
    }

    @Test
    @DisplayName("encodePath escapes each segment but keeps separators")
    void encodePath() {
        assertEquals("docs/my%20file.md", GitHubObjectStoreClient.encodePath("docs/my file.md"));
        assertEquals("", GitHubObjectStoreClient.encodePath(""));
    }
}
