package com.repolink.core.objectstore;

import com.repolink.core.error.ErrorKind;
import com.repolink.core.error.RepolinkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryObjectStoreTest {

    private InMemoryObjectStore store;
    private String initialHead;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        initialHead = store.createRepository("sandbox", "main");
    }

    private String commitFile(String path, String content, String message) {
        String head = store.getBranchHead("sandbox", "main");
        String blob = store.createBlob("sandbox", content.getBytes(StandardCharsets.UTF_8));
        String tree = store.createTree("sandbox", store.getTree("sandbox", head),
                List.of(TreeEntry.regularFile(path, blob)));
        String commit = store.createCommit("sandbox", message, tree, head);
        store.updateRef("sandbox", "main", commit, head);
        return commit;
    }

    @Test
    @DisplayName("blob sha matches git's object hash")
    void gitCompatibleBlobHash() {
        // `printf 'hello\n' | git hash-object --stdin`
        assertEquals("ce013625030ba8dba906f756967f9e9ca394464a",
                store.createBlob("sandbox", "hello\n".getBytes(StandardCharsets.UTF_8)));
        // the empty blob
        assertEquals("e69de29bb2d1d6434b8b29ae775ad8c2e48c5391", store.createBlob("sandbox", new byte[0]));
    }

    @Test
    @DisplayName("createRepository is idempotent")
    void createRepositoryIdempotent() {
        assertEquals(initialHead, store.createRepository("sandbox", "main"));
        assertEquals(1, store.listRepositories().size());
    }

    @Test
    @DisplayName("updateRef with a stale expected head is ref_conflict")
    void staleRefUpdate() {
        String first = commitFile("a.txt", "a", "first");
        var e = assertThrows(RepolinkException.class,
                () -> store.updateRef("sandbox", "main", first, initialHead));
        assertEquals(ErrorKind.CONFLICT, e.kind());
        assertEquals("ref_conflict", e.code());
    }

    @Test
    @DisplayName("listPath groups nested files into directories")
    void listPath() {
        commitFile("README.md", "# Sandbox", "readme");
        commitFile("src/main/App.java", "class App {}", "app");
        commitFile("src/util.txt", "u", "util");

        var root = store.listPath("sandbox", "main", "");
        assertEquals(List.of("README.md", "src"), root.stream().map(RepoEntry::name).toList());
        assertEquals("dir", root.get(1).type());

        var src = store.listPath("sandbox", "main", "/src/");
        assertEquals(List.of("main", "util.txt"), src.stream().map(RepoEntry::name).toList());

        var e = assertThrows(RepolinkException.class, () -> store.listPath("sandbox", "main", "nope"));
        assertEquals("path_not_found", e.code());
    }

    @Test
    @DisplayName("branches share history until they diverge")
    void branches() {
        commitFile("a.txt", "a", "first");
        var feature = store.createBranch("sandbox", "feature", "main");
        assertEquals(store.getBranchHead("sandbox", "main"), feature.headSha());

        var exists = assertThrows(RepolinkException.class, () -> store.createBranch("sandbox", "feature", "main"));
        assertEquals("branch_exists", exists.code());

        store.deleteBranch("sandbox", "feature");
        var gone = assertThrows(RepolinkException.class, () -> store.getBranch("sandbox", "feature"));
        assertEquals("branch_not_found", gone.code());
    }

    @Test
    @DisplayName("readme lookup and commit history")
    void readmeAndHistory() {
        var missing = assertThrows(RepolinkException.class, () -> store.readReadme("sandbox", "main"));
        assertEquals("readme_not_found", missing.code());

        commitFile("README.md", "# Hi", "Add readme");
        assertEquals("# Hi", store.readReadme("sandbox", "main"));

        var history = store.listCommits("sandbox", "main");
        assertEquals(List.of("Add readme", "Initial commit"),
                history.stream().map(CommitSummary::message).toList());
    }

    @Test
    @DisplayName("tree entries must reference stored blobs")
    void unknownBlob() {
        String tree = store.getTree("sandbox", initialHead);
        var e = assertThrows(RepolinkException.class, () ->
                store.createTree("sandbox", tree, List.of(TreeEntry.regularFile("x", "deadbeef"))));
        assertEquals(ErrorKind.UPSTREAM, e.kind());
    }

    @Test
    @DisplayName("createRepository through the gateway rejects a taken name")
    void createRepositoryThroughGateway() {
        var created = store.createRepository("gadgets", "Gadget tracker", false);
        assertEquals("main", created.defaultBranch());
        assertNotNull(store.getBranchHead("gadgets", "main"));

        var e = assertThrows(RepolinkException.class, () -> store.createRepository("sandbox", "", false));
        assertEquals(ErrorKind.CONFLICT, e.kind());
        assertEquals("repo_exists", e.code());
        assertEquals(initialHead, store.getBranchHead("sandbox", "main"));
    }

    @Test
    @DisplayName("pull requests are numbered per repository and need diverged branches")
    void pullRequests() {
        store.createBranch("sandbox", "feature", "main");

        var empty = assertThrows(RepolinkException.class,
                () -> store.createPullRequest("sandbox", "Nothing yet", "feature", "main", null));
        assertEquals("pull_request_invalid", empty.code());

        String head = store.getBranchHead("sandbox", "feature");
        String blob = store.createBlob("sandbox", "gear".getBytes(StandardCharsets.UTF_8));
        String tree = store.createTree("sandbox", store.getTree("sandbox", head),
                List.of(TreeEntry.regularFile("gear.txt", blob)));
        store.updateRef("sandbox", "feature", store.createCommit("sandbox", "gear", tree, head), head);

        var first = store.createPullRequest("sandbox", "Add gear", "feature", "main", "");
        var second = store.createPullRequest("sandbox", "Add gear again", "feature", "main", "");
        assertEquals(1, first.number());
        assertEquals(2, second.number());
        assertEquals("open", first.state());

        var unknown = assertThrows(RepolinkException.class,
                () -> store.createPullRequest("sandbox", "Ghost", "ghost", "main", null));
        assertEquals(ErrorKind.VALIDATION, unknown.kind());
    }
}
