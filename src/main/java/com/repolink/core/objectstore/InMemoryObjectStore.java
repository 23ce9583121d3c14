package com.repolink.core.objectstore;

import com.repolink.core.codec.ContentCodec;
import com.repolink.core.error.RepolinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Content-addressed object store held in process memory.
 *
 * <p>Objects are keyed by the SHA-1 of a git-style header plus payload, so
 * identical blobs share one sha. Trees are stored flattened (full path to
 * blob sha). Ref updates compare-and-swap under the repository's monitor.
 * Selected with {@code repolink.object-store.provider=memory}; nothing
 * survives a restart.
 */
public class InMemoryObjectStore implements ObjectStoreClient, RepositoryGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStore.class);

    private final ConcurrentHashMap<String, Repo> repos = new ConcurrentHashMap<>();
    private final AtomicLong commitClock = new AtomicLong();

    private record StoredCommit(String sha, String treeSha, String parentSha, String message, Instant createdAt) {}

    private static final class Repo {
        final String name;
        final String defaultBranch;
        final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
        final Map<String, SortedMap<String, String>> trees = new ConcurrentHashMap<>();
        final Map<String, StoredCommit> commits = new ConcurrentHashMap<>();
        final Map<String, String> refs = new HashMap<>();
        final List<PullRequestInfo> pulls = new ArrayList<>();

        Repo(String name, String defaultBranch) {
            this.name = name;
            this.defaultBranch = defaultBranch;
        }
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * Creates a repository whose {@code defaultBranch} points at an initial
     * commit with an empty tree. No-op when the repository already exists.
     *
     * @return the head sha of {@code defaultBranch}
     */
    public String createRepository(String repoName, String defaultBranch) {
        Repo repo = repos.computeIfAbsent(repoName, n -> {
            log.info("Created in-memory repository {} on {}", n, defaultBranch);
            return initialized(n, defaultBranch);
        });
        synchronized (repo) {
            return repo.refs.get(repo.defaultBranch);
        }
    }

    // -- Object primitives ------------------------------------------------

    @Override
    public String getBranchHead(String repo, String branch) {
        Repo r = repo(repo);
        synchronized (r) {
            String head = r.refs.get(branch);
            if (head == null) {
                throw branchNotFound(repo, branch);
            }
            return head;
        }
    }

    @Override
    public String getTree(String repo, String commitSha) {
        StoredCommit commit = repo(repo).commits.get(commitSha);
        if (commit == null) {
            throw RepolinkException.notFound("commit_not_found",
                    "Commit %s not found in %s".formatted(commitSha, repo));
        }
        return commit.treeSha();
    }

    @Override
    public String createBlob(String repo, byte[] content) {
        Repo r = repo(repo);
        String sha = hash("blob", content);
        r.blobs.putIfAbsent(sha, content.clone());
        return sha;
    }

    @Override
    public String createTree(String repo, String baseTreeSha, List<TreeEntry> entries) {
        Repo r = repo(repo);
        SortedMap<String, String> base = baseTreeSha == null ? new TreeMap<>() : r.trees.get(baseTreeSha);
        if (base == null) {
            throw RepolinkException.notFound("tree_not_found", "Tree not found: " + baseTreeSha);
        }
        var merged = new TreeMap<>(base);
        for (TreeEntry entry : entries) {
            if (!r.blobs.containsKey(entry.sha())) {
                throw RepolinkException.upstream("Tree entry %s references unknown blob %s"
                        .formatted(entry.path(), entry.sha()));
            }
            merged.put(entry.path(), entry.sha());
        }
        return storeTree(r, merged);
    }

    @Override
    public String createCommit(String repo, String message, String treeSha, String parentSha) {
        Repo r = repo(repo);
        if (!r.trees.containsKey(treeSha)) {
            throw RepolinkException.notFound("tree_not_found", "Tree not found: " + treeSha);
        }
        if (parentSha != null && !r.commits.containsKey(parentSha)) {
            throw RepolinkException.notFound("commit_not_found", "Parent commit not found: " + parentSha);
        }
        return storeCommit(r, message, treeSha, parentSha);
    }

    @Override
    public void updateRef(String repo, String branch, String newSha, String expectedOldSha) {
        Repo r = repo(repo);
        if (!r.commits.containsKey(newSha)) {
            throw RepolinkException.notFound("commit_not_found", "Commit not found: " + newSha);
        }
        synchronized (r) {
            String current = r.refs.get(branch);
            if (current == null) {
                throw branchNotFound(repo, branch);
            }
            if (!current.equals(expectedOldSha)) {
                throw RepolinkException.conflict("ref_conflict",
                        "Branch %s moved: expected head %s but found %s"
                                .formatted(branch, expectedOldSha, current));
            }
            r.refs.put(branch, newSha);
        }
        log.debug("Moved {}/{} from {} to {}", repo, branch, expectedOldSha, newSha);
    }

    // -- Repository pass-throughs -----------------------------------------

    @Override
    public List<RepositorySummary> listRepositories() {
        var result = new ArrayList<RepositorySummary>();
        for (Repo r : new TreeMap<>(repos).values()) {
            result.add(new RepositorySummary(r.name, "memory/" + r.name, true, r.defaultBranch, null));
        }
        return result;
    }

    @Override
    public RepositorySummary createRepository(String name, String description, boolean isPrivate) {
        if (repos.putIfAbsent(name, initialized(name, "main")) != null) {
            throw RepolinkException.conflict("repo_exists", "Repository already exists: " + name);
        }
        log.info("Created in-memory repository {} on main", name);
        return new RepositorySummary(name, "memory/" + name, true, "main", null);
    }

    private Repo initialized(String name, String defaultBranch) {
        var r = new Repo(name, defaultBranch);
        String emptyTree = storeTree(r, new TreeMap<>());
        r.refs.put(defaultBranch, storeCommit(r, "Initial commit", emptyTree, null));
        return r;
    }

    @Override
    public BranchInfo getBranch(String repo, String branch) {
        return new BranchInfo(branch, getBranchHead(repo, branch), false);
    }

    @Override
    public BranchInfo createBranch(String repo, String newBranch, String fromBranch) {
        Repo r = repo(repo);
        synchronized (r) {
            String from = r.refs.get(fromBranch);
            if (from == null) {
                throw branchNotFound(repo, fromBranch);
            }
            if (r.refs.containsKey(newBranch)) {
                throw RepolinkException.conflict("branch_exists",
                        "Branch %s already exists in %s".formatted(newBranch, repo));
            }
            r.refs.put(newBranch, from);
            return new BranchInfo(newBranch, from, false);
        }
    }

    @Override
    public void deleteBranch(String repo, String branch) {
        Repo r = repo(repo);
        synchronized (r) {
            if (r.refs.remove(branch) == null) {
                throw branchNotFound(repo, branch);
            }
        }
    }

    @Override
    public List<CommitSummary> listCommits(String repo, String branch) {
        Repo r = repo(repo);
        var result = new ArrayList<CommitSummary>();
        String sha = getBranchHead(repo, branch);
        while (sha != null) {
            StoredCommit c = r.commits.get(sha);
            result.add(new CommitSummary(c.sha(), c.message(), "repolink", c.createdAt().toString()));
            sha = c.parentSha();
        }
        return result;
    }

    @Override
    public List<RepoEntry> listPath(String repo, String branch, String path) {
        Repo r = repo(repo);
        SortedMap<String, String> tree = r.trees.get(getTree(repo, getBranchHead(repo, branch)));
        String clean = path == null ? "" : path.replaceAll("^/+|/+$", "");

        if (!clean.isEmpty() && tree.containsKey(clean)) {
            return List.of(fileEntry(r, clean, tree.get(clean)));
        }

        String prefix = clean.isEmpty() ? "" : clean + "/";
        var entries = new LinkedHashMap<String, RepoEntry>();
        for (var e : tree.entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                continue;
            }
            String rest = e.getKey().substring(prefix.length());
            int slash = rest.indexOf('/');
            if (slash < 0) {
                entries.put(rest, fileEntry(r, e.getKey(), e.getValue()));
            } else {
                String dir = rest.substring(0, slash);
                entries.putIfAbsent(dir, new RepoEntry(dir, prefix + dir, "dir", "", 0));
            }
        }
        if (entries.isEmpty() && !clean.isEmpty()) {
            throw RepolinkException.notFound("path_not_found",
                    "Path '%s' not found in %s on %s".formatted(clean, repo, branch));
        }
        return new ArrayList<>(entries.values());
    }

    @Override
    public RepoFile readFile(String repo, String branch, String path) {
        Repo r = repo(repo);
        SortedMap<String, String> tree = r.trees.get(getTree(repo, getBranchHead(repo, branch)));
        String blobSha = tree.get(path);
        if (blobSha == null) {
            throw RepolinkException.notFound("path_not_found",
                    "Path '%s' not found in %s on %s".formatted(path, repo, branch));
        }
        byte[] content = r.blobs.get(blobSha);
        return new RepoFile(path, blobSha, content.length, new String(content, StandardCharsets.UTF_8));
    }

    @Override
    public String readReadme(String repo, String branch) {
        Repo r = repo(repo);
        SortedMap<String, String> tree = r.trees.get(getTree(repo, getBranchHead(repo, branch)));
        for (String candidate : List.of("README.md", "README", "readme.md", "README.txt")) {
            if (tree.containsKey(candidate)) {
                return new String(r.blobs.get(tree.get(candidate)), StandardCharsets.UTF_8);
            }
        }
        throw RepolinkException.notFound("readme_not_found",
                "No README in %s on %s".formatted(repo, branch));
    }

    @Override
    public PullRequestInfo createPullRequest(String repo, String title, String head, String base, String body) {
        Repo r = repo(repo);
        synchronized (r) {
            String headSha = r.refs.get(head);
            String baseSha = r.refs.get(base);
            if (headSha == null || baseSha == null) {
                throw RepolinkException.validation("pull_request_invalid",
                        "Unknown branch in %s -> %s".formatted(head, base));
            }
            if (headSha.equals(baseSha)) {
                throw RepolinkException.validation("pull_request_invalid",
                        "No commits between %s and %s".formatted(base, head));
            }
            var pull = new PullRequestInfo(r.pulls.size() + 1, title, "open", head, base, null);
            r.pulls.add(pull);
            log.debug("Opened pull request #{} in {} ({} -> {})", pull.number(), repo, head, base);
            return pull;
        }
    }

    // -- Internals --------------------------------------------------------

    private Repo repo(String name) {
        Repo r = name == null ? null : repos.get(name);
        if (r == null) {
            throw RepolinkException.notFound("repo_not_found", "Repository not found: " + name);
        }
        return r;
    }

    private static RepolinkException branchNotFound(String repo, String branch) {
        return RepolinkException.notFound("branch_not_found",
                "Branch %s not found in %s".formatted(branch, repo));
    }

    private static RepoEntry fileEntry(Repo r, String path, String sha) {
        int slash = path.lastIndexOf('/');
        return new RepoEntry(path.substring(slash + 1), path, "file", sha, r.blobs.get(sha).length);
    }

    private static String storeTree(Repo r, SortedMap<String, String> entries) {
        var sb = new StringBuilder();
        for (var e : entries.entrySet()) {
            sb.append(TreeEntry.REGULAR_FILE_MODE).append(' ')
                    .append(e.getKey()).append('\0').append(e.getValue()).append('\n');
        }
        String sha = hash("tree", ContentCodec.toBytes(sb.toString()));
        r.trees.putIfAbsent(sha, new TreeMap<>(entries));
        return sha;
    }

    private String storeCommit(Repo r, String message, String treeSha, String parentSha) {
        // The tick plays the role of git's author timestamp
        long tick = commitClock.incrementAndGet();
        var body = "tree " + treeSha + "\n"
                + (parentSha != null ? "parent " + parentSha + "\n" : "")
                + "tick " + tick + "\n\n" + message;
        String sha = hash("commit", ContentCodec.toBytes(body));
        r.commits.put(sha, new StoredCommit(sha, treeSha, parentSha, message, Instant.now()));
        return sha;
    }

    static String hash(String type, byte[] payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            digest.update((type + " " + payload.length + "\0").getBytes(StandardCharsets.UTF_8));
            byte[] hash = digest.digest(payload);
            var sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }
}
