package com.repolink.core.commit;

import com.repolink.core.codec.ContentCodec;
import com.repolink.core.error.ErrorKind;
import com.repolink.core.error.RepolinkException;
import com.repolink.core.logging.MdcContext;
import com.repolink.core.metrics.RepolinkMetrics;
import com.repolink.core.objectstore.ObjectStoreClient;
import com.repolink.core.objectstore.TreeEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns a {@link CommitRequest} into exactly one new commit on a branch.
 *
 * <p>Sequence: resolve head, read its tree, upload blobs (in parallel), build
 * a tree over the base tree, create a single-parent commit, then move the
 * branch with a compare-and-swap against the head read in the first step.
 * Nothing touches the branch before that last step, so a failure anywhere
 * earlier leaves it as it was. Objects left behind by a failed attempt are
 * unreachable and harmless.
 *
 * <p>A moved branch surfaces as a {@code CONFLICT}. This class never retries;
 * the caller decides whether re-resolving and resubmitting is safe.
 */
public class AtomicCommitBuilder {

    private static final Logger log = LoggerFactory.getLogger(AtomicCommitBuilder.class);

    private final ObjectStoreClient objectStore;
    private final Executor blobExecutor;
    private final RepolinkMetrics metrics;

    public AtomicCommitBuilder(ObjectStoreClient objectStore, Executor blobExecutor, RepolinkMetrics metrics) {
        this.objectStore = objectStore;
        this.blobExecutor = blobExecutor;
        this.metrics = metrics;
    }

    public CommitResult commit(CommitRequest request) {
        return commit(request, new CommitAttempt(UUID.randomUUID().toString().substring(0, 8)));
    }

    /**
     * Runs {@code request} as {@code attempt}. On return the attempt is
     * {@link CommitState#COMMITTED}; on exception it is {@link CommitState#ABORTED}.
     */
    public CommitResult commit(CommitRequest request, CommitAttempt attempt) {
        long startMs = System.currentTimeMillis();
        try {
            validate(request);
        } catch (RepolinkException e) {
            attempt.abort(e);
            record("validation", startMs);
            throw e;
        }

        String repo = request.repo();
        String branch = request.branch();
        Map<String, String> files = normalize(request.files());

        MdcContext.setCommit(repo, branch, attempt.id());
        try {
            // RESOLVING
            String headSha = objectStore.getBranchHead(repo, branch);
            String baseTreeSha = objectStore.getTree(repo, headSha);
            log.info("Committing {} file(s) to {}/{} on top of {}", files.size(), repo, branch, headSha);

            attempt.advance(); // BLOBS_PENDING
            Map<String, String> blobShas = createBlobs(repo, branch, attempt.id(), files);

            attempt.advance(); // TREE_BUILDING
            var entries = new ArrayList<TreeEntry>(blobShas.size());
            blobShas.forEach((path, sha) -> entries.add(TreeEntry.regularFile(path, sha)));
            String treeSha = objectStore.createTree(repo, baseTreeSha, entries);

            attempt.advance(); // COMMIT_PENDING
            String commitSha = objectStore.createCommit(repo, request.message(), treeSha, headSha);

            attempt.advance(); // REF_UPDATING
            objectStore.updateRef(repo, branch, commitSha, headSha);

            attempt.advance(); // COMMITTED
            log.info("Committed {} to {}/{} ({} file(s))", commitSha, repo, branch, files.size());
            record("committed", startMs);
            if (metrics != null) {
                metrics.recordCommitFiles(files.size());
            }

            var committed = new ArrayList<CommitResult.CommittedFile>(blobShas.size());
            blobShas.forEach((path, sha) -> committed.add(new CommitResult.CommittedFile(path, sha)));
            return new CommitResult(commitSha, request.message(), repo, branch, headSha, treeSha,
                    List.copyOf(committed));
        } catch (RepolinkException e) {
            log.warn("Commit to {}/{} aborted in {}: [{}] {}",
                    repo, branch, attempt.state(), e.code(), e.getMessage());
            attempt.abort(e);
            record(e.kind().name().toLowerCase(Locale.ROOT), startMs);
            throw e;
        } catch (RuntimeException e) {
            log.error("Commit to {}/{} failed unexpectedly in {}", repo, branch, attempt.state(), e);
            attempt.abort(e);
            record("internal", startMs);
            throw new RepolinkException(ErrorKind.INTERNAL, "internal_error",
                    "Commit failed: " + e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Uploads every file as a blob. Uploads are independent, so they run
     * concurrently; the returned map keeps request order.
     */
    private Map<String, String> createBlobs(String repo, String branch, String attemptId,
                                           Map<String, String> files) {
        var futures = new LinkedHashMap<String, CompletableFuture<String>>();
        for (var file : files.entrySet()) {
            byte[] bytes = ContentCodec.toBytes(file.getValue());
            futures.put(file.getKey(), CompletableFuture.supplyAsync(() -> {
                MdcContext.setCommit(repo, branch, attemptId);
                try {
                    return objectStore.createBlob(repo, bytes);
                } finally {
                    MdcContext.clear();
                }
            }, blobExecutor));
        }

        var shas = new LinkedHashMap<String, String>();
        try {
            for (var future : futures.entrySet()) {
                shas.put(future.getKey(), future.getValue().join());
            }
        } catch (CompletionException e) {
            futures.values().forEach(f -> f.cancel(false));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return shas;
    }

    static void validate(CommitRequest request) {
        if (request == null) {
            throw RepolinkException.validation("Commit request is required");
        }
        if (isBlank(request.repo())) {
            throw RepolinkException.validation("repo is required");
        }
        if (isBlank(request.branch())) {
            throw RepolinkException.validation("branch is required");
        }
        if (isBlank(request.message())) {
            throw RepolinkException.validation("message is required");
        }
        if (request.files() == null || request.files().isEmpty()) {
            throw RepolinkException.validation("empty_file_list", "At least one file is required");
        }
        for (FileChange file : request.files()) {
            if (file == null || isBlank(file.path()) || isBlank(stripLeadingSlashes(file.path()))) {
                throw RepolinkException.validation("Every file needs a non-empty path");
            }
        }
    }

    /**
     * Path to content in first-seen order; a repeated path keeps its first
     * position but takes the last content.
     */
    static Map<String, String> normalize(List<FileChange> files) {
        var byPath = new LinkedHashMap<String, String>();
        for (FileChange file : files) {
            byPath.put(stripLeadingSlashes(file.path()), file.content() != null ? file.content() : "");
        }
        return byPath;
    }

    private static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private void record(String outcome, long startMs) {
        if (metrics != null) {
            metrics.recordCommit(outcome, System.currentTimeMillis() - startMs);
        }
    }
}
