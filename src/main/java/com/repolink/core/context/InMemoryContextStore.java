package com.repolink.core.context;

import com.repolink.config.RepolinkProperties;
import com.repolink.core.error.RepolinkException;
import com.repolink.core.metrics.RepolinkMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Volatile {@link ContextStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Every read and write of a {@link Context} happens inside
 * {@code compute}/{@code computeIfPresent} for its key, so work on one id is
 * serialized while other ids proceed independently. The eviction sweep uses
 * the same path and therefore never sees a half-applied mutation.
 */
public class InMemoryContextStore implements ContextStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContextStore.class);

    private static final String ID_PREFIX = "ctx_";
    private static final String ELLIPSIS = "...";

    private final ConcurrentHashMap<String, Context> contexts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final SecureRandom random = new SecureRandom();

    private final Clock clock;
    private final RepolinkProperties properties;
    private final RepolinkMetrics metrics;

    public InMemoryContextStore(Clock clock, RepolinkProperties properties, RepolinkMetrics metrics) {
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public String create() {
        Instant now = clock.instant();
        String id = generateId(now);
        contexts.put(id, new Context(id, now));
        if (metrics != null) {
            metrics.recordContextCreated();
        }
        log.info("Created context {}", id);
        return id;
    }

    /**
     * Builds {@code ctx_<epochMillis>_<sequence>_<random>}. The sequence part
     * alone guarantees uniqueness for the lifetime of the process.
     */
    String generateId(Instant now) {
        String seq = Long.toString(sequence.incrementAndGet(), 36);
        String suffix = Long.toString(random.nextInt(36 * 36 * 36 * 36), 36);
        return ID_PREFIX + now.toEpochMilli() + "_" + seq + "_" + suffix;
    }

    @Override
    public void addFile(String contextId, String path, String content, String repo, String branch) {
        Instant now = clock.instant();
        FileEntry entry = FileEntry.of(path, content, now);
        Context updated = contexts.computeIfPresent(key(contextId), (id, ctx) -> {
            ctx.putFile(entry);
            if (repo != null && !repo.isBlank()) {
                String effectiveBranch = branch != null && !branch.isBlank()
                        ? branch : properties.getDefaultBranch();
                ctx.setRepoInfo(new RepoInfo(repo, effectiveBranch));
            }
            return ctx;
        });
        if (updated == null) {
            throw RepolinkException.contextNotFound(contextId);
        }
        log.debug("Staged {} ({} bytes) in context {}", path, entry.size(), contextId);
    }

    @Override
    public void removeFile(String contextId, String path) {
        var removed = new AtomicReference<FileEntry>();
        Context updated = contexts.computeIfPresent(key(contextId), (id, ctx) -> {
            removed.set(ctx.removeFile(path));
            return ctx;
        });
        if (updated == null) {
            throw RepolinkException.contextNotFound(contextId);
        }
        if (removed.get() == null) {
            throw RepolinkException.notFound("file_not_found",
                    "File not found in context %s: %s".formatted(contextId, path));
        }
        log.debug("Removed {} from context {}", path, contextId);
    }

    @Override
    public ContextSnapshot getContext(String contextId) {
        var snapshot = new AtomicReference<ContextSnapshot>();
        Context ctx = contexts.computeIfPresent(key(contextId), (id, c) -> {
            snapshot.set(c.snapshot());
            return c;
        });
        if (ctx == null) {
            throw RepolinkException.contextNotFound(contextId);
        }
        return snapshot.get();
    }

    @Override
    public SearchResult search(String contextId, String query) {
        // Snapshot first so an unknown id reports NOT_FOUND even with an empty query
        ContextSnapshot snapshot = getContext(contextId);
        if (query == null || query.isEmpty()) {
            throw RepolinkException.validation("empty_query", "Search query must not be empty");
        }

        String needle = query.toLowerCase(Locale.ROOT);
        int previewLength = properties.getPreviewLength();
        var results = new ArrayList<SearchResult.FileMatches>();
        int total = 0;

        for (ContextSnapshot.FileView file : snapshot.files()) {
            List<SearchResult.LineMatch> matches = new ArrayList<>();
            String[] lines = file.content().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                int idx = line.toLowerCase(Locale.ROOT).indexOf(needle);
                if (idx >= 0) {
                    matches.add(new SearchResult.LineMatch(i + 1, line, preview(line, idx, previewLength)));
                }
            }
            if (!matches.isEmpty()) {
                results.add(new SearchResult.FileMatches(file.path(), List.copyOf(matches)));
                total += matches.size();
            }
        }

        log.debug("Search '{}' in context {}: {} matches across {} files",
                query, contextId, total, snapshot.fileCount());
        return new SearchResult(query, List.copyOf(results), total, snapshot.fileCount());
    }

    /**
     * Bounds a line to {@code limit} characters, keeping the first match in view.
     */
    static String preview(String line, int matchIndex, int limit) {
        String trimmed = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        if (limit <= 0 || trimmed.length() <= limit) {
            return trimmed;
        }
        int start = Math.max(0, Math.min(matchIndex - limit / 4, trimmed.length() - limit));
        int end = start + limit;
        var sb = new StringBuilder(limit + 2 * ELLIPSIS.length());
        if (start > 0) {
            sb.append(ELLIPSIS);
        }
        sb.append(trimmed, start, end);
        if (end < trimmed.length()) {
            sb.append(ELLIPSIS);
        }
        return sb.toString();
    }

    @Override
    public int evictExpired(Instant now) {
        int evicted = 0;
        for (String id : new ArrayList<>(contexts.keySet())) {
            var removed = new AtomicReference<Boolean>(false);
            contexts.computeIfPresent(id, (k, ctx) -> {
                if (ctx.isExpired(now, properties.getRetention())) {
                    removed.set(true);
                    return null;
                }
                return ctx;
            });
            if (removed.get()) {
                evicted++;
                log.info("Evicted expired context {}", id);
            }
        }
        if (evicted > 0 && metrics != null) {
            metrics.recordContextsEvicted(evicted);
        }
        return evicted;
    }

    @Override
    public int size() {
        return contexts.size();
    }

    private static String key(String contextId) {
        // ConcurrentHashMap rejects null keys; "" never matches a generated id
        return contextId != null ? contextId : "";
    }
}
