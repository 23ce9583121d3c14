package com.repolink.core.context;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable working set of staged files.
 *
 * <p>Not thread-safe on its own. {@link InMemoryContextStore} only touches an
 * instance from inside the map's per-key {@code compute} callbacks.
 */
public class Context {

    private final String id;
    private final Instant createdAt;
    private final Map<String, FileEntry> files = new LinkedHashMap<>();
    private RepoInfo repoInfo;

    public Context(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public RepoInfo repoInfo() {
        return repoInfo;
    }

    void putFile(FileEntry entry) {
        files.put(entry.path(), entry);
    }

    FileEntry removeFile(String path) {
        return files.remove(path);
    }

    void setRepoInfo(RepoInfo repoInfo) {
        this.repoInfo = repoInfo;
    }

    List<FileEntry> files() {
        return new ArrayList<>(files.values());
    }

    int fileCount() {
        return files.size();
    }

    /** True once {@code now - createdAt} is strictly greater than {@code retention}. */
    boolean isExpired(Instant now, Duration retention) {
        return Duration.between(createdAt, now).compareTo(retention) > 0;
    }

    ContextSnapshot snapshot() {
        var views = new ArrayList<ContextSnapshot.FileView>(files.size());
        for (FileEntry entry : files.values()) {
            views.add(new ContextSnapshot.FileView(
                    entry.path(), entry.content(), entry.size(), entry.addedAt()));
        }
        return new ContextSnapshot(id, createdAt, List.copyOf(views), repoInfo, views.size());
    }
}
