package com.repolink.core.objectstore;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A file or directory returned by a path listing.
 *
 * @param type "file" or "dir" (GitHub may also report "symlink" or "submodule")
 */
public record RepoEntry(
    String name,
    String path,
    String type,
    String sha,
    long size
) {

    @JsonIgnore
    public boolean isFile() {
        return "file".equals(type);
    }
}
