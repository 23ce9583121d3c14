package com.repolink.core.objectstore;

/**
 * A file read from a branch, with content decoded to text.
 */
public record RepoFile(String path, String sha, long size, String content) {}
