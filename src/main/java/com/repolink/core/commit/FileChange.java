package com.repolink.core.commit;

/**
 * New content for one path. Empty content is legal and yields an empty file.
 */
public record FileChange(String path, String content) {}
