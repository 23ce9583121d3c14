package com.repolink.core.context;

/**
 * Repository coordinates last attached to a context by a file add.
 */
public record RepoInfo(String repo, String branch) {}
