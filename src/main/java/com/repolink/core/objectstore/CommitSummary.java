package com.repolink.core.objectstore;

public record CommitSummary(
    String sha,
    String message,
    String author,
    String date
) {}
