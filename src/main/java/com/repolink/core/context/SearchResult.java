package com.repolink.core.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a case-insensitive substring search over one context.
 *
 * @param query         the query as submitted
 * @param results       one entry per file with at least one matching line
 * @param totalMatches  matching lines across all files
 * @param filesSearched files scanned, including those without matches
 */
public record SearchResult(
    String query,
    List<FileMatches> results,
    @JsonProperty("total_matches") int totalMatches,
    @JsonProperty("files_searched") int filesSearched
) {

    public record FileMatches(String path, List<LineMatch> matches) {}

    /**
     * @param line    1-based line number
     * @param content the raw line text
     * @param preview the line bounded to the configured preview length
     */
    public record LineMatch(int line, String content, String preview) {}
}
