package com.repolink.core.repository;

import com.repolink.core.objectstore.RepoEntry;
import com.repolink.core.objectstore.RepoFile;
import com.repolink.core.objectstore.RepositoryGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the files under a repository path with their decoded content.
 * Only direct children are read; subdirectories are skipped.
 */
@Service
public class RepositoryFilesService {

    private static final Logger log = LoggerFactory.getLogger(RepositoryFilesService.class);

    private final RepositoryGateway gateway;

    public RepositoryFilesService(RepositoryGateway gateway) {
        this.gateway = gateway;
    }

    public List<RepoFile> fetchFiles(String repo, String branch, String path) {
        List<RepoEntry> entries = gateway.listPath(repo, branch, path);
        var files = new ArrayList<RepoFile>();
        for (RepoEntry entry : entries) {
            if (entry.isFile()) {
                files.add(gateway.readFile(repo, branch, entry.path()));
            }
        }
        log.info("Fetched {} file(s) from {}:{}/{}", files.size(), repo, branch, path == null ? "" : path);
        return files;
    }
}
