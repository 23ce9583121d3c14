package com.repolink.dispatch.cli;

import com.repolink.config.RepolinkProperties;
import com.repolink.core.commit.AtomicCommitBuilder;
import com.repolink.core.commit.CommitRequest;
import com.repolink.core.commit.CommitResult;
import com.repolink.core.commit.FileChange;
import com.repolink.core.error.RepolinkException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: repolink commit --repo R -m "msg" FILE...
 * <p>
 * Reads local files and commits them to the branch as a single commit.
 * Each file's repository path is its path relative to {@code --base-dir};
 * files outside that directory are refused before anything is committed.
 */
@Command(name = "commit", mixinStandardHelpOptions = true,
        description = "Commit local files to a branch as one atomic commit")
@Component
public class CommitCommand implements Callable<Integer> {

    @Option(names = "--repo", required = true, description = "Target repository name")
    private String repo;

    @Option(names = "--branch", description = "Target branch (default: repolink.context.default-branch)")
    private String branch;

    @Option(names = {"-m", "--message"}, required = true, description = "Commit message")
    private String message;

    @Option(names = "--base-dir", defaultValue = ".",
            description = "Directory that repository paths are relative to (default: ${DEFAULT-VALUE})")
    private Path baseDir;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to commit")
    private List<Path> files;

    private final AtomicCommitBuilder commitBuilder;
    private final RepolinkProperties properties;

    public CommitCommand(AtomicCommitBuilder commitBuilder, RepolinkProperties properties) {
        this.commitBuilder = commitBuilder;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String targetBranch = branch != null && !branch.isBlank() ? branch : properties.getDefaultBranch();
        List<FileChange> changes;
        try {
            changes = readFiles();
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read file: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Committing " + changes.size() + " file(s) to " + repo + "/" + targetBranch);
        try {
            CommitResult result = commitBuilder.commit(new CommitRequest(repo, targetBranch, changes, message));
            ConsoleOutput.committed(result);
            return 0;
        } catch (RepolinkException e) {
            ConsoleOutput.error(e.kind() + " [" + e.code() + "] " + e.getMessage());
            return 1;
        }
    }

    private List<FileChange> readFiles() throws IOException {
        Path base = baseDir.toAbsolutePath().normalize();
        var changes = new ArrayList<FileChange>(files.size());
        for (Path file : files) {
            Path absolute = base.resolve(file).normalize();
            String repoPath = toRepoPath(base, absolute);
            changes.add(new FileChange(repoPath, Files.readString(absolute, StandardCharsets.UTF_8)));
        }
        return changes;
    }

    /**
     * Repository path of {@code file}; both paths must be absolute and normalized.
     *
     * @throws IllegalArgumentException when {@code file} is not strictly inside {@code base}
     */
    static String toRepoPath(Path base, Path file) {
        if (!file.startsWith(base) || file.equals(base)) {
            throw new IllegalArgumentException("%s is outside --base-dir %s".formatted(file, base));
        }
        return base.relativize(file).toString().replace('\\', '/');
    }
}
