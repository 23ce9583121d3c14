package com.repolink.dispatch.cli;

import com.repolink.core.commit.CommitResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Repolink CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) REPOLINK v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [REPOLINK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void committed(CommitResult result) {
        success("Committed " + shortSha(result.commitSha()) + " to "
                + result.repo() + "/" + result.branch()
                + " (parent " + shortSha(result.parentSha()) + ")");
        for (var file : result.files()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) ~|@ " + file.path() + " @|faint " + shortSha(file.blobSha()) + "|@"));
        }
    }

    static String shortSha(String sha) {
        if (sha == null) return "-";
        return sha.length() > 7 ? sha.substring(0, 7) : sha;
    }
}
