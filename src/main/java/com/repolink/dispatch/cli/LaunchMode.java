package com.repolink.dispatch.cli;

import java.util.List;

/**
 * How a process was asked to run, decided from the raw arguments before
 * Spring starts.
 *
 * <p>{@link #SERVER} keeps an embedded web server up until shutdown;
 * {@link #COMMAND} hands the arguments to picocli and exits with its code.
 */
public enum LaunchMode {
    SERVER,
    COMMAND;

    private static final List<String> HELP_FLAGS = List.of("-h", "--help", "-V", "--version");

    /**
     * Only a leading {@code serve} subcommand starts the server, so an option
     * value that happens to read "serve" cannot. {@code serve --help} stays a
     * command and prints usage.
     */
    public static LaunchMode of(String... args) {
        if (args.length == 0 || !"serve".equals(args[0])) {
            return COMMAND;
        }
        for (String arg : args) {
            if (HELP_FLAGS.contains(arg)) {
                return COMMAND;
            }
        }
        return SERVER;
    }

    /**
     * Hosting platforms set {@code PORT} and start the jar without arguments;
     * treat that as a request to serve.
     */
    public static String[] withHostedDefault(String[] args, String portEnv) {
        return args.length == 0 && portEnv != null ? new String[]{"serve"} : args;
    }
}
