package com.fcube.app.commands;

import java.util.List;

/**
 * Parsed arguments of {@code fcube addplugin}.
 *
 * @param pluginName plugin to install; null lists plugins
 * @param dir        target directory relative to the project root; null uses the configured app dir
 */
public record AddPluginArgs(
        String pluginName,
        boolean list,
        boolean dryRun,
        boolean force,
        String dir,
        boolean json,
        boolean help) {

    public static final String USAGE = """
            Usage: fcube addplugin [<plugin>] [options]

            Install a plugin into the current FCube project.

            Options:
              -l, --list          List available plugins (default when no plugin is given)
                  --dry-run       Show the files that would be written without writing them
              -f, --force         Overwrite existing files
              -d, --dir <path>    Target directory, relative to the project root (default: app)
                  --json          Print --list or --dry-run output as JSON
              -h, --help          Show this help
            """;

    /** Raised for a malformed command line; maps to exit code 2. */
    public static class UsageException extends RuntimeException {
        public UsageException(String message) {
            super(message);
        }
    }

    /** Lists plugins instead of installing one. */
    public boolean isListing() {
        return list || pluginName == null;
    }

    /**
     * @throws UsageException on unknown options, a missing option value, or extra arguments
     */
    public static AddPluginArgs parse(List<String> args) {
        String pluginName = null;
        boolean list = false;
        boolean dryRun = false;
        boolean force = false;
        boolean json = false;
        boolean help = false;
        String dir = null;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "-l", "--list" -> list = true;
                case "--dry-run" -> dryRun = true;
                case "-f", "--force" -> force = true;
                case "--json" -> json = true;
                case "-h", "--help" -> help = true;
                case "-d", "--dir" -> {
                    if (i + 1 >= args.size() || args.get(i + 1).isBlank()) {
                        throw new UsageException("option " + arg + " requires a path");
                    }
                    dir = args.get(++i);
                }
                default -> {
                    if (arg.startsWith("--dir=")) {
                        dir = requireValue("--dir", arg.substring("--dir=".length()));
                    } else if (arg.startsWith("-")) {
                        throw new UsageException("unknown option: " + arg);
                    } else if (pluginName != null) {
                        throw new UsageException("unexpected argument: " + arg);
                    } else {
                        pluginName = arg;
                    }
                }
            }
        }

        AddPluginArgs parsed = new AddPluginArgs(pluginName, list, dryRun, force, dir, json, help);
        if (json && !help && !parsed.isListing() && !dryRun) {
            throw new UsageException("--json requires --list or --dry-run");
        }
        return parsed;
    }

    private static String requireValue(String arg, String value) {
        if (value.isBlank()) {
            throw new UsageException("option " + arg + " requires a path");
        }
        return value;
    }
}
