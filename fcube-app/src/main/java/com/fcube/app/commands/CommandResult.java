package com.fcube.app.commands;

/**
 * Result of a command execution: exit code plus the text for each stream.
 */
public record CommandResult(
        int exitCode,
        String stdout,
        String stderr) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    /** Successful result with output for standard out. */
    public static CommandResult ok(String stdout) {
        return new CommandResult(EXIT_OK, stdout, "");
    }

    /** Engine failure with the message for standard error. */
    public static CommandResult failure(String stderr) {
        return new CommandResult(EXIT_FAILURE, "", stderr);
    }

    /** Bad command line. */
    public static CommandResult usage(String stderr) {
        return new CommandResult(EXIT_USAGE, "", stderr);
    }

    public boolean isSuccess() {
        return exitCode == EXIT_OK;
    }
}
