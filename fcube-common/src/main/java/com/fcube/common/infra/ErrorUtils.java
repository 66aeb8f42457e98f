package com.fcube.common.infra;

/**
 * Error formatting utilities: readable messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Message of the deepest cause, used when a wrapped I/O failure is more
     * informative than its wrapper.
     */
    public static String formatRootCause(Throwable err) {
        if (err == null)
            return "Error";
        Throwable root = err;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = formatErrorMessage(root);
        if (root instanceof java.nio.file.FileSystemException) {
            return root.getClass().getSimpleName() + ": " + msg;
        }
        return msg;
    }
}
