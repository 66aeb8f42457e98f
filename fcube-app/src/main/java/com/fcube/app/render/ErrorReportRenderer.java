package com.fcube.app.render;

import com.fcube.common.infra.FsSafe;
import com.fcube.plugin.errors.FileConflictException;
import com.fcube.plugin.errors.MissingDependencyException;
import com.fcube.plugin.errors.PartialWriteException;
import com.fcube.plugin.errors.PluginException;
import com.fcube.plugin.errors.PluginNotFoundException;
import com.fcube.plugin.errors.PluginValidationException;
import com.fcube.plugin.validation.MetadataValidator.Violation;

import java.nio.file.Path;

/**
 * Formats engine failures for standard error: {@code <ErrorKind>: <message>}
 * followed by kind-specific hints.
 */
public final class ErrorReportRenderer {

    public static final String USER_MODULE = "user";

    private ErrorReportRenderer() {
    }

    public static String render(PluginException e, Path projectRoot) {
        var sb = new StringBuilder();
        sb.append(e.getKind().label()).append(": ").append(e.getMessage()).append('\n');

        switch (e.getKind()) {
            case PLUGIN_NOT_FOUND -> {
                var notFound = (PluginNotFoundException) e;
                if (notFound.getKnownNames().isEmpty()) {
                    sb.append("No plugins are available.\n");
                } else {
                    sb.append("Available plugins: ")
                            .append(String.join(", ", notFound.getKnownNames())).append('\n');
                    sb.append("Run 'fcube addplugin --list' for details.\n");
                }
            }
            case TARGET_DIRECTORY_NOT_FOUND ->
                    sb.append("Tip: run the command from the project root, or pass --dir <path>.\n");
            case MISSING_DEPENDENCY -> {
                for (String dependency : ((MissingDependencyException) e).getMissing()) {
                    sb.append("Tip: add the ").append(dependency).append(" module first:\n")
                            .append("   ").append(remedyFor(dependency)).append('\n');
                }
            }
            case FILE_CONFLICT -> {
                sb.append("Existing files:\n");
                for (Path path : ((FileConflictException) e).getConflicts()) {
                    sb.append("  ").append(display(projectRoot, path)).append('\n');
                }
                sb.append("Tip: use --force to overwrite.\n");
            }
            case PARTIAL_WRITE -> {
                var partial = (PartialWriteException) e;
                if (partial.getWritten().isEmpty()) {
                    sb.append("No files were written.\n");
                } else {
                    sb.append("Files written before the failure:\n");
                    for (Path path : partial.getWritten()) {
                        sb.append("  ").append(display(projectRoot, path)).append('\n');
                    }
                    sb.append("Tip: fix the cause and re-run with --force to overwrite them.\n");
                }
            }
            default -> {
                if (e instanceof PluginValidationException validation) {
                    for (Violation violation : validation.getViolations()) {
                        sb.append("  ").append(violation.kind().label())
                                .append(": ").append(violation.message()).append('\n');
                    }
                }
            }
        }
        return sb.toString();
    }

    /** Command that creates a missing dependency. */
    public static String remedyFor(String dependency) {
        return USER_MODULE.equals(dependency)
                ? "fcube adduser --auth-type email"
                : "fcube startmodule " + dependency;
    }

    private static String display(Path projectRoot, Path path) {
        return FsSafe.isWithinRoot(projectRoot, path)
                ? FsSafe.toPortableRelative(projectRoot, path)
                : path.toString();
    }
}
