package com.fcube.common.infra;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Path containment checks: a path is accepted only if it stays inside a
 * given root directory, blocking {@code ..} traversal and symlink escape.
 */
public final class FsSafe {

    private FsSafe() {
    }

    // ── Error ───────────────────────────────────────────────────────────

    public enum ErrorCode {
        PATH_ESCAPES_ROOT, SYMLINK_ESCAPES_ROOT, UNRESOLVABLE
    }

    public static class SafePathError extends RuntimeException {
        private final ErrorCode code;

        public SafePathError(ErrorCode code, String message) {
            super(message);
            this.code = code;
        }

        public ErrorCode getCode() {
            return code;
        }
    }

    // ── API ─────────────────────────────────────────────────────────────

    /**
     * Normalize {@code path} (resolved against {@code rootDir} when relative)
     * and verify it stays within {@code rootDir}. The path itself need not
     * exist; its deepest existing ancestor must not be a symlink leading
     * outside the root.
     *
     * @return the absolute, normalized path
     * @throws SafePathError if the path leaves the root
     */
    public static Path requireWithinRoot(Path rootDir, Path path) {
        Path root = rootDir.toAbsolutePath().normalize();
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new SafePathError(ErrorCode.PATH_ESCAPES_ROOT,
                    "path escapes root " + root + ": " + path);
        }

        Path existing = resolved;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null || !existing.startsWith(root) || existing.equals(root)) {
            return resolved;
        }

        try {
            Path rootReal = root.toRealPath();
            Path real = existing.toRealPath();
            if (!real.startsWith(rootReal)) {
                throw new SafePathError(ErrorCode.SYMLINK_ESCAPES_ROOT,
                        "symlink escapes root " + root + ": " + existing);
            }
        } catch (IOException e) {
            // Dangling symlink or unreadable ancestor
            throw new SafePathError(ErrorCode.UNRESOLVABLE,
                    "cannot resolve " + existing + ": " + e.getMessage());
        }
        return resolved;
    }

    /**
     * Whether {@code path} lies inside {@code rootDir} after normalization.
     */
    public static boolean isWithinRoot(Path rootDir, Path path) {
        try {
            requireWithinRoot(rootDir, path);
            return true;
        } catch (SafePathError e) {
            return false;
        }
    }

    /**
     * Path of {@code path} relative to {@code rootDir} with {@code /}
     * separators, for display and for comparison with declared file lists.
     */
    public static String toPortableRelative(Path rootDir, Path path) {
        Path root = rootDir.toAbsolutePath().normalize();
        Path abs = root.resolve(path).normalize();
        Path rel = abs.startsWith(root) ? root.relativize(abs) : abs;
        return rel.toString().replace('\\', '/');
    }
}
