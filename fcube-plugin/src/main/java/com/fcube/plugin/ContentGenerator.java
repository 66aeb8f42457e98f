package com.fcube.plugin;

import java.nio.file.Path;
import java.util.List;

/**
 * Produces the files a plugin installs.
 *
 * <p>
 * Implementations compute strings only: they must not touch the filesystem
 * and must return the same list, in the same order, for the same target
 * directory. Relative paths are resolved against {@code targetDir}.
 * </p>
 */
@FunctionalInterface
public interface ContentGenerator {

    List<GeneratedFile> generate(Path targetDir);
}
