package com.fcube.plugin.dependency;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A dependency counts as present when {@code <targetDir>/<name>} is a
 * directory, e.g. {@code app/user} for the {@code user} module.
 * <p>
 * Heuristic: a directory created by other means also satisfies it, and
 * there is no ledger of installed plugins.
 * </p>
 */
@Slf4j
public class DirectoryPresenceProbe implements PresenceProbe {

    @Override
    public boolean isPresent(String dependency, Path targetDir) {
        Path marker = targetDir.resolve(dependency);
        boolean present = Files.isDirectory(marker);
        log.debug("Dependency {} {} at {}", dependency, present ? "found" : "missing", marker);
        return present;
    }
}
