package com.fcube.plugin.dependency;

import java.nio.file.Path;

/**
 * Decides whether a dependency is present in a project.
 */
@FunctionalInterface
public interface PresenceProbe {

    boolean isPresent(String dependency, Path targetDir);
}
