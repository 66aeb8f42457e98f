package com.fcube.plugin.dependency;

import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.errors.MissingDependencyException;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Verifies that a plugin's declared dependencies are already satisfied.
 *
 * <p>
 * Dependencies are a flat list: no transitive resolution and no cycle
 * detection. {@code filesGenerated} is not consulted.
 * </p>
 */
public final class ConflictDependencyChecker {

    private ConflictDependencyChecker() {
    }

    /**
     * @param satisfied names already present in the project or installed
     * @throws MissingDependencyException listing every missing name, in declaration order
     */
    public static void checkDependencies(PluginMetadata metadata, Set<String> satisfied) {
        List<String> missing = findMissing(metadata, satisfied);
        if (!missing.isEmpty()) {
            throw new MissingDependencyException(metadata.getName(), missing);
        }
    }

    public static List<String> findMissing(PluginMetadata metadata, Set<String> satisfied) {
        return metadata.getDependencies().stream()
                .filter(dep -> !satisfied.contains(dep))
                .distinct()
                .toList();
    }

    /**
     * The declared dependencies {@code probe} reports as present in {@code targetDir}.
     */
    public static Set<String> resolveSatisfied(PluginMetadata metadata, Path targetDir, PresenceProbe probe) {
        Set<String> satisfied = new LinkedHashSet<>();
        for (String dependency : metadata.getDependencies()) {
            if (probe.isPresent(dependency, targetDir)) {
                satisfied.add(dependency);
            }
        }
        return satisfied;
    }
}
