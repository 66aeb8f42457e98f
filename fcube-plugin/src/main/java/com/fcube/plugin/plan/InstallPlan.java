package com.fcube.plugin.plan;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered file operations for one plugin install. A snapshot: the
 * filesystem may change between planning and applying.
 *
 * @param undeclaredPaths generated relative paths missing from the plugin's
 *                        declared file list
 */
public record InstallPlan(
        String pluginName,
        String version,
        String postInstallNotes,
        Path projectRoot,
        Path targetDir,
        List<FilePlanEntry> entries,
        List<String> undeclaredPaths) {

    public InstallPlan {
        entries = List.copyOf(entries);
        undeclaredPaths = List.copyOf(undeclaredPaths);
    }

    public int fileCount() {
        return entries.size();
    }

    public long totalBytes() {
        return entries.stream().mapToLong(FilePlanEntry::sizeBytes).sum();
    }

    public List<FilePlanEntry> conflicts() {
        return entries.stream().filter(FilePlanEntry::isOverwrite).toList();
    }

    public boolean hasConflicts() {
        return entries.stream().anyMatch(FilePlanEntry::isOverwrite);
    }
}
