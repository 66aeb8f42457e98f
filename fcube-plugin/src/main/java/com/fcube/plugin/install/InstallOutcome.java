package com.fcube.plugin.install;

import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.plan.InstallPlan;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a successful install or preview.
 *
 * @param writtenPaths files written, in order; empty for {@link InstallMode#PREVIEW}
 */
public record InstallOutcome(
        String pluginName,
        String version,
        InstallMode mode,
        InstallPlan plan,
        List<Path> writtenPaths,
        String postInstallNotes,
        boolean configRequired,
        List<String> dependencies) {

    public InstallOutcome {
        writtenPaths = List.copyOf(writtenPaths);
        dependencies = List.copyOf(dependencies);
    }

    static InstallOutcome preview(PluginMetadata metadata, InstallPlan plan) {
        return new InstallOutcome(metadata.getName(), metadata.getVersion(), InstallMode.PREVIEW,
                plan, List.of(), metadata.getPostInstallNotes(), metadata.isConfigRequired(),
                metadata.getDependencies());
    }

    static InstallOutcome applied(PluginMetadata metadata, InstallPlan plan, List<Path> written) {
        return new InstallOutcome(metadata.getName(), metadata.getVersion(), InstallMode.APPLY,
                plan, written, metadata.getPostInstallNotes(), metadata.isConfigRequired(),
                metadata.getDependencies());
    }

    public boolean isDryRun() {
        return mode == InstallMode.PREVIEW;
    }
}
