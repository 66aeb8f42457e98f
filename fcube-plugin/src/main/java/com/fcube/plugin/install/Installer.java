package com.fcube.plugin.install;

import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.dependency.ConflictDependencyChecker;
import com.fcube.plugin.dependency.DirectoryPresenceProbe;
import com.fcube.plugin.dependency.PresenceProbe;
import com.fcube.plugin.errors.FileConflictException;
import com.fcube.plugin.errors.PluginErrorKind;
import com.fcube.plugin.errors.PluginException;
import com.fcube.plugin.plan.FilePlanEntry;
import com.fcube.plugin.plan.InstallPlan;
import com.fcube.plugin.plan.InstallPlanner;
import com.fcube.plugin.registry.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Installs one plugin into a target directory.
 *
 * <p>
 * Runs LOOKUP → DEP_CHECK → PLAN, then either PREVIEW (dry run) or APPLY.
 * Both modes share every step up to the plan, so a preview shows exactly
 * what a real install would write. PREVIEW never writes and never fails on
 * existing files. APPLY checks all conflicts before its first write.
 * </p>
 */
@Slf4j
public class Installer {

    private final PluginRegistry registry;
    private final PresenceProbe presenceProbe;
    private final InstallPlanner planner;
    private final PlanWriter writer;

    public Installer(PluginRegistry registry) {
        this(registry, new DirectoryPresenceProbe(), new InstallPlanner(), new PlanWriter());
    }

    public Installer(PluginRegistry registry, PresenceProbe presenceProbe,
            InstallPlanner planner, PlanWriter writer) {
        this.registry = registry;
        this.presenceProbe = presenceProbe;
        this.planner = planner;
        this.writer = writer;
    }

    /**
     * @throws com.fcube.plugin.errors.PluginNotFoundException     unknown plugin
     * @throws PluginException                                     target directory missing,
     *                                                             generator failure
     * @throws com.fcube.plugin.errors.MissingDependencyException  unsatisfied dependencies
     * @throws com.fcube.plugin.errors.UnsafePathException         generated path outside the project
     * @throws FileConflictException                               existing files and no force (APPLY only)
     * @throws com.fcube.plugin.errors.PartialWriteException       a write failed (APPLY only)
     */
    public InstallOutcome install(String pluginName, Path targetDir, InstallOptions options) {
        InstallStage stage = InstallStage.LOOKUP;
        try {
            PluginMetadata metadata = registry.get(pluginName);
            Path target = targetDir.toAbsolutePath().normalize();
            if (!Files.isDirectory(target)) {
                throw new PluginException(PluginErrorKind.TARGET_DIRECTORY_NOT_FOUND,
                        "target directory not found: " + target);
            }

            stage = advance(pluginName, stage, InstallStage.DEP_CHECK);
            ConflictDependencyChecker.checkDependencies(metadata,
                    ConflictDependencyChecker.resolveSatisfied(metadata, target, presenceProbe));

            stage = advance(pluginName, stage, InstallStage.PLAN);
            Path projectRoot = options.getProjectRoot() != null
                    ? options.getProjectRoot()
                    : InstallPlanner.defaultProjectRoot(target);
            InstallPlan plan = planner.plan(metadata, target, projectRoot);

            if (options.isDryRun()) {
                stage = advance(pluginName, stage, InstallStage.PREVIEW);
                log.info("Previewed plugin {} v{}: {} file(s), {} byte(s), {} overwrite(s)",
                        pluginName, plan.version(), plan.fileCount(), plan.totalBytes(),
                        plan.conflicts().size());
                advance(pluginName, stage, InstallStage.DONE);
                return InstallOutcome.preview(metadata, plan);
            }

            stage = advance(pluginName, stage, InstallStage.APPLY);
            if (!options.isForce() && plan.hasConflicts()) {
                List<Path> conflicts = plan.conflicts().stream().map(FilePlanEntry::path).toList();
                throw new FileConflictException(pluginName, conflicts);
            }
            List<Path> written = writer.write(plan);
            log.info("Installed plugin {} v{}: {} file(s) written under {}",
                    pluginName, plan.version(), written.size(), projectRoot);
            advance(pluginName, stage, InstallStage.DONE);
            return InstallOutcome.applied(metadata, plan, written);
        } catch (PluginException e) {
            log.debug("Plugin {} install {} -> {}: {}: {}", pluginName, stage, InstallStage.FAILED,
                    e.getKind().label(), e.getMessage());
            throw e;
        }
    }

    private static InstallStage advance(String pluginName, InstallStage from, InstallStage to) {
        log.debug("Plugin {} install {} -> {}", pluginName, from, to);
        return to;
    }
}
