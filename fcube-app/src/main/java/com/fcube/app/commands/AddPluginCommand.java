package com.fcube.app.commands;

import com.fcube.app.render.ErrorReportRenderer;
import com.fcube.app.render.InstallReportRenderer;
import com.fcube.app.render.PluginListRenderer;
import com.fcube.app.render.PreviewRenderer;
import com.fcube.common.config.FcubeConfig;
import com.fcube.common.infra.InstallLock;
import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.errors.PluginException;
import com.fcube.plugin.install.InstallOptions;
import com.fcube.plugin.install.InstallOutcome;
import com.fcube.plugin.install.Installer;
import com.fcube.plugin.plan.InstallPlanner;
import com.fcube.plugin.registry.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code fcube addplugin}: list plugins, preview an install, or install.
 *
 * <p>
 * Real installs run under the project's install lock when it is enabled in
 * configuration. Dry runs take no lock because they never write.
 * </p>
 */
@Slf4j
public class AddPluginCommand {

    static final long LOCK_POLL_INTERVAL_MS = 100;

    private final PluginRegistry registry;
    private final Installer installer;
    private final FcubeConfig config;
    private final Path projectRoot;

    public AddPluginCommand(PluginRegistry registry, FcubeConfig config, Path projectRoot) {
        this(registry, new Installer(registry), config, projectRoot);
    }

    public AddPluginCommand(PluginRegistry registry, Installer installer, FcubeConfig config, Path projectRoot) {
        this.registry = registry;
        this.installer = installer;
        this.config = config;
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    public CommandResult execute(List<String> rawArgs) {
        AddPluginArgs args;
        try {
            args = AddPluginArgs.parse(rawArgs);
        } catch (AddPluginArgs.UsageException e) {
            return CommandResult.usage("error: " + e.getMessage() + "\n\n" + AddPluginArgs.USAGE);
        }
        return execute(args);
    }

    public CommandResult execute(AddPluginArgs args) {
        if (args.help()) {
            return CommandResult.ok(AddPluginArgs.USAGE);
        }
        if (args.isListing()) {
            return handleList(args.json());
        }

        Path targetDir = resolveTargetDir(args.dir());
        Path root = projectRootFor(targetDir);
        InstallOptions options = InstallOptions.builder()
                .force(args.force())
                .dryRun(args.dryRun())
                .projectRoot(root)
                .build();

        try {
            if (args.dryRun()) {
                InstallOutcome outcome = installer.install(args.pluginName(), targetDir, options);
                return CommandResult.ok(args.json()
                        ? PreviewRenderer.renderJson(outcome.plan())
                        : PreviewRenderer.render(outcome.plan()));
            }
            InstallOutcome outcome = installLocked(args.pluginName(), targetDir, root, options);
            return CommandResult.ok(InstallReportRenderer.render(outcome));
        } catch (PluginException e) {
            log.debug("addplugin {} failed: {}", args.pluginName(), e.getKind().label(), e);
            return CommandResult.failure(ErrorReportRenderer.render(e, root));
        } catch (InstallLock.InstallLockException e) {
            log.warn("addplugin {}: {}", args.pluginName(), e.getMessage());
            return CommandResult.failure("InstallLockError: " + e.getMessage() + "\n");
        }
    }

    Path resolveTargetDir(String dir) {
        String relative = dir != null ? dir : config.getAppDir();
        if (relative == null || relative.isBlank()) {
            relative = FcubeConfig.DEFAULT_APP_DIR;
        }
        return projectRoot.resolve(relative).normalize();
    }

    /**
     * The working directory when it contains the target, otherwise the target's parent.
     */
    Path projectRootFor(Path targetDir) {
        return targetDir.startsWith(projectRoot) ? projectRoot : InstallPlanner.defaultProjectRoot(targetDir);
    }

    private InstallOutcome installLocked(String pluginName, Path targetDir, Path root, InstallOptions options) {
        FcubeConfig.LockConfig lock = config.getLock();
        if (lock == null || !lock.isEnabled()) {
            return installer.install(pluginName, targetDir, options);
        }
        try (InstallLock.LockHandle ignored =
                InstallLock.acquire(root, lock.getTimeoutMs(), LOCK_POLL_INTERVAL_MS)) {
            return installer.install(pluginName, targetDir, options);
        }
    }

    private CommandResult handleList(boolean json) {
        List<PluginMetadata> plugins = registry.list();
        return CommandResult.ok(json
                ? PluginListRenderer.renderJson(plugins)
                : PluginListRenderer.render(plugins));
    }
}
