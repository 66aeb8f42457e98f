package com.fcube.plugin.plan;

import com.fcube.common.infra.FsSafe;
import com.fcube.plugin.GeneratedFile;
import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.errors.PluginErrorKind;
import com.fcube.plugin.errors.PluginException;
import com.fcube.plugin.errors.UnsafePathException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a plugin's generated files into an {@link InstallPlan}.
 *
 * <p>
 * Invokes the content generator once, keeps its order, and probes the live
 * filesystem for each destination. Never writes. Two calls with no
 * filesystem change in between produce equal plans.
 * </p>
 */
@Slf4j
public class InstallPlanner {

    /**
     * Plan with the default project root (the parent of {@code targetDir}).
     */
    public InstallPlan plan(PluginMetadata metadata, Path targetDir) {
        Path target = targetDir.toAbsolutePath().normalize();
        return plan(metadata, target, defaultProjectRoot(target));
    }

    /**
     * @param projectRoot directory every generated path must stay inside
     * @throws PluginException     ({@code GeneratorFailedError}) if the generator fails
     *                             or returns incomplete entries
     * @throws UnsafePathException if a path leaves the project root or repeats
     */
    public InstallPlan plan(PluginMetadata metadata, Path targetDir, Path projectRoot) {
        String pluginName = metadata.getName();
        Path target = targetDir.toAbsolutePath().normalize();
        Path root = projectRoot.toAbsolutePath().normalize();

        List<GeneratedFile> files = generate(metadata, target);
        List<FilePlanEntry> entries = new ArrayList<>(files.size());
        Set<Path> seen = new HashSet<>();

        for (GeneratedFile file : files) {
            if (file == null || file.path() == null || file.content() == null) {
                throw new PluginException(PluginErrorKind.GENERATOR_FAILED,
                        "plugin '" + pluginName + "' generated an entry without path or content");
            }

            Path resolved;
            try {
                resolved = FsSafe.requireWithinRoot(root, target.resolve(file.path()));
            } catch (FsSafe.SafePathError e) {
                throw new UnsafePathException(pluginName, file.path(), e.getMessage());
            }
            if (resolved.equals(root) || resolved.equals(target)) {
                throw new UnsafePathException(pluginName, file.path(), "path is a project directory");
            }
            if (!seen.add(resolved)) {
                throw new UnsafePathException(pluginName, file.path(), "generated more than once");
            }

            // A dangling symlink counts as existing
            boolean exists = Files.exists(resolved, LinkOption.NOFOLLOW_LINKS);
            entries.add(new FilePlanEntry(
                    resolved,
                    FsSafe.toPortableRelative(root, resolved),
                    file.content(),
                    file.content().getBytes(StandardCharsets.UTF_8).length,
                    exists,
                    exists ? FileAction.OVERWRITE : FileAction.CREATE));
        }

        List<String> undeclared = findUndeclared(metadata, target, entries);
        if (!undeclared.isEmpty()) {
            log.warn("Plugin {} generates {} file(s) not in its declared list: {}",
                    pluginName, undeclared.size(), undeclared);
        }
        log.debug("Planned {} file(s) for plugin {} in {}", entries.size(), pluginName, target);

        return new InstallPlan(pluginName, metadata.getVersion(), metadata.getPostInstallNotes(),
                root, target, entries, undeclared);
    }

    /**
     * Parent of the target directory, or the target itself at a filesystem root.
     */
    public static Path defaultProjectRoot(Path targetDir) {
        Path target = targetDir.toAbsolutePath().normalize();
        Path parent = target.getParent();
        return parent != null ? parent : target;
    }

    private List<GeneratedFile> generate(PluginMetadata metadata, Path target) {
        List<GeneratedFile> files;
        try {
            files = metadata.getContentGenerator().generate(target);
        } catch (PluginException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PluginException(PluginErrorKind.GENERATOR_FAILED,
                    "content generator of plugin '" + metadata.getName() + "' failed: " + e.getMessage(), e);
        }
        if (files == null) {
            throw new PluginException(PluginErrorKind.GENERATOR_FAILED,
                    "content generator of plugin '" + metadata.getName() + "' returned no file list");
        }
        return files;
    }

    /**
     * Declared paths are written for the default layout: relative to the target's
     * parent, with the first segment naming the target directory. A file inside the
     * target matches on the remainder, so a renamed target still cross-checks.
     */
    private static List<String> findUndeclared(PluginMetadata metadata, Path target, List<FilePlanEntry> entries) {
        Set<String> declared = new LinkedHashSet<>();
        Set<String> declaredInTarget = new HashSet<>();
        for (String path : metadata.getFilesGenerated()) {
            String normalized = normalizeDeclared(path);
            declared.add(normalized);
            int slash = normalized.indexOf('/');
            if (slash > 0) {
                declaredInTarget.add(normalized.substring(slash + 1));
            }
        }
        Path layoutRoot = defaultProjectRoot(target);
        return entries.stream()
                .filter(entry -> !declared.contains(FsSafe.toPortableRelative(layoutRoot, entry.path()))
                        && !(entry.path().startsWith(target)
                        && declaredInTarget.contains(FsSafe.toPortableRelative(target, entry.path()))))
                .map(FilePlanEntry::relativePath)
                .toList();
    }

    private static String normalizeDeclared(String path) {
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }
}
