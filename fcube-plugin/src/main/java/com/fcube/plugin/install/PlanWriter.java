package com.fcube.plugin.install;

import com.fcube.plugin.errors.PartialWriteException;
import com.fcube.plugin.plan.FilePlanEntry;
import com.fcube.plugin.plan.InstallPlan;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a plan to disk, sequentially and in plan order, creating parent
 * directories. No rollback: on failure the files already written stay.
 */
@Slf4j
public class PlanWriter {

    /**
     * @return the written paths, in order
     * @throws PartialWriteException on the first failed write
     */
    public List<Path> write(InstallPlan plan) {
        List<Path> written = new ArrayList<>(plan.fileCount());
        for (FilePlanEntry entry : plan.entries()) {
            try {
                Path parent = entry.path().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(entry.path(), entry.content(), StandardCharsets.UTF_8);
                written.add(entry.path());
                log.debug("{} {}", entry.isOverwrite() ? "Overwrote" : "Created", entry.relativePath());
            } catch (IOException e) {
                log.error("Failed to write {} for plugin {}: {}", entry.path(), plan.pluginName(), e.getMessage());
                throw new PartialWriteException(plan.pluginName(), written, entry.path(), e);
            }
        }
        return List.copyOf(written);
    }
}
