package com.fcube.plugin.errors;

import java.nio.file.Path;
import java.util.List;

/**
 * A real install would overwrite existing files and {@code force} is off.
 * Raised before any write; lists every conflicting path.
 */
public class FileConflictException extends PluginException {

    private final String pluginName;
    private final List<Path> conflicts;

    public FileConflictException(String pluginName, List<Path> conflicts) {
        super(PluginErrorKind.FILE_CONFLICT,
                String.format("plugin '%s' would overwrite %d existing file(s)",
                        pluginName, conflicts.size()));
        this.pluginName = pluginName;
        this.conflicts = List.copyOf(conflicts);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<Path> getConflicts() {
        return conflicts;
    }
}
