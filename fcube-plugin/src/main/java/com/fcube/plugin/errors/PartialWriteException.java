package com.fcube.plugin.errors;

import com.fcube.common.infra.ErrorUtils;

import java.nio.file.Path;
import java.util.List;

/**
 * A write failed partway through an install. Files written before the
 * failure stay on disk; {@link #getWritten()} lists them so they can be
 * cleaned up or overwritten with {@code --force}.
 */
public class PartialWriteException extends PluginException {

    private final String pluginName;
    private final List<Path> written;
    private final Path failedPath;

    public PartialWriteException(String pluginName, List<Path> written, Path failedPath, Throwable cause) {
        super(PluginErrorKind.PARTIAL_WRITE,
                String.format("plugin '%s': failed to write %s after writing %d file(s): %s",
                        pluginName, failedPath, written.size(), ErrorUtils.formatRootCause(cause)),
                cause);
        this.pluginName = pluginName;
        this.written = List.copyOf(written);
        this.failedPath = failedPath;
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<Path> getWritten() {
        return written;
    }

    public Path getFailedPath() {
        return failedPath;
    }
}
