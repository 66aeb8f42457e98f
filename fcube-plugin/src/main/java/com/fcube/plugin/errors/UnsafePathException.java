package com.fcube.plugin.errors;

import java.nio.file.Path;

/**
 * A generated path cannot be installed: it leaves the project root or
 * appears twice in one plan.
 */
public class UnsafePathException extends PluginException {

    private final String pluginName;
    private final Path path;

    public UnsafePathException(String pluginName, Path path, String reason) {
        super(PluginErrorKind.UNSAFE_PATH,
                "plugin '" + pluginName + "' generated an unsafe path " + path + ": " + reason);
        this.pluginName = pluginName;
        this.path = path;
    }

    public String getPluginName() {
        return pluginName;
    }

    public Path getPath() {
        return path;
    }
}
