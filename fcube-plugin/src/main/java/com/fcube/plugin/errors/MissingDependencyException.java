package com.fcube.plugin.errors;

import java.util.List;

/**
 * One or more declared dependencies are absent. Lists all of them, in
 * declaration order.
 */
public class MissingDependencyException extends PluginException {

    private final String pluginName;
    private final List<String> missing;

    public MissingDependencyException(String pluginName, List<String> missing) {
        super(PluginErrorKind.MISSING_DEPENDENCY,
                "plugin '" + pluginName + "' requires missing module(s): " + String.join(", ", missing));
        this.pluginName = pluginName;
        this.missing = List.copyOf(missing);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getMissing() {
        return missing;
    }
}
