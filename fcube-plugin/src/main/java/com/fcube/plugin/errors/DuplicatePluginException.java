package com.fcube.plugin.errors;

public class DuplicatePluginException extends PluginException {

    private final String pluginName;

    public DuplicatePluginException(String pluginName) {
        super(PluginErrorKind.DUPLICATE_PLUGIN,
                "plugin '" + pluginName + "' is already registered");
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
