package com.fcube.plugin.errors;

import java.util.List;

/**
 * Lookup of an unknown plugin name. Carries close matches (possibly empty)
 * and every known name so callers can offer alternatives.
 */
public class PluginNotFoundException extends PluginException {

    private final String pluginName;
    private final List<String> suggestions;
    private final List<String> knownNames;

    public PluginNotFoundException(String pluginName, List<String> suggestions, List<String> knownNames) {
        super(PluginErrorKind.PLUGIN_NOT_FOUND, formatMessage(pluginName, suggestions));
        this.pluginName = pluginName;
        this.suggestions = List.copyOf(suggestions);
        this.knownNames = List.copyOf(knownNames);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public List<String> getKnownNames() {
        return knownNames;
    }

    private static String formatMessage(String pluginName, List<String> suggestions) {
        String message = "unknown plugin '" + pluginName + "'";
        if (!suggestions.isEmpty()) {
            message += " (did you mean: " + String.join(", ", suggestions) + "?)";
        }
        return message;
    }
}
