package com.fcube.plugin.errors;

import com.fcube.plugin.validation.MetadataValidator.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Plugin metadata failed one or more structural checks. Carries every
 * violation; {@link #getKind()} is the kind of the first one.
 */
public class PluginValidationException extends PluginException {

    private final String pluginName;
    private final List<Violation> violations;

    public PluginValidationException(String pluginName, List<Violation> violations) {
        super(violations.get(0).kind(), formatMessage(pluginName, violations));
        this.pluginName = pluginName;
        this.violations = List.copyOf(violations);
    }

    public String getPluginName() {
        return pluginName;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String formatMessage(String pluginName, List<Violation> violations) {
        return String.format("plugin '%s' has %d invalid field(s): %s",
                pluginName, violations.size(),
                violations.stream()
                        .map(v -> v.kind().label() + " (" + v.message() + ")")
                        .collect(Collectors.joining("; ")));
    }
}
