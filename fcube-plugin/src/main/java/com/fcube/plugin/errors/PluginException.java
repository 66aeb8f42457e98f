package com.fcube.plugin.errors;

/**
 * Base class of every plugin engine failure.
 */
public class PluginException extends RuntimeException {

    private final PluginErrorKind kind;

    public PluginException(PluginErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PluginException(PluginErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public PluginErrorKind getKind() {
        return kind;
    }
}
