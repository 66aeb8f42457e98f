package com.fcube.plugin;

/**
 * Entry of the compile-time plugin table. Each built-in plugin exposes one
 * source; discovery calls {@link #describe()} once at startup.
 */
@FunctionalInterface
public interface PluginSource {

    PluginMetadata describe();
}
