package com.fcube.plugin;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Descriptor of one installable plugin.
 *
 * <p>
 * {@link #getFilesGenerated()} documents what the plugin creates and is used
 * to cross-check the preview; the {@link #getContentGenerator() generator}
 * is the authoritative file list and runs only at plan time.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PluginMetadata {

    /** Bare identifier, unique within the registry. */
    String name;

    String description;

    /** {@code MAJOR.MINOR.PATCH}. */
    String version;

    /** Plugins or project modules that must already be present. */
    @Builder.Default
    List<String> dependencies = List.of();

    /** Project-relative, {@code /}-separated paths. */
    @Builder.Default
    List<String> filesGenerated = List.of();

    /** Needs manual configuration after install (informational). */
    boolean configRequired;

    String postInstallNotes;

    ContentGenerator contentGenerator;

    /**
     * Copy whose lists can no longer be modified through references the
     * author kept. Only call on validated metadata (no null list elements).
     */
    public PluginMetadata immutableCopy() {
        return toBuilder()
                .dependencies(dependencies == null ? List.of() : List.copyOf(dependencies))
                .filesGenerated(List.copyOf(filesGenerated))
                .build();
    }
}
