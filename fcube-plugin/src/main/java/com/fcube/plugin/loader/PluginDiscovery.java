package com.fcube.plugin.loader;

import com.fcube.plugin.PluginMetadata;
import com.fcube.plugin.PluginSource;
import com.fcube.plugin.errors.PluginException;
import com.fcube.plugin.errors.PluginValidationException;
import com.fcube.plugin.registry.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the plugin registry from the compile-time plugin table.
 *
 * <p>
 * Each source is described and registered in order. A source that fails
 * (invalid metadata, duplicate name, or an exception while describing
 * itself) is logged and recorded as a diagnostic; the remaining sources
 * still register. The returned registry is frozen.
 * </p>
 */
@Slf4j
public final class PluginDiscovery {

    private PluginDiscovery() {
    }

    // =========================================================================
    // Discovery result types
    // =========================================================================

    public enum DiagnosticLevel {
        WARN, ERROR
    }

    public record PluginDiagnostic(
            String pluginName,
            DiagnosticLevel level,
            String message) {
    }

    public record DiscoveryResult(
            PluginRegistry registry,
            List<PluginDiagnostic> diagnostics) {

        public boolean hasErrors() {
            return diagnostics.stream().anyMatch(d -> d.level() == DiagnosticLevel.ERROR);
        }
    }

    // =========================================================================
    // Discovery
    // =========================================================================

    /**
     * Register every source into a fresh registry and freeze it.
     *
     * @param sources the plugin table, in registration order
     */
    public static DiscoveryResult initializeRegistry(List<? extends PluginSource> sources) {
        PluginRegistry registry = new PluginRegistry();
        List<PluginDiagnostic> diagnostics = new ArrayList<>();

        for (int i = 0; i < sources.size(); i++) {
            PluginSource source = sources.get(i);
            String label = "source #" + i;
            try {
                PluginMetadata metadata = source.describe();
                if (metadata == null) {
                    diagnostics.add(error(label, "plugin source returned no metadata"));
                    log.error("Plugin {} returned no metadata, skipped", label);
                    continue;
                }
                if (metadata.getName() != null) {
                    label = metadata.getName();
                }
                registry.register(metadata);
            } catch (PluginValidationException e) {
                for (var violation : e.getViolations()) {
                    log.warn("Plugin {} rejected: {}: {}", label, violation.kind().label(), violation.message());
                }
                diagnostics.add(new PluginDiagnostic(label, DiagnosticLevel.WARN, e.getMessage()));
            } catch (PluginException e) {
                log.warn("Plugin {} rejected: {}: {}", label, e.getKind().label(), e.getMessage());
                diagnostics.add(new PluginDiagnostic(label, DiagnosticLevel.WARN, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Failed to load plugin {}: {}", label, e.getMessage(), e);
                diagnostics.add(error(label, "failed to load: " + e.getMessage()));
            }
        }

        registry.freeze();
        log.debug("Plugin registry initialized: {} registered, {} rejected",
                registry.size(), diagnostics.size());
        return new DiscoveryResult(registry, List.copyOf(diagnostics));
    }

    private static PluginDiagnostic error(String label, String message) {
        return new PluginDiagnostic(label, DiagnosticLevel.ERROR, message);
    }
}
