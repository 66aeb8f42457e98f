package com.fcube.app.render;

import com.fcube.plugin.PluginMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats the {@code --list} output.
 */
public final class PluginListRenderer {

    private PluginListRenderer() {
    }

    public static String render(List<PluginMetadata> plugins) {
        if (plugins.isEmpty()) {
            return "No plugins available.\n";
        }
        var sb = new StringBuilder("Available FCube plugins (").append(plugins.size()).append(")\n\n");
        TextTable table = TextTable.of("PLUGIN", "VERSION", "DESCRIPTION", "DEPENDENCIES", "CONFIG");
        for (PluginMetadata plugin : plugins) {
            table.row(plugin.getName(),
                    plugin.getVersion(),
                    plugin.getDescription(),
                    plugin.getDependencies().isEmpty() ? "None" : String.join(", ", plugin.getDependencies()),
                    plugin.isConfigRequired() ? "required" : "-");
        }
        table.appendTo(sb, "  ");
        sb.append("\nUsage: fcube addplugin <plugin_name> [--dry-run] [--force]\n");
        return sb.toString();
    }

    public static String renderJson(List<PluginMetadata> plugins) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (PluginMetadata plugin : plugins) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", plugin.getName());
            entry.put("version", plugin.getVersion());
            entry.put("description", plugin.getDescription());
            entry.put("dependencies", plugin.getDependencies());
            entry.put("configRequired", plugin.isConfigRequired());
            entry.put("filesGenerated", plugin.getFilesGenerated());
            out.add(entry);
        }
        return JsonOutput.write(out);
    }
}
