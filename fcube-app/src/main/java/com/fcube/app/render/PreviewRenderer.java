package com.fcube.app.render;

import com.fcube.plugin.plan.FilePlanEntry;
import com.fcube.plugin.plan.InstallPlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats a dry-run {@link InstallPlan}: one row per file in plan order,
 * a count and size summary, undeclared-path warnings and the post-install notes.
 */
public final class PreviewRenderer {

    public static final String DRY_RUN_FOOTER = "No files were created (dry run).";

    private PreviewRenderer() {
    }

    public static String render(InstallPlan plan) {
        var sb = new StringBuilder();
        sb.append("Dry run: plugin '").append(plan.pluginName())
                .append("' v").append(plan.version()).append("\n\n");

        TextTable table = TextTable.of("PATH", "SIZE (B)", "ACTION").alignRight(1);
        for (FilePlanEntry entry : plan.entries()) {
            table.row(entry.relativePath(), String.valueOf(entry.sizeBytes()), entry.action().label());
        }
        table.appendTo(sb, "  ");

        int overwrites = plan.conflicts().size();
        sb.append('\n').append(plan.fileCount()).append(" file(s), ")
                .append(plan.totalBytes()).append(" byte(s) total");
        if (overwrites > 0) {
            sb.append(", ").append(overwrites).append(" would be overwritten (needs --force)");
        }
        sb.append('\n');

        if (!plan.undeclaredPaths().isEmpty()) {
            sb.append("\nWarning: ").append(plan.undeclaredPaths().size())
                    .append(" file(s) not in the plugin's declared file list:\n");
            for (String path : plan.undeclaredPaths()) {
                sb.append("  ").append(path).append('\n');
            }
        }

        appendNotes(sb, plan.postInstallNotes());
        sb.append('\n').append(DRY_RUN_FOOTER).append('\n');
        return sb.toString();
    }

    public static String renderJson(InstallPlan plan) {
        List<Map<String, Object>> files = new ArrayList<>();
        for (FilePlanEntry entry : plan.entries()) {
            Map<String, Object> file = new LinkedHashMap<>();
            file.put("path", entry.relativePath());
            file.put("sizeBytes", entry.sizeBytes());
            file.put("action", entry.action().label());
            files.add(file);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("plugin", plan.pluginName());
        out.put("version", plan.version());
        out.put("dryRun", true);
        out.put("targetDir", plan.targetDir().toString());
        out.put("files", files);
        out.put("fileCount", plan.fileCount());
        out.put("totalBytes", plan.totalBytes());
        out.put("undeclaredPaths", plan.undeclaredPaths());
        out.put("postInstallNotes", plan.postInstallNotes().strip());
        return JsonOutput.write(out);
    }

    static void appendNotes(StringBuilder sb, String notes) {
        sb.append("\nNext steps:\n");
        for (String line : notes.strip().split("\\R", -1)) {
            sb.append(line.isEmpty() ? "" : "  " + line).append('\n');
        }
    }
}
