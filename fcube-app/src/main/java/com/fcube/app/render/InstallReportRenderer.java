package com.fcube.app.render;

import com.fcube.plugin.install.InstallOutcome;
import com.fcube.plugin.plan.FilePlanEntry;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Formats the report printed after a real install: written files, a tree
 * of them, a summary, the post-install notes and a success line.
 */
public final class InstallReportRenderer {

    private InstallReportRenderer() {
    }

    public static String render(InstallOutcome outcome) {
        List<FilePlanEntry> entries = outcome.plan().entries();
        var sb = new StringBuilder();
        sb.append("Adding plugin: ").append(outcome.pluginName()).append("\n\n");

        for (FilePlanEntry entry : entries) {
            sb.append("  ").append(entry.isOverwrite() ? "Overwrote: " : "Created:   ")
                    .append(entry.relativePath()).append('\n');
        }

        sb.append('\n');
        appendTree(sb, entries.stream().map(FilePlanEntry::relativePath).toList());

        long overwritten = entries.stream().filter(FilePlanEntry::isOverwrite).count();
        String written = outcome.writtenPaths().size()
                + (overwritten > 0 ? " (" + overwritten + " overwritten)" : "");

        sb.append("\nPlugin '").append(outcome.pluginName()).append("' summary\n");
        TextTable.of("", "").withoutHeader()
                .row("Plugin:", outcome.pluginName())
                .row("Version:", outcome.version())
                .row("Location:", commonDirectory(entries))
                .row("Files written:", written)
                .row("Dependencies:", outcome.dependencies().isEmpty()
                        ? "None" : String.join(", ", outcome.dependencies()))
                .row("Config required:", outcome.configRequired() ? "yes" : "no")
                .appendTo(sb, "  ");

        PreviewRenderer.appendNotes(sb, outcome.postInstallNotes());
        sb.append("\nPlugin '").append(outcome.pluginName()).append("' added successfully!\n");
        return sb.toString();
    }

    /**
     * Tree of {@code /}-separated paths, directories before files, each level
     * sorted by name.
     */
    static void appendTree(StringBuilder sb, List<String> paths) {
        Node root = new Node();
        for (String path : paths) {
            Node node = root;
            String[] parts = path.split("/");
            for (int i = 0; i < parts.length; i++) {
                boolean leaf = i == parts.length - 1;
                node = node.children.computeIfAbsent(leaf ? "1" + parts[i] : "0" + parts[i], k -> new Node());
            }
        }
        appendChildren(sb, root, "");
    }

    private static void appendChildren(StringBuilder sb, Node node, String prefix) {
        int i = 0;
        for (Map.Entry<String, Node> child : node.children.entrySet()) {
            boolean last = ++i == node.children.size();
            boolean dir = child.getKey().charAt(0) == '0';
            String name = child.getKey().substring(1) + (dir ? "/" : "");
            sb.append(prefix).append(last ? "└── " : "├── ").append(name).append('\n');
            if (dir) {
                appendChildren(sb, child.getValue(), prefix + (last ? "    " : "│   "));
            }
        }
    }

    /** Deepest directory holding every written file, e.g. {@code app/referral}. */
    static String commonDirectory(List<FilePlanEntry> entries) {
        String common = null;
        for (FilePlanEntry entry : entries) {
            String path = entry.relativePath();
            int slash = path.lastIndexOf('/');
            String dir = slash < 0 ? "" : path.substring(0, slash);
            common = common == null ? dir : commonPrefixDir(common, dir);
        }
        return common == null || common.isEmpty() ? "." : common;
    }

    private static String commonPrefixDir(String a, String b) {
        String[] left = a.split("/");
        String[] right = b.split("/");
        var sb = new StringBuilder();
        for (int i = 0; i < Math.min(left.length, right.length) && left[i].equals(right[i]); i++) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(left[i]);
        }
        return sb.toString();
    }

    private static final class Node {
        // Keys are "0<dir>" or "1<file>" so directories sort first
        final Map<String, Node> children = new TreeMap<>();
    }
}
