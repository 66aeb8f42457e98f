package com.fcube.app.render;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Plain-text table with padded columns.
 */
final class TextTable {

    private static final String GAP = "  ";

    private final List<String> headers;
    private final List<List<String>> rows = new ArrayList<>();
    private final Set<Integer> rightAligned = new HashSet<>();
    private boolean showHeader = true;

    private TextTable(List<String> headers) {
        this.headers = headers;
    }

    static TextTable of(String... headers) {
        return new TextTable(List.of(headers));
    }

    TextTable alignRight(int column) {
        rightAligned.add(column);
        return this;
    }

    TextTable withoutHeader() {
        showHeader = false;
        return this;
    }

    TextTable row(String... cells) {
        if (cells.length != headers.size()) {
            throw new IllegalArgumentException(
                    "expected " + headers.size() + " cells, got " + cells.length);
        }
        rows.add(List.of(cells));
        return this;
    }

    void appendTo(StringBuilder sb, String indent) {
        int[] widths = new int[headers.size()];
        for (int c = 0; c < widths.length; c++) {
            widths[c] = showHeader ? headers.get(c).length() : 0;
            for (List<String> row : rows) {
                widths[c] = Math.max(widths[c], row.get(c).length());
            }
        }
        if (showHeader) {
            appendLine(sb, indent, headers, widths);
        }
        for (List<String> row : rows) {
            appendLine(sb, indent, row, widths);
        }
    }

    private void appendLine(StringBuilder sb, String indent, List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder(indent);
        for (int c = 0; c < cells.size(); c++) {
            if (c > 0) {
                line.append(GAP);
            }
            String cell = cells.get(c);
            String pad = " ".repeat(widths[c] - cell.length());
            line.append(rightAligned.contains(c) ? pad + cell : cell + pad);
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }
}
