package com.docforge.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Line diff in unified format, for previewing rewrites.
 */
final class UnifiedDiff {

    private static final int CONTEXT = 3;
    private static final long MAX_TABLE_CELLS = 4_000_000L;

    private UnifiedDiff() {
        // Utility class - no instantiation
    }

    private enum Op { KEEP, DELETE, INSERT }

    private record Edit(Op op, String line, int oldLine, int newLine) {
    }

    /**
     * Renders the diff between two texts.
     *
     * @param name file name for the headers
     * @param before original text
     * @param after rewritten text
     * @return unified diff, empty if the texts have the same lines
     */
    static String diff(String name, String before, String after) {
        List<Edit> edits = edits(lines(before), lines(after));
        if (edits.stream().allMatch(edit -> edit.op() == Op.KEEP)) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        out.append("--- a/").append(name).append('\n');
        out.append("+++ b/").append(name).append('\n');
        int i = 0;
        while (i < edits.size()) {
            if (edits.get(i).op() == Op.KEEP) {
                i++;
                continue;
            }
            int start = Math.max(0, i - CONTEXT);
            int end = i;
            int lastChange = i;
            while (end < edits.size() && end - lastChange <= 2 * CONTEXT) {
                if (edits.get(end).op() != Op.KEEP) {
                    lastChange = end;
                }
                end++;
            }
            end = Math.min(edits.size(), lastChange + CONTEXT + 1);
            appendHunk(out, edits.subList(start, end));
            i = end;
        }
        return out.toString();
    }

    private static void appendHunk(StringBuilder out, List<Edit> hunk) {
        int oldStart = 0;
        int newStart = 0;
        int oldCount = 0;
        int newCount = 0;
        for (Edit edit : hunk) {
            if (edit.op() != Op.INSERT) {
                oldStart = oldStart == 0 ? edit.oldLine() : oldStart;
                oldCount++;
            }
            if (edit.op() != Op.DELETE) {
                newStart = newStart == 0 ? edit.newLine() : newStart;
                newCount++;
            }
        }
        out.append("@@ -").append(oldStart).append(',').append(oldCount)
            .append(" +").append(newStart).append(',').append(newCount).append(" @@\n");
        for (Edit edit : hunk) {
            char marker = switch (edit.op()) {
                case KEEP -> ' ';
                case DELETE -> '-';
                case INSERT -> '+';
            };
            out.append(marker).append(edit.line()).append('\n');
        }
    }

    private static List<Edit> edits(List<String> a, List<String> b) {
        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
            && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }
        List<Edit> edits = new ArrayList<>();
        for (int i = 0; i < prefix; i++) {
            edits.add(new Edit(Op.KEEP, a.get(i), i + 1, i + 1));
        }
        middle(a.subList(prefix, a.size() - suffix), b.subList(prefix, b.size() - suffix), prefix, edits);
        for (int k = suffix; k > 0; k--) {
            int oldIndex = a.size() - k;
            edits.add(new Edit(Op.KEEP, a.get(oldIndex), oldIndex + 1, b.size() - k + 1));
        }
        return edits;
    }

    private static void middle(List<String> a, List<String> b, int offset, List<Edit> edits) {
        int n = a.size();
        int m = b.size();
        if ((long) (n + 1) * (m + 1) > MAX_TABLE_CELLS) {
            for (int i = 0; i < n; i++) {
                edits.add(new Edit(Op.DELETE, a.get(i), offset + i + 1, 0));
            }
            for (int j = 0; j < m; j++) {
                edits.add(new Edit(Op.INSERT, b.get(j), 0, offset + j + 1));
            }
            return;
        }
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = a.get(i).equals(b.get(j)) ? lcs[i + 1][j + 1] + 1 : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        int i = 0;
        int j = 0;
        while (i < n || j < m) {
            if (i < n && j < m && a.get(i).equals(b.get(j))) {
                edits.add(new Edit(Op.KEEP, a.get(i), offset + i + 1, offset + j + 1));
                i++;
                j++;
            } else if (i < n && (j == m || lcs[i + 1][j] >= lcs[i][j + 1])) {
                edits.add(new Edit(Op.DELETE, a.get(i), offset + i + 1, 0));
                i++;
            } else {
                edits.add(new Edit(Op.INSERT, b.get(j), 0, offset + j + 1));
                j++;
            }
        }
    }

    private static List<String> lines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(List.of(text.split("\r\n|\r|\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
