package io.flowdoc.core.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Unified line diff of two texts.
///
/// Produces the familiar `--- / +++ / @@` format with three lines of context around
/// each change, hunks merged when their context overlaps. The edit script is derived
/// from a longest-common-subsequence table, which is adequate for document-sized input.
public final class LineDiff {

    static final int CONTEXT_LINES = 3;

    private enum Op {
        EQUAL(' '),
        DELETE('-'),
        INSERT('+');

        private final char prefix;

        Op(char prefix) {
            this.prefix = prefix;
        }
    }

    /// One line of the edit script. For inserts `aIndex` is the position in the
    /// original text the line is inserted before; for deletes `bIndex` likewise.
    private record Edit(Op op, int aIndex, int bIndex, String line) {}

    private LineDiff() {}

    /// Computes the unified diff of two texts.
    ///
    /// @param original original text, not null
    /// @param modified modified text, not null
    /// @param fromLabel label for the `---` header, not null
    /// @param toLabel label for the `+++` header, not null
    /// @return unified diff, or an empty string when the texts are equal
    public static String unified(
            String original, String modified, String fromLabel, String toLabel) {
        if (original.equals(modified)) {
            return "";
        }

        List<Edit> edits = editScript(lines(original), lines(modified));
        List<Integer> changed = new ArrayList<>();
        for (int i = 0; i < edits.size(); i++) {
            if (edits.get(i).op() != Op.EQUAL) {
                changed.add(i);
            }
        }
        if (changed.isEmpty()) {
            // Texts differ only in a trailing newline.
            return "";
        }

        StringBuilder out = new StringBuilder();
        out.append("--- ").append(fromLabel).append('\n');
        out.append("+++ ").append(toLabel).append('\n');

        int g = 0;
        while (g < changed.size()) {
            int groupEnd = g;
            while (groupEnd + 1 < changed.size()
                    && changed.get(groupEnd + 1) - changed.get(groupEnd) <= 2 * CONTEXT_LINES) {
                groupEnd++;
            }
            int from = Math.max(0, changed.get(g) - CONTEXT_LINES);
            int to = Math.min(edits.size() - 1, changed.get(groupEnd) + CONTEXT_LINES);
            appendHunk(out, edits.subList(from, to + 1));
            g = groupEnd + 1;
        }

        return out.toString();
    }

    private static void appendHunk(StringBuilder out, List<Edit> hunk) {
        int aStart = hunk.get(0).aIndex();
        int bStart = hunk.get(0).bIndex();
        int aCount = 0;
        int bCount = 0;
        for (Edit edit : hunk) {
            if (edit.op() != Op.INSERT) aCount++;
            if (edit.op() != Op.DELETE) bCount++;
        }

        out.append("@@ -")
                .append(range(aStart, aCount))
                .append(" +")
                .append(range(bStart, bCount))
                .append(" @@\n");
        for (Edit edit : hunk) {
            out.append(edit.op().prefix).append(edit.line()).append('\n');
        }
    }

    private static String range(int start, int count) {
        int beginning = start + 1;
        if (count == 1) {
            return String.valueOf(beginning);
        }
        if (count == 0) {
            beginning--;
        }
        return beginning + "," + count;
    }

    private static List<Edit> editScript(List<String> a, List<String> b) {
        int[][] lcs = new int[a.size() + 1][b.size() + 1];
        for (int i = a.size() - 1; i >= 0; i--) {
            for (int j = b.size() - 1; j >= 0; j--) {
                lcs[i][j] =
                        a.get(i).equals(b.get(j))
                                ? lcs[i + 1][j + 1] + 1
                                : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        List<Edit> edits = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < a.size() && j < b.size()) {
            if (a.get(i).equals(b.get(j))) {
                edits.add(new Edit(Op.EQUAL, i, j, a.get(i)));
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                edits.add(new Edit(Op.DELETE, i, j, a.get(i)));
                i++;
            } else {
                edits.add(new Edit(Op.INSERT, i, j, b.get(j)));
                j++;
            }
        }
        while (i < a.size()) {
            edits.add(new Edit(Op.DELETE, i, j, a.get(i)));
            i++;
        }
        while (j < b.size()) {
            edits.add(new Edit(Op.INSERT, i, j, b.get(j)));
            j++;
        }
        return edits;
    }

    private static List<String> lines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        if (text.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
