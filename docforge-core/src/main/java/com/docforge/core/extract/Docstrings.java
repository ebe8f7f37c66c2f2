package com.docforge.core.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers for documentation blocks.
 */
public final class Docstrings {

    private Docstrings() {
        // Utility class - no instantiation
    }

    /**
     * Normalizes the body of a documentation block for reading.
     *
     * <p>Tabs are expanded, leading whitespace is removed from the first line, the common
     * indentation of the remaining lines is removed, and leading and trailing blank lines
     * are dropped.
     *
     * @param body text between the quotes
     * @return cleaned content with {@code \n} line breaks
     */
    public static String clean(String body) {
        String[] lines = body.replace("\t", "        ").split("\r\n|\r|\n", -1);
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            String stripped = lines[i].stripLeading();
            if (!stripped.isEmpty()) {
                margin = Math.min(margin, lines[i].length() - stripped.length());
            }
        }
        List<String> cleaned = new ArrayList<>();
        cleaned.add(lines[0].strip());
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (margin != Integer.MAX_VALUE && line.length() >= margin) {
                line = line.substring(margin);
            }
            cleaned.add(line.stripTrailing());
        }
        while (!cleaned.isEmpty() && cleaned.get(0).isBlank()) {
            cleaned.remove(0);
        }
        while (!cleaned.isEmpty() && cleaned.get(cleaned.size() - 1).isBlank()) {
            cleaned.remove(cleaned.size() - 1);
        }
        return String.join("\n", cleaned);
    }

    /**
     * Returns the leading spaces and tabs of the line containing {@code offset}.
     *
     * @param source text
     * @param offset any offset on the line
     * @return indentation, possibly empty
     */
    public static String indentationAt(String source, int offset) {
        int lineStart = lineStart(source, offset);
        int end = lineStart;
        while (end < source.length() && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return source.substring(lineStart, end);
    }

    public static int lineStart(String source, int offset) {
        int i = Math.min(offset, source.length());
        while (i > 0 && source.charAt(i - 1) != '\n' && source.charAt(i - 1) != '\r') {
            i--;
        }
        return i;
    }
}
