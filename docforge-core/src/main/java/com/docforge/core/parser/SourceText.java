package com.docforge.core.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Source text with the offset and line lookups the tree builder needs.
 *
 * <p>ANTLR indexes the input by code point while spans are {@code String} offsets; the two
 * only differ when the text contains supplementary characters.
 */
final class SourceText {

    private final String source;
    private final int[] lineStarts;
    private final int[] charOffsets;

    SourceText(String source) {
        this.source = source;
        this.lineStarts = lineStarts(source);
        this.charOffsets = source.codePointCount(0, source.length()) == source.length()
            ? null
            : charOffsets(source);
    }

    String source() {
        return source;
    }

    int length() {
        return source.length();
    }

    /**
     * Converts an ANTLR input index to a {@code String} offset.
     *
     * @param codePointIndex index counted in code points, up to the input size
     * @return char offset
     */
    int offset(int codePointIndex) {
        if (charOffsets == null) {
            return codePointIndex;
        }
        return charOffsets[Math.min(codePointIndex, charOffsets.length - 1)];
    }

    /**
     * Returns the 1-indexed line containing a char offset. {@code \r\n}, {@code \r} and
     * {@code \n} each end a line.
     */
    int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -(index + 1);
    }

    String slice(int start, int end) {
        return source.substring(start, end);
    }

    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (c == '\r' || c == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] charOffsets(String source) {
        int[] offsets = new int[source.codePointCount(0, source.length()) + 1];
        int offset = 0;
        for (int i = 0; i < offsets.length - 1; i++) {
            offsets[i] = offset;
            offset += Character.charCount(source.codePointAt(offset));
        }
        offsets[offsets.length - 1] = source.length();
        return offsets;
    }
}
