package com.docforge.core.model;

/**
 * A contiguous region of source text.
 *
 * <p>Offsets are {@code char} offsets into the decoded source string, end-exclusive.
 * Lines are 1-indexed and inclusive.
 *
 * @param startOffset offset of the first character
 * @param endOffset offset one past the last character
 * @param startLine line of the first character (1-indexed)
 * @param endLine line of the last character (1-indexed)
 */
public record SourceSpan(
    int startOffset,
    int endOffset,
    int startLine,
    int endLine
) {
    /**
     * Compact constructor with validation.
     */
    public SourceSpan {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                "Invalid offsets: [" + startOffset + ", " + endOffset + ")");
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                "Invalid lines: " + startLine + ".." + endLine);
        }
    }

    public int length() {
        return endOffset - startOffset;
    }

    /**
     * Returns true if {@code other} lies entirely inside this span.
     *
     * @param other span to test
     * @return true if contained
     */
    public boolean contains(SourceSpan other) {
        return other.startOffset >= startOffset && other.endOffset <= endOffset;
    }

    /**
     * Returns true if the two spans share at least one character.
     *
     * @param other span to test
     * @return true if overlapping
     */
    public boolean overlaps(SourceSpan other) {
        return startOffset < other.endOffset && other.startOffset < endOffset;
    }

    /**
     * Extracts the covered text from the source it was computed on.
     *
     * @param source original source text
     * @return covered substring
     */
    public String text(String source) {
        return source.substring(startOffset, endOffset);
    }
}
