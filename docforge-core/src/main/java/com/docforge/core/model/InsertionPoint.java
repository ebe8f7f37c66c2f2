package com.docforge.core.model;

import java.util.Objects;

/**
 * Where a new documentation block goes when an element has none.
 *
 * <p>For an indented body the offset is the start of the line after the header. For a body
 * written on the header line ({@code def f(): return 1}) the offset is right after the
 * header colon and {@code inlineBody} is set, so the injector must break the line.
 *
 * @param offset insertion offset
 * @param indent whitespace that prefixes each line of the block
 * @param inlineBody true if the body shares the header line
 */
public record InsertionPoint(int offset, String indent, boolean inlineBody) {

    public InsertionPoint {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        Objects.requireNonNull(indent, "indent must not be null");
    }
}
