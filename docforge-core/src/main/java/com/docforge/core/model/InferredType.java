package com.docforge.core.model;

import java.util.Objects;

/**
 * Result of heuristic type inference.
 *
 * <p>{@link #UNKNOWN} is an explicit marker for "no unambiguous evidence". It must be reported
 * as a warning and never be mistaken for a concrete type.
 *
 * @param name type name in Python annotation syntax (e.g. "Sequence", "int | float")
 * @param known false only for {@link #UNKNOWN}
 */
public record InferredType(String name, boolean known) {

    public static final InferredType UNKNOWN = new InferredType("Any", false);

    public InferredType {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates a known inferred type.
     *
     * @param name type name
     * @return known type
     */
    public static InferredType of(String name) {
        return new InferredType(name, true);
    }
}
