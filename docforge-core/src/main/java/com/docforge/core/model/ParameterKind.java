package com.docforge.core.model;

/**
 * How a parameter binds arguments.
 *
 * <p>{@link #RECEIVER} marks the implicit {@code self}/{@code cls} of methods; it keeps its
 * position in the parameter list but is never documented.
 */
public enum ParameterKind {
    POSITIONAL_ONLY,
    POSITIONAL_OR_KEYWORD,
    VAR_POSITIONAL,
    KEYWORD_ONLY,
    VAR_KEYWORD,
    RECEIVER
}
