package com.docforge.core.model;

import java.util.Objects;

/**
 * A function parameter in declaration order.
 *
 * @param name parameter name without star prefixes
 * @param kind binding kind
 * @param declaredType annotation source text, or null
 * @param defaultValue default value source text (never evaluated), or null
 * @param inferredType inferred type, or null when not inferred (declared or receiver)
 */
public record Parameter(
    String name,
    ParameterKind kind,
    String declaredType,
    String defaultValue,
    InferredType inferredType
) {
    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Creates a positional-or-keyword parameter without annotation or default.
     *
     * @param name parameter name
     * @return parameter
     */
    public static Parameter named(String name) {
        return new Parameter(name, ParameterKind.POSITIONAL_OR_KEYWORD, null, null, null);
    }

    /**
     * Returns true if this parameter appears in generated documentation.
     *
     * @return false for the implicit receiver
     */
    public boolean isDocumented() {
        return kind != ParameterKind.RECEIVER;
    }

    /**
     * Name as written in the signature, with {@code *} or {@code **} for variadics.
     *
     * @return display name
     */
    public String displayName() {
        return switch (kind) {
            case VAR_POSITIONAL -> "*" + name;
            case VAR_KEYWORD -> "**" + name;
            default -> name;
        };
    }

    /**
     * Declared type if present, otherwise the inferred one, otherwise {@link InferredType#UNKNOWN}'s name.
     *
     * @return type name for rendering
     */
    public String effectiveType() {
        if (declaredType != null) {
            return declaredType;
        }
        return inferredType != null ? inferredType.name() : InferredType.UNKNOWN.name();
    }

    /**
     * Returns true if the parameter has no annotation and inference found no evidence.
     *
     * @return true if the type is unresolved
     */
    public boolean hasUnknownType() {
        return isDocumented() && declaredType == null
            && (inferredType == null || !inferredType.known());
    }

    public Parameter withInferredType(InferredType type) {
        return new Parameter(name, kind, declaredType, defaultValue, type);
    }
}
