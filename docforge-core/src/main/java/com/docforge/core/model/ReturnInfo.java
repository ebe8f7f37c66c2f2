package com.docforge.core.model;

/**
 * What a callable produces.
 *
 * @param declaredType return annotation source text, or null
 * @param inferredType inferred type, or null when not inferred
 * @param isGenerator true if the body yields
 * @param isMultiValue true if a return statement produces a tuple
 */
public record ReturnInfo(
    String declaredType,
    InferredType inferredType,
    boolean isGenerator,
    boolean isMultiValue
) {
    public String effectiveType() {
        if (declaredType != null) {
            return declaredType;
        }
        return inferredType != null ? inferredType.name() : InferredType.UNKNOWN.name();
    }

    public boolean hasUnknownType() {
        return declaredType == null && (inferredType == null || !inferredType.known());
    }

    public ReturnInfo withInferredType(InferredType type) {
        return new ReturnInfo(declaredType, type, isGenerator, isMultiValue);
    }
}
