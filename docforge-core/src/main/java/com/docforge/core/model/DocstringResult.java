package com.docforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Terminal output of the refinement loop for one element.
 *
 * @param elementName simple element name
 * @param qualifiedName dotted name including enclosing scopes
 * @param kind element kind
 * @param span source span of the element, the key used by the injector
 * @param text accepted documentation block, delimiters included
 * @param confidenceScore confidence of {@code text} in [0, 1]
 * @param style style the block was written in
 * @param iterationsUsed generator calls made, at least 1
 * @param warnings non-fatal findings (unknown types, threshold not met)
 * @param outcome how the loop terminated
 */
public record DocstringResult(
    String elementName,
    String qualifiedName,
    ElementKind kind,
    SourceSpan span,
    String text,
    double confidenceScore,
    DocstringStyle style,
    int iterationsUsed,
    List<String> warnings,
    RefinementOutcome outcome
) {
    public DocstringResult {
        Objects.requireNonNull(elementName, "elementName must not be null");
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (iterationsUsed < 1) {
            throw new IllegalArgumentException("iterationsUsed must be >= 1");
        }
        qualifiedName = qualifiedName != null ? qualifiedName : elementName;
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean accepted() {
        return outcome == RefinementOutcome.ACCEPTED;
    }
}
