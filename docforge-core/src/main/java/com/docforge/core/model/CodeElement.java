package com.docforge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One documentable unit: a function, method, constructor or class.
 *
 * <p>Elements are produced once per extraction pass. Inference fills in
 * {@link Parameter#inferredType()}, {@link ReturnInfo#inferredType()} and
 * {@link #complexityScore()} through {@link #withInference(List, ReturnInfo, int)}, which
 * returns a copy and never changes {@link #sourceSpan()} or {@link #existingDoc()}.
 *
 * @param kind element kind
 * @param name simple name
 * @param qualifiedName dotted name through enclosing classes and functions
 * @param parameters parameters in declaration order, receiver included
 * @param returns return info, or null when the element produces no value
 * @param raises explicitly raised exception kinds, deduplicated, in first-seen order
 * @param existingDoc documentation block already present, or null
 * @param sourceSpan span from the {@code def}/{@code class} keyword to the end of the body;
 *                   decorator lines are excluded
 * @param insertionPoint where a new block is inserted
 * @param complexityScore cyclomatic complexity, at least 1
 * @param modifiers element attributes
 * @param decorators decorator expressions in source order, without the {@code @}
 * @param bodyDigest short body summary used to seed generation
 */
public record CodeElement(
    ElementKind kind,
    String name,
    String qualifiedName,
    List<Parameter> parameters,
    ReturnInfo returns,
    List<ExceptionInfo> raises,
    ExistingDoc existingDoc,
    SourceSpan sourceSpan,
    InsertionPoint insertionPoint,
    int complexityScore,
    Set<Modifier> modifiers,
    List<String> decorators,
    String bodyDigest
) {
    public CodeElement {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sourceSpan, "sourceSpan must not be null");
        Objects.requireNonNull(insertionPoint, "insertionPoint must not be null");
        if (complexityScore < 1) {
            throw new IllegalArgumentException("complexityScore must be >= 1");
        }
        if (kind == ElementKind.CLASS && returns != null) {
            throw new IllegalArgumentException("classes carry no return info");
        }
        qualifiedName = qualifiedName != null ? qualifiedName : name;
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        raises = raises != null ? dedupe(raises) : List.of();
        modifiers = modifiers == null || modifiers.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
        bodyDigest = bodyDigest != null ? bodyDigest : "";
    }

    private static List<ExceptionInfo> dedupe(List<ExceptionInfo> raises) {
        Map<String, ExceptionInfo> byKind = new LinkedHashMap<>();
        for (ExceptionInfo info : raises) {
            byKind.putIfAbsent(info.kind(), info);
        }
        return List.copyOf(byKind.values());
    }

    /**
     * Parameters that appear in documentation (receiver excluded).
     *
     * @return documented parameters in declaration order
     */
    public List<Parameter> documentedParameters() {
        return parameters.stream().filter(Parameter::isDocumented).toList();
    }

    public boolean hasExistingDoc() {
        return existingDoc != null;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    /**
     * Line of the {@code def}/{@code class} keyword.
     *
     * @return 1-indexed line
     */
    public int line() {
        return sourceSpan.startLine();
    }

    /**
     * Returns an augmented copy. Span, existing doc and all other facts are carried over.
     *
     * @param inferredParameters parameters with inferred types
     * @param inferredReturns return info with inferred type, or null
     * @param complexity computed cyclomatic complexity
     * @return augmented element
     */
    public CodeElement withInference(List<Parameter> inferredParameters, ReturnInfo inferredReturns, int complexity) {
        if (inferredParameters.size() != parameters.size()) {
            throw new IllegalArgumentException("inference must not add or drop parameters");
        }
        return new CodeElement(kind, name, qualifiedName, inferredParameters, inferredReturns, raises,
            existingDoc, sourceSpan, insertionPoint, complexity, modifiers, decorators, bodyDigest);
    }

    /**
     * Warnings for facts inference could not resolve.
     *
     * @return one message per unresolved parameter or return type
     */
    public List<String> inferenceWarnings() {
        List<String> warnings = new ArrayList<>();
        for (Parameter parameter : parameters) {
            if (parameter.hasUnknownType()) {
                warnings.add("Could not infer type of parameter '" + parameter.name() + "'");
            }
        }
        if (returns != null && returns.hasUnknownType()) {
            warnings.add("Could not infer return type");
        }
        return warnings;
    }
}
