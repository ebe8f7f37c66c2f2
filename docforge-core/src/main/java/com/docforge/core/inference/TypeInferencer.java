package com.docforge.core.inference;

import com.docforge.core.extract.ExtractedElement;
import com.docforge.core.extract.ExtractionResult;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.InferredType;
import com.docforge.core.model.Parameter;
import com.docforge.core.model.ParameterKind;
import com.docforge.core.model.ReturnInfo;
import com.docforge.core.parser.PythonAst.ClassDef;
import com.docforge.core.parser.PythonAst.FunctionDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Augments extracted elements with inferred types and complexity.
 *
 * <p>Parameters with an annotation keep it and get no inferred type; the receiver is left
 * alone. Variadics resolve to {@code tuple} and {@code dict}. Everything else goes through
 * {@link EvidenceCollector} and {@link TypeResolver}. Unresolved types become
 * {@link InferredType#UNKNOWN} and surface later as warnings.
 *
 * <p>Augmentation returns copies; spans and existing blocks are never touched.
 */
public class TypeInferencer {

    private static final Logger log = LoggerFactory.getLogger(TypeInferencer.class);

    private final EvidenceCollector evidenceCollector;
    private final TypeResolver typeResolver;
    private final ReturnTypeInferrer returnTypeInferrer;
    private final ComplexityCalculator complexityCalculator;

    public TypeInferencer() {
        this(new EvidenceCollector(), new TypeResolver(), new ReturnTypeInferrer(), new ComplexityCalculator());
    }

    public TypeInferencer(EvidenceCollector evidenceCollector, TypeResolver typeResolver,
                          ReturnTypeInferrer returnTypeInferrer, ComplexityCalculator complexityCalculator) {
        this.evidenceCollector = evidenceCollector;
        this.typeResolver = typeResolver;
        this.returnTypeInferrer = returnTypeInferrer;
        this.complexityCalculator = complexityCalculator;
    }

    /**
     * Augments every element of an extraction.
     *
     * @param extraction extraction result
     * @return copy with augmented elements in the same order
     */
    public ExtractionResult augment(ExtractionResult extraction) {
        List<ExtractedElement> augmented = new ArrayList<>(extraction.elements().size());
        for (ExtractedElement extracted : extraction.elements()) {
            augmented.add(extracted.withElement(augment(extracted)));
        }
        return extraction.withElements(augmented);
    }

    /**
     * Augments a single element.
     *
     * @param extracted element and its node
     * @return augmented element
     */
    public CodeElement augment(ExtractedElement extracted) {
        CodeElement element = extracted.element();
        if (extracted.node() instanceof ClassDef type) {
            int complexity = complexityCalculator.complexity(type.body().statements());
            return element.withInference(element.parameters(), null, complexity);
        }
        FunctionDef function = (FunctionDef) extracted.node();
        Map<String, Set<EvidenceTag>> evidence = evidenceCollector.collect(function);

        List<Parameter> parameters = new ArrayList<>(element.parameters().size());
        Map<String, String> knownTypes = new HashMap<>();
        for (Parameter parameter : element.parameters()) {
            Parameter inferred = inferParameter(parameter, evidence.getOrDefault(parameter.name(), Set.of()));
            parameters.add(inferred);
            if (inferred.declaredType() != null) {
                knownTypes.put(inferred.name(), inferred.declaredType());
            } else if (inferred.inferredType() != null && inferred.inferredType().known()) {
                knownTypes.put(inferred.name(), inferred.inferredType().name());
            }
        }

        ReturnInfo returns = returnTypeInferrer.infer(function, element.returns(), knownTypes);
        int complexity = complexityCalculator.complexity(function.body().statements());
        CodeElement augmented = element.withInference(parameters, returns, complexity);
        if (log.isDebugEnabled()) {
            log.debug("Inferred {}: complexity={}, unresolved={}", element.qualifiedName(), complexity,
                augmented.inferenceWarnings().size());
        }
        return augmented;
    }

    private Parameter inferParameter(Parameter parameter, Set<EvidenceTag> tags) {
        if (parameter.kind() == ParameterKind.RECEIVER || parameter.declaredType() != null) {
            return parameter;
        }
        if (parameter.kind() == ParameterKind.VAR_POSITIONAL) {
            return parameter.withInferredType(InferredType.of("tuple"));
        }
        if (parameter.kind() == ParameterKind.VAR_KEYWORD) {
            return parameter.withInferredType(InferredType.of("dict"));
        }
        return parameter.withInferredType(typeResolver.resolve(tags));
    }
}
