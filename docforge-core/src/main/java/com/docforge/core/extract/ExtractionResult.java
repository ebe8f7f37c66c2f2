package com.docforge.core.extract;

import com.docforge.core.model.CodeElement;
import com.docforge.core.parser.PythonAst;

import java.util.List;
import java.util.Objects;

/**
 * Output of one extraction pass over a file.
 *
 * @param source text the elements were extracted from
 * @param module parsed tree
 * @param elements elements in source pre-order (an owner precedes its members)
 */
public record ExtractionResult(String source, PythonAst.Module module, List<ExtractedElement> elements) {
    public ExtractionResult {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(module, "module must not be null");
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    public List<CodeElement> codeElements() {
        return elements.stream().map(ExtractedElement::element).toList();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public ExtractionResult withElements(List<ExtractedElement> augmented) {
        return new ExtractionResult(source, module, augmented);
    }
}
