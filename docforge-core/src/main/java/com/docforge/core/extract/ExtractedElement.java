package com.docforge.core.extract;

import com.docforge.core.model.CodeElement;
import com.docforge.core.parser.PythonAst;

import java.util.Objects;

/**
 * An element together with the syntax node it was extracted from.
 *
 * @param element extracted facts
 * @param node the {@code def} or {@code class} node
 */
public record ExtractedElement(CodeElement element, PythonAst.Stmt node) {
    public ExtractedElement {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(node, "node must not be null");
    }

    public ExtractedElement withElement(CodeElement augmented) {
        return new ExtractedElement(augmented, node);
    }
}
