package com.docforge.core.extract;

import com.docforge.core.parser.SourceParseException;

/**
 * Turns source text into documentable elements.
 *
 * <p>Implementations are stateless and may be shared between threads.
 */
public interface ElementExtractor {

    /**
     * Extracts every function, method, constructor and class in source order.
     *
     * <p>An empty file, or one with only module-level statements, yields no elements.
     *
     * @param source complete file text
     * @return extraction result
     * @throws SourceParseException if the text is not syntactically valid
     */
    ExtractionResult extract(String source);
}
