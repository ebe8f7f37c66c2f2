package com.docforge.core.generator;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;

/**
 * Produces candidate documentation blocks.
 *
 * <p>Implementations never fail: a backend error or an unusable answer falls back to a
 * deterministic rule-based block for that call.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocstringGenerator generator = new RuleBasedGenerator();
 * String candidate = generator.generate(element, DocstringStyle.GOOGLE, null);
 * }</pre>
 */
public interface DocstringGenerator {

    /**
     * Generates a candidate block.
     *
     * @param element element to document
     * @param style target style
     * @param priorReview review of the previous candidate, null on the first iteration
     * @return complete {@code """}-delimited block, unindented
     */
    String generate(CodeElement element, DocstringStyle style, CriticReview priorReview);
}
