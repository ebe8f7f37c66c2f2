package com.docforge.core.llm;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;

/**
 * Natural-language evaluation capability.
 */
public interface EvaluationClient {

    /**
     * Judges a candidate block.
     *
     * @param code code the block documents
     * @param candidate candidate block
     * @param element element facts
     * @return review with a score in [0, 1]
     * @throws EvaluationException if the call fails or the verdict cannot be read
     */
    CriticReview evaluate(String code, String candidate, CodeElement element) throws EvaluationException;
}
