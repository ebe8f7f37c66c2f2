package com.docforge.core.scoring;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.Parameter;
import com.docforge.core.style.DocstringFormat;
import com.docforge.core.style.StyleTemplate;
import com.docforge.core.style.StyleTemplates;

import java.util.List;

/**
 * Combines the critic score with objective coverage into a confidence in [0, 1].
 *
 * <p>Weights: critic {@value #CRITIC_WEIGHT}, parameter coverage {@value #PARAMETER_WEIGHT},
 * return coverage {@value #RETURN_WEIGHT}, exception coverage {@value #EXCEPTION_WEIGHT},
 * clarity {@value #CLARITY_WEIGHT}. A coverage component is 1.0 when there is nothing to
 * cover; return coverage is 1.0 only when a returns section is present exactly when the
 * element returns. Pure: equal inputs give equal scores.
 */
public class ConfidenceScorer {

    static final double CRITIC_WEIGHT = 0.4;
    static final double PARAMETER_WEIGHT = 0.2;
    static final double RETURN_WEIGHT = 0.15;
    static final double EXCEPTION_WEIGHT = 0.1;
    static final double CLARITY_WEIGHT = 0.15;

    static final int MIN_WORDS = 2;
    static final int MAX_WORDS = 250;

    public double score(CodeElement element, String candidate, CriticReview review, DocstringStyle style) {
        String text = candidate != null ? candidate : "";
        StyleTemplate template = StyleTemplates.forStyle(style);
        double total = CRITIC_WEIGHT * review.score()
            + PARAMETER_WEIGHT * parameterCoverage(element, text)
            + RETURN_WEIGHT * returnCoverage(element, text, template)
            + EXCEPTION_WEIGHT * exceptionCoverage(element, text)
            + CLARITY_WEIGHT * clarity(element, text, template);
        double rounded = Math.round(total * 1e9) / 1e9;
        return Math.max(0.0, Math.min(1.0, rounded));
    }

    static double parameterCoverage(CodeElement element, String text) {
        List<Parameter> parameters = element.documentedParameters();
        if (parameters.isEmpty()) {
            return 1.0;
        }
        long mentioned = parameters.stream().filter(p -> DocstringFormat.mentions(text, p.name())).count();
        return (double) mentioned / parameters.size();
    }

    static double returnCoverage(CodeElement element, String text, StyleTemplate template) {
        boolean required = element.returns() != null;
        return template.hasReturnsSection(text) == required ? 1.0 : 0.0;
    }

    static double exceptionCoverage(CodeElement element, String text) {
        List<ExceptionInfo> raises = element.raises();
        if (raises.isEmpty()) {
            return 1.0;
        }
        long mentioned = raises.stream().filter(r -> DocstringFormat.mentions(text, r.kind())).count();
        return (double) mentioned / raises.size();
    }

    /**
     * Share of clarity checks passed: word count within bounds, required headers present,
     * block embeddable.
     */
    static double clarity(CodeElement element, String text, StyleTemplate template) {
        int passed = 0;
        String body = DocstringFormat.body(text).strip();
        int words = body.isEmpty() ? 0 : body.split("\\s+").length;
        if (words >= MIN_WORDS && words <= MAX_WORDS) {
            passed++;
        }
        boolean headers = true;
        for (String header : template.requiredHeaders(element)) {
            headers &= template.hasHeader(text, header);
        }
        if (headers) {
            passed++;
        }
        if (DocstringFormat.isDelimited(text)) {
            passed++;
        }
        return passed / 3.0;
    }
}
