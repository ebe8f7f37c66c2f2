package com.docforge.core.critic;

import com.docforge.core.llm.EvaluationClient;
import com.docforge.core.llm.EvaluationException;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.Parameter;
import com.docforge.core.style.DocstringFormat;
import com.docforge.core.style.StyleTemplate;
import com.docforge.core.style.StyleTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reviews candidate blocks against the facts of their element.
 *
 * <p>Five objective checks carry equal weight: the block is non-empty and embeddable, it
 * stays under {@value #MAX_LINES} lines, it mentions every documented parameter, it has a
 * returns section exactly when the element returns, and it mentions every raised kind. Each
 * failed check adds an issue and a matching suggestion.
 *
 * <p>When an {@link EvaluationClient} is configured its score is averaged with the objective
 * score and its issues and suggestions are appended. An evaluation failure is logged and the
 * review falls back to the objective checks alone.
 */
public class DocstringCritic {

    private static final Logger log = LoggerFactory.getLogger(DocstringCritic.class);

    static final int MAX_LINES = 200;
    private static final int CHECKS = 5;

    private final EvaluationClient evaluator;

    public DocstringCritic() {
        this(null);
    }

    /**
     * @param evaluator optional model-backed evaluator, may be null
     */
    public DocstringCritic(EvaluationClient evaluator) {
        this.evaluator = evaluator;
    }

    public CriticReview review(CodeElement element, String candidate, DocstringStyle style) {
        StyleTemplate template = StyleTemplates.forStyle(style);
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        int passed = 0;

        if (candidate != null && !DocstringFormat.body(candidate).isBlank() && DocstringFormat.isDelimited(candidate)) {
            passed++;
        } else {
            issues.add("Docstring is empty or not a single triple-quoted block");
            suggestions.add("Return one block delimited by \"\"\" with a summary line");
        }
        String text = candidate != null ? candidate : "";

        if (DocstringFormat.lineCount(text) < MAX_LINES) {
            passed++;
        } else {
            issues.add("Docstring is " + DocstringFormat.lineCount(text) + " lines long");
            suggestions.add("Shorten the docstring to fewer than " + MAX_LINES + " lines");
        }

        List<String> missingParameters = new ArrayList<>();
        for (Parameter parameter : element.documentedParameters()) {
            if (!DocstringFormat.mentions(text, parameter.name())) {
                missingParameters.add(parameter.name());
            }
        }
        if (missingParameters.isEmpty()) {
            passed++;
        } else {
            issues.add("Missing parameters: " + String.join(", ", missingParameters));
            suggestions.add("Document parameters " + String.join(", ", missingParameters));
        }

        boolean returns = element.returns() != null;
        boolean hasSection = template.hasReturnsSection(text);
        if (returns == hasSection) {
            passed++;
        } else if (returns) {
            issues.add("Missing returns section");
            suggestions.add("Describe the " + (element.returns().isGenerator() ? "yielded values" : "return value"));
        } else {
            issues.add("Returns section documented but nothing is returned");
            suggestions.add("Remove the returns section");
        }

        List<String> missingRaises = new ArrayList<>();
        for (ExceptionInfo raised : element.raises()) {
            if (!DocstringFormat.mentions(text, raised.kind())) {
                missingRaises.add(raised.kind());
            }
        }
        if (missingRaises.isEmpty()) {
            passed++;
        } else {
            issues.add("Missing exceptions: " + String.join(", ", missingRaises));
            suggestions.add("Document raised exceptions " + String.join(", ", missingRaises));
        }

        double score = (double) passed / CHECKS;
        if (evaluator != null) {
            try {
                CriticReview judged = evaluator.evaluate(element.bodyDigest(), text, element);
                score = (score + judged.score()) / 2.0;
                issues.addAll(judged.issues());
                suggestions.addAll(judged.suggestions());
            } catch (EvaluationException e) {
                log.warn("Evaluation failed for {}, using objective checks only: {}",
                    element.qualifiedName(), e.getMessage());
            }
        }
        return new CriticReview(Math.max(0.0, Math.min(1.0, score)), issues, suggestions);
    }
}
