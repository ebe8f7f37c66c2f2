package com.docforge.core.llm;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.Modifier;
import com.docforge.core.model.Parameter;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds chat prompts from structured element facts.
 *
 * <p>Prompts carry the facts rather than the full source: kind, name, parameters with their
 * types and defaults, return info, raised kinds, complexity, modifiers and the body digest,
 * plus a rule-based skeleton of the requested layout. Refinement prompts add the previous
 * review's issues and suggestions.
 */
public class PromptFactory {

    private static final String GENERATION_SYSTEM =
        "You are a senior Python engineer writing docstrings. Reply with exactly one docstring in %s style, "
            + "delimited by triple double quotes, without code fences or surrounding code. "
            + "Mention every parameter and every raised exception by name. "
            + "Describe only behaviour the facts support.";

    private static final String EVALUATION_SYSTEM =
        "You review Python docstrings for accuracy, completeness and clarity. "
            + "Reply with a JSON object {\"score\": number from 0 to 1, \"issues\": [string], "
            + "\"suggestions\": [string]} and nothing else.";

    public ChatPrompt generationPrompt(CodeElement element, DocstringStyle style, String skeleton,
                                       CriticReview priorReview) {
        StringBuilder user = new StringBuilder(facts(element));
        user.append("\nTemplate:\n").append(skeleton).append('\n');
        if (priorReview != null && (priorReview.hasIssues() || !priorReview.suggestions().isEmpty())) {
            user.append(String.format(Locale.ROOT, "%nPrevious attempt scored %.2f.%n", priorReview.score()));
            if (priorReview.hasIssues()) {
                user.append("Issues to fix:\n");
                priorReview.issues().forEach(issue -> user.append("- ").append(issue).append('\n'));
            }
            if (!priorReview.suggestions().isEmpty()) {
                user.append("Suggestions:\n");
                priorReview.suggestions().forEach(tip -> user.append("- ").append(tip).append('\n'));
            }
        }
        return new ChatPrompt(String.format(GENERATION_SYSTEM, style.id()), user.toString());
    }

    public ChatPrompt evaluationPrompt(String code, String candidate, CodeElement element) {
        String user = facts(element)
            + "\nCode:\n" + code + "\n"
            + "\nCandidate docstring:\n" + candidate + "\n";
        return new ChatPrompt(EVALUATION_SYSTEM, user);
    }

    /**
     * Renders element facts as plain text.
     *
     * @param element element
     * @return multi-line fact listing
     */
    String facts(CodeElement element) {
        StringBuilder facts = new StringBuilder();
        facts.append("Element: ").append(element.kind().label()).append(' ').append(element.qualifiedName()).append('\n');
        if (!element.documentedParameters().isEmpty()) {
            facts.append("Parameters:\n");
            for (Parameter parameter : element.documentedParameters()) {
                facts.append("- ").append(parameter.displayName()).append(": ").append(parameter.effectiveType());
                if (parameter.defaultValue() != null) {
                    facts.append(" (default ").append(parameter.defaultValue()).append(')');
                }
                facts.append('\n');
            }
        }
        if (element.returns() != null) {
            facts.append(element.returns().isGenerator() ? "Yields: " : "Returns: ")
                .append(element.returns().effectiveType());
            if (element.returns().isMultiValue()) {
                facts.append(" (multiple values)");
            }
            facts.append('\n');
        }
        if (!element.raises().isEmpty()) {
            facts.append("Raises: ")
                .append(element.raises().stream().map(ExceptionInfo::kind).collect(Collectors.joining(", ")))
                .append('\n');
        }
        facts.append("Complexity: ").append(element.complexityScore()).append('\n');
        if (!element.modifiers().isEmpty()) {
            facts.append("Modifiers: ")
                .append(element.modifiers().stream()
                    .map(Modifier::name)
                    .map(name -> name.toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", ")))
                .append('\n');
        }
        if (!element.bodyDigest().isEmpty()) {
            facts.append("Body:\n").append(element.bodyDigest()).append('\n');
        }
        return facts.toString();
    }
}
