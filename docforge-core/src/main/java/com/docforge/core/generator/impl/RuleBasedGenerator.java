package com.docforge.core.generator.impl;

import com.docforge.core.generator.DocstringGenerator;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.ElementKind;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.Parameter;
import com.docforge.core.model.ReturnInfo;
import com.docforge.core.style.DocBlock;
import com.docforge.core.style.StyleTemplates;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic generator that fills the style template from element facts.
 *
 * <p>One line per documented parameter with its declared or inferred type, one return line
 * when the element returns or yields, one line per raised kind. Descriptions are placeholders
 * ({@code "Description of x."}); a message literal from the raise site is used for exceptions
 * when present. Never calls out and never fails.
 */
public class RuleBasedGenerator implements DocstringGenerator {

    @Override
    public String generate(CodeElement element, DocstringStyle style, CriticReview priorReview) {
        return StyleTemplates.forStyle(style).render(block(element));
    }

    /**
     * Builds the style-independent content for an element.
     *
     * @param element element
     * @return block content
     */
    public DocBlock block(CodeElement element) {
        List<DocBlock.Field> parameters = new ArrayList<>();
        for (Parameter parameter : element.documentedParameters()) {
            parameters.add(new DocBlock.Field(parameter.displayName(), parameter.effectiveType(),
                "Description of " + parameter.name() + "."));
        }
        DocBlock.Field returns = null;
        ReturnInfo info = element.returns();
        if (info != null) {
            String description = info.isGenerator() ? "Description of yielded values." : "Description of return value.";
            returns = new DocBlock.Field(null, info.effectiveType(), description);
        }
        List<DocBlock.Field> raises = new ArrayList<>();
        for (ExceptionInfo raised : element.raises()) {
            String description = raised.description() != null
                ? sentence(raised.description())
                : "Description of " + raised.kind() + ".";
            raises.add(new DocBlock.Field(raised.kind(), null, description));
        }
        return new DocBlock(summary(element), parameters, returns, info != null && info.isGenerator(), raises);
    }

    /**
     * Summary line derived from the element name, at least two words, ending with a period.
     *
     * @param element element
     * @return summary sentence
     */
    static String summary(CodeElement element) {
        if (element.kind() == ElementKind.CONSTRUCTOR) {
            String qualified = element.qualifiedName();
            int dot = qualified.lastIndexOf('.');
            String owner = dot > 0 ? qualified.substring(qualified.lastIndexOf('.', dot - 1) + 1, dot) : "object";
            return "Initialize the " + owner + " instance.";
        }
        if (element.kind() == ElementKind.CLASS) {
            return element.name() + " class.";
        }
        List<String> words = words(element.name());
        if (words.isEmpty()) {
            return capitalize(element.kind().label()) + ".";
        }
        String text = String.join(" ", words);
        if (words.size() == 1) {
            text = text + " " + element.kind().label();
        }
        return capitalize(text) + ".";
    }

    private static List<String> words(String identifier) {
        List<String> words = new ArrayList<>();
        for (String part : identifier.split("_+")) {
            if (part.isEmpty()) {
                continue;
            }
            for (String word : part.split("(?<=[a-z0-9])(?=[A-Z])")) {
                words.add(word.toLowerCase(Locale.ROOT));
            }
        }
        return words;
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String sentence(String text) {
        String trimmed = capitalize(text.strip());
        return trimmed.endsWith(".") ? trimmed : trimmed + ".";
    }
}
