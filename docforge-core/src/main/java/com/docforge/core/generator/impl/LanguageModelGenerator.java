package com.docforge.core.generator.impl;

import com.docforge.core.extract.Docstrings;
import com.docforge.core.generator.DocstringGenerator;
import com.docforge.core.llm.ChatPrompt;
import com.docforge.core.llm.CompletionClient;
import com.docforge.core.llm.GenerationException;
import com.docforge.core.llm.PromptFactory;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.Parameter;
import com.docforge.core.style.DocstringFormat;
import com.docforge.core.style.StyleTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Generator backed by a {@link CompletionClient}.
 *
 * <p>The model receives the element facts and a rule-based skeleton of the target layout.
 * Its answer is normalized (fences and stray indentation removed, delimiters added when
 * missing) and then validated: it must be a single embeddable block and name every
 * documented parameter and every raised kind. A failed call or a rejected answer yields the
 * {@link RuleBasedGenerator} block for that iteration.
 */
public class LanguageModelGenerator implements DocstringGenerator {

    private static final Logger log = LoggerFactory.getLogger(LanguageModelGenerator.class);

    private final CompletionClient client;
    private final PromptFactory prompts;
    private final RuleBasedGenerator fallback;

    public LanguageModelGenerator(CompletionClient client) {
        this(client, new PromptFactory(), new RuleBasedGenerator());
    }

    public LanguageModelGenerator(CompletionClient client, PromptFactory prompts, RuleBasedGenerator fallback) {
        this.client = client;
        this.prompts = prompts;
        this.fallback = fallback;
    }

    @Override
    public String generate(CodeElement element, DocstringStyle style, CriticReview priorReview) {
        String skeleton = StyleTemplates.forStyle(style).render(fallback.block(element));
        ChatPrompt prompt = prompts.generationPrompt(element, style, skeleton, priorReview);
        try {
            String candidate = normalize(client.complete(prompt));
            List<String> problems = validate(element, candidate);
            if (problems.isEmpty()) {
                return candidate;
            }
            log.debug("Rejected model output for {}: {}", element.qualifiedName(), problems);
        } catch (GenerationException e) {
            log.warn("Generation failed for {}, using rule-based block: {}", element.qualifiedName(), e.getMessage());
        }
        return fallback.generate(element, style, priorReview);
    }

    /**
     * Brings model output into block form.
     *
     * @param output raw model output
     * @return delimited, dedented block
     */
    static String normalize(String output) {
        String text = output.strip();
        if (text.startsWith("```")) {
            int firstLineEnd = text.indexOf('\n');
            text = firstLineEnd > 0 ? text.substring(firstLineEnd + 1) : "";
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
            text = text.strip();
        }
        int open = text.indexOf(DocstringFormat.DELIMITER);
        int close = text.lastIndexOf(DocstringFormat.DELIMITER);
        if (open >= 0 && close > open) {
            text = text.substring(open + DocstringFormat.DELIMITER.length(), close);
        }
        String content = Docstrings.clean(text);
        if (!content.contains("\n")) {
            return DocstringFormat.DELIMITER + content + DocstringFormat.DELIMITER;
        }
        return DocstringFormat.DELIMITER + content + "\n" + DocstringFormat.DELIMITER;
    }

    /**
     * Lists reasons a normalized candidate cannot be used.
     *
     * @param element documented element
     * @param candidate normalized candidate
     * @return problems, empty if acceptable
     */
    static List<String> validate(CodeElement element, String candidate) {
        List<String> problems = new ArrayList<>();
        if (DocstringFormat.body(candidate).isBlank()) {
            problems.add("empty block");
        }
        if (!DocstringFormat.isDelimited(candidate)) {
            problems.add("not embeddable as a single block");
        }
        for (Parameter parameter : element.documentedParameters()) {
            if (!DocstringFormat.mentions(candidate, parameter.name())) {
                problems.add("missing parameter " + parameter.name());
            }
        }
        for (ExceptionInfo raised : element.raises()) {
            if (!DocstringFormat.mentions(candidate, raised.kind())) {
                problems.add("missing exception " + raised.kind());
            }
        }
        return problems;
    }
}
