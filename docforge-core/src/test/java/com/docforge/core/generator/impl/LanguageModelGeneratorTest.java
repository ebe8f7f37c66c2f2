package com.docforge.core.generator.impl;

import com.docforge.core.extract.PythonElementExtractor;
import com.docforge.core.inference.TypeInferencer;
import com.docforge.core.llm.ChatPrompt;
import com.docforge.core.llm.CompletionClient;
import com.docforge.core.llm.GenerationException;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LanguageModelGenerator}.
 */
class LanguageModelGeneratorTest {

    private static final String SOURCE = """
        def divide(a, b):
            if b == 0:
                raise ZeroDivisionError("b is zero")
            return a / b
        """;

    private final CodeElement element = new TypeInferencer()
        .augment(new PythonElementExtractor().extract(SOURCE)).codeElements().get(0);

    @Test
    void generate_validModelOutput_isNormalizedAndReturned() {
        RecordingClient client = new RecordingClient("""
            ```python
                \"\"\"Divide a by b.

                Args:
                    a (float): Dividend.
                    b (float): Divisor.

                Returns:
                    float: Quotient.

                Raises:
                    ZeroDivisionError: If b is zero.
                \"\"\"
            ```
            """);
        LanguageModelGenerator generator = new LanguageModelGenerator(client);

        String text = generator.generate(element, DocstringStyle.GOOGLE, null);

        assertThat(text).startsWith("\"\"\"Divide a by b.\n\nArgs:\n    a (float): Dividend.");
        assertThat(text).endsWith("If b is zero.\n\"\"\"");
        assertThat(client.prompts).hasSize(1);
        assertThat(client.prompts.get(0).system()).contains("google style");
        assertThat(client.prompts.get(0).user())
            .contains("Element: function divide")
            .contains("Raises: ZeroDivisionError")
            .contains("Template:\n\"\"\"Divide function.");
    }

    @Test
    void generate_outputMissingParameter_fallsBackToRuleBlock() {
        LanguageModelGenerator generator = new LanguageModelGenerator(
            new RecordingClient("\"\"\"Divide a. Raises ZeroDivisionError.\"\"\""));

        String text = generator.generate(element, DocstringStyle.GOOGLE, null);

        assertThat(text).isEqualTo(new RuleBasedGenerator().generate(element, DocstringStyle.GOOGLE, null));
    }

    @Test
    void generate_clientFailure_fallsBackToRuleBlock() {
        CompletionClient failing = prompt -> {
            throw new GenerationException("HTTP 503");
        };
        LanguageModelGenerator generator = new LanguageModelGenerator(failing);

        String text = generator.generate(element, DocstringStyle.NUMPY, null);

        assertThat(text).isEqualTo(new RuleBasedGenerator().generate(element, DocstringStyle.NUMPY, null));
    }

    @Test
    void generate_priorReview_isIncludedInPrompt() {
        RecordingClient client = new RecordingClient("\"\"\"Divide a by b, raising ZeroDivisionError.\"\"\"");
        LanguageModelGenerator generator = new LanguageModelGenerator(client);
        CriticReview review = new CriticReview(0.4, List.of("Missing returns section"),
            List.of("Describe the return value"));

        generator.generate(element, DocstringStyle.GOOGLE, review);

        assertThat(client.prompts.get(0).user())
            .contains("Previous attempt scored 0.40.")
            .contains("- Missing returns section")
            .contains("- Describe the return value");
    }

    @Test
    void normalize_bareText_addsDelimiters() {
        assertThat(LanguageModelGenerator.normalize("  Just a summary.  ")).isEqualTo("\"\"\"Just a summary.\"\"\"");
        assertThat(LanguageModelGenerator.normalize("Line one.\n\n    Line two."))
            .isEqualTo("\"\"\"Line one.\n\nLine two.\n\"\"\"");
    }

    @Test
    void normalize_textAroundBlock_isDropped() {
        assertThat(LanguageModelGenerator.normalize("Here you go:\n\"\"\"Summary.\"\"\"\nHope it helps"))
            .isEqualTo("\"\"\"Summary.\"\"\"");
    }

    @Test
    void validate_reportsEveryProblem() {
        assertThat(LanguageModelGenerator.validate(element, "\"\"\"\"\"\""))
            .containsExactly("empty block", "missing parameter a", "missing parameter b",
                "missing exception ZeroDivisionError");
        assertThat(LanguageModelGenerator.validate(element, "\"\"\"a b ZeroDivisionError\"\"\"")).isEmpty();
    }

    private static final class RecordingClient implements CompletionClient {
        private final String answer;
        private final List<ChatPrompt> prompts = new ArrayList<>();

        RecordingClient(String answer) {
            this.answer = answer;
        }

        @Override
        public String complete(ChatPrompt prompt) {
            prompts.add(prompt);
            return answer;
        }
    }
}
