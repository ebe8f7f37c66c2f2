package com.docforge.core.inject;

import com.docforge.core.extract.PythonElementExtractor;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.DocstringResult;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.RefinementOutcome;
import com.docforge.core.model.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocstringInjector}.
 */
class DocstringInjectorTest {

    private final PythonElementExtractor extractor = new PythonElementExtractor();
    private final DocstringInjector injector = new DocstringInjector();

    @Test
    void inject_blockBody_insertsIndentedBlockBeforeFirstStatement() {
        String source = "def add(a, b):\n    return a + b\n";

        String output = injectAll(source, false, "\"\"\"Add.\n\nMore.\n\"\"\"");

        assertThat(output).isEqualTo("def add(a, b):\n    \"\"\"Add.\n\n    More.\n    \"\"\"\n    return a + b\n");
    }

    @Test
    void inject_inlineBody_movesBodyToOwnLine() {
        String source = "def ping(): pass\n";

        String output = injectAll(source, false, "\"\"\"Ping.\"\"\"");

        assertThat(output).isEqualTo("def ping():\n    \"\"\"Ping.\"\"\"\n    pass\n");
    }

    @Test
    void inject_crlfSource_usesCrlfThroughout() {
        String source = "def f(x):\r\n    return x\r\n";

        String output = injectAll(source, false, "\"\"\"F.\n\nArgs:\n    x: X.\n\"\"\"");

        assertThat(output).isEqualTo(
            "def f(x):\r\n    \"\"\"F.\r\n\r\n    Args:\r\n        x: X.\r\n    \"\"\"\r\n    return x\r\n");
        assertThat(output.replace("\r\n", "")).doesNotContain("\n");
    }

    @Test
    void inject_tabIndentedSource_reusesTabs() {
        String source = "class A:\n\tdef f(self):\n\t\treturn 1\n";
        List<CodeElement> elements = extractor.extract(source).codeElements();

        String output = injector.inject(source, elements, results(List.of(elements.get(1)), "\"\"\"F.\"\"\""), false);

        assertThat(output).isEqualTo("class A:\n\tdef f(self):\n\t\t\"\"\"F.\"\"\"\n\t\treturn 1\n");
    }

    @Test
    void inject_blankExistingDocstring_isReplacedWithoutOverwrite() {
        String source = "def f():\n    \"\"\n    return 1\n";

        String output = injectAll(source, false, "\"\"\"F.\"\"\"");

        assertThat(output).isEqualTo("def f():\n    \"\"\"F.\"\"\"\n    return 1\n");
    }

    @Test
    void inject_existingDocstringWithoutOverwrite_isKept() {
        String source = "def f():\n    \"\"\"Original.\"\"\"\n    return 1\n";

        String output = injectAll(source, false, "\"\"\"Replacement.\"\"\"");

        assertThat(output).isEqualTo(source);
    }

    @Test
    void inject_existingDocstringWithOverwrite_replacesOnlyLiteral() {
        String source = "def f():\n    '''Original\n    text.'''\n    return 1\n";

        String output = injectAll(source, true, "\"\"\"New.\n\nDetails.\n\"\"\"");

        assertThat(output).isEqualTo("def f():\n    \"\"\"New.\n\n    Details.\n    \"\"\"\n    return 1\n");
    }

    @Test
    void inject_noResults_returnsSourceUnchanged() {
        String source = "def f():\n    return 1\n";

        String output = injector.inject(source, extractor.extract(source).codeElements(), Map.of(), false);

        assertThat(output).isSameAs(source);
    }

    @Test
    void inject_subsetOfElements_leavesOthersByteIdentical() {
        String untouched = "def middle(y):\n    # keep this comment\n    return  y\n";
        String source = "def first(x):\n    return x\n\n\n" + untouched + "\n\ndef last(z):\n    return z\n";
        List<CodeElement> elements = extractor.extract(source).codeElements();

        String output = injector.inject(source, elements,
            results(List.of(elements.get(0), elements.get(2)), "\"\"\"Doc.\"\"\""), false);

        assertThat(output).contains(untouched);
        List<CodeElement> reparsed = extractor.extract(output).codeElements();
        assertThat(reparsed).extracting(CodeElement::hasExistingDoc).containsExactly(true, false, true);
    }

    @Test
    void inject_nestedElements_allBlocksRoundTrip() {
        String source = """
            class Calculator:
                def __init__(self):
                    self.total = 0

                def add(self, value): self.total += value
            """;
        List<CodeElement> elements = extractor.extract(source).codeElements();
        Map<SourceSpan, DocstringResult> results = new LinkedHashMap<>();
        results.put(elements.get(0).sourceSpan(), result(elements.get(0), "\"\"\"Calculator.\n\nKeeps a total.\n\"\"\""));
        results.put(elements.get(1).sourceSpan(), result(elements.get(1), "\"\"\"Initialize.\"\"\""));
        results.put(elements.get(2).sourceSpan(), result(elements.get(2), "\"\"\"Add value.\"\"\""));

        String output = injector.inject(source, elements, results, false);

        List<CodeElement> reparsed = extractor.extract(output).codeElements();
        assertThat(reparsed).extracting(CodeElement::qualifiedName)
            .containsExactly("Calculator", "Calculator.__init__", "Calculator.add");
        assertThat(reparsed).extracting(element -> element.existingDoc().content())
            .containsExactly("Calculator.\n\nKeeps a total.", "Initialize.", "Add value.");
        assertThat(output).contains("    def add(self, value):\n        \"\"\"Add value.\"\"\"\n        self.total += value\n");
    }

    @Test
    void indentContinuation_leavesBlankLinesEmpty() {
        assertThat(DocstringInjector.indentContinuation("a\n\nb", "  ", "\n")).isEqualTo("a\n\n  b");
    }

    @Test
    void lineEnding_prefersNextBreakThenPrevious() {
        assertThat(DocstringInjector.lineEnding("a\r\nb\n", 0)).isEqualTo("\r\n");
        assertThat(DocstringInjector.lineEnding("a\r\nb", 3)).isEqualTo("\r\n");
        assertThat(DocstringInjector.lineEnding("a\rb", 2)).isEqualTo("\r");
        assertThat(DocstringInjector.lineEnding("abc", 1)).isEqualTo("\n");
    }

    private String injectAll(String source, boolean overwrite, String text) {
        List<CodeElement> elements = extractor.extract(source).codeElements();
        return injector.inject(source, elements, results(elements, text), overwrite);
    }

    private static Map<SourceSpan, DocstringResult> results(List<CodeElement> elements, String text) {
        Map<SourceSpan, DocstringResult> results = new LinkedHashMap<>();
        for (CodeElement element : elements) {
            results.put(element.sourceSpan(), result(element, text));
        }
        return results;
    }

    private static DocstringResult result(CodeElement element, String text) {
        return new DocstringResult(element.name(), element.qualifiedName(), element.kind(), element.sourceSpan(),
            text, 1.0, DocstringStyle.GOOGLE, 1, List.of(), RefinementOutcome.ACCEPTED);
    }
}
