package com.docforge.core.generator.impl;

import com.docforge.core.extract.PythonElementExtractor;
import com.docforge.core.inference.TypeInferencer;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.DocstringStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RuleBasedGenerator}.
 */
class RuleBasedGeneratorTest {

    private final RuleBasedGenerator generator = new RuleBasedGenerator();

    @Test
    void generate_functionWithReturn_listsArgsAndReturns() {
        CodeElement element = elements("""
            def add(a, b):
                return a + b
            """).get(0);

        String text = generator.generate(element, DocstringStyle.GOOGLE, null);

        assertThat(text).isEqualTo("""
            \"\"\"Add function.

            Args:
                a (int | float): Description of a.
                b (int | float): Description of b.

            Returns:
                int | float: Description of return value.
            \"\"\"""");
    }

    @Test
    void generate_noParametersNoReturn_isSingleLine() {
        CodeElement element = elements("def ping(): pass\n").get(0);

        assertThat(generator.generate(element, DocstringStyle.NUMPY, null)).isEqualTo("\"\"\"Ping function.\"\"\"");
    }

    @Test
    void generate_raisesWithMessage_usesMessageAsDescription() {
        CodeElement element = elements("""
            def check(value: int) -> None:
                if value < 0:
                    raise ValueError("value must be positive")
                raise TypeError
            """).get(0);

        String text = generator.generate(element, DocstringStyle.RST, null);

        assertThat(text)
            .contains(":param value: Description of value.\n:type value: int")
            .contains(":raises ValueError: Value must be positive.")
            .contains(":raises TypeError: Description of TypeError.")
            .doesNotContain(":returns:");
    }

    @Test
    void generate_generator_describesYieldedValues() {
        CodeElement element = elements("""
            def lines(path):
                yield from open(path)
            """).get(0);

        String text = generator.generate(element, DocstringStyle.GOOGLE, null);

        assertThat(text).contains("Yields:\n    Iterator: Description of yielded values.");
    }

    @Test
    void generate_variadicParameters_useStarredNames() {
        CodeElement element = elements("""
            def log(*args, **kwargs):
                pass
            """).get(0);

        assertThat(generator.generate(element, DocstringStyle.GOOGLE, null))
            .contains("*args (tuple): Description of args.")
            .contains("**kwargs (dict): Description of kwargs.");
    }

    @Test
    void summary_derivesSentenceFromName() {
        List<CodeElement> elements = elements("""
            class HttpClient:
                def __init__(self, url):
                    self.url = url

                def sendRequest(self, body):
                    pass

                def _parse_json_body(self, text):
                    pass
            """);

        assertThat(elements).extracting(RuleBasedGenerator::summary).containsExactly(
            "HttpClient class.",
            "Initialize the HttpClient instance.",
            "Send request.",
            "Parse json body.");
    }

    @Test
    void generate_sameElement_isDeterministic() {
        CodeElement element = elements("def scale(x, factor=2):\n    return x * factor\n").get(0);

        assertThat(generator.generate(element, DocstringStyle.GOOGLE, null))
            .isEqualTo(generator.generate(element, DocstringStyle.GOOGLE, null));
    }

    private static List<CodeElement> elements(String source) {
        return new TypeInferencer().augment(new PythonElementExtractor().extract(source)).codeElements();
    }
}
