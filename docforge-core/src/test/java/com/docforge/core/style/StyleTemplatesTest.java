package com.docforge.core.style;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.ElementKind;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.InferredType;
import com.docforge.core.model.InsertionPoint;
import com.docforge.core.model.Parameter;
import com.docforge.core.model.ReturnInfo;
import com.docforge.core.model.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StyleTemplates} and the built-in templates.
 */
class StyleTemplatesTest {

    private static final DocBlock FULL_BLOCK = new DocBlock(
        "Divide two numbers.",
        List.of(new DocBlock.Field("a", "float", "Dividend."), new DocBlock.Field("b", "float", "Divisor.")),
        new DocBlock.Field(null, "float", "Quotient."),
        false,
        List.of(new DocBlock.Field("ZeroDivisionError", null, "If b is zero.")));

    @Test
    void forStyle_everyStyle_hasTemplate() {
        for (DocstringStyle style : DocstringStyle.values()) {
            assertThat(StyleTemplates.forStyle(style).style()).isEqualTo(style);
        }
    }

    @Test
    void render_google_usesIndentedSections() {
        String text = StyleTemplates.forStyle(DocstringStyle.GOOGLE).render(FULL_BLOCK);

        assertThat(text).isEqualTo("""
            \"\"\"Divide two numbers.

            Args:
                a (float): Dividend.
                b (float): Divisor.

            Returns:
                float: Quotient.

            Raises:
                ZeroDivisionError: If b is zero.
            \"\"\"""");
    }

    @Test
    void render_numpy_underlinesHeaders() {
        String text = StyleTemplates.forStyle(DocstringStyle.NUMPY).render(FULL_BLOCK);

        assertThat(text).isEqualTo("""
            \"\"\"Divide two numbers.

            Parameters
            ----------
            a : float
                Dividend.
            b : float
                Divisor.

            Returns
            -------
            float
                Quotient.

            Raises
            ------
            ZeroDivisionError
                If b is zero.
            \"\"\"""");
    }

    @Test
    void render_rst_usesFieldLists() {
        String text = StyleTemplates.forStyle(DocstringStyle.RST).render(FULL_BLOCK);

        assertThat(text).isEqualTo("""
            \"\"\"Divide two numbers.

            :param a: Dividend.
            :type a: float
            :param b: Divisor.
            :type b: float

            :returns: Quotient.
            :rtype: float

            :raises ZeroDivisionError: If b is zero.
            \"\"\"""");
    }

    @Test
    void render_summaryOnly_isSingleLine() {
        DocBlock block = new DocBlock("Ping the server.", List.of(), null, false, List.of());

        for (DocstringStyle style : DocstringStyle.values()) {
            assertThat(StyleTemplates.forStyle(style).render(block)).isEqualTo("\"\"\"Ping the server.\"\"\"");
        }
    }

    @Test
    void render_generator_usesYieldsHeader() {
        DocBlock block = new DocBlock("Count up.", List.of(), new DocBlock.Field(null, "Iterator[int]", "Numbers."),
            true, List.of());

        assertThat(StyleTemplates.forStyle(DocstringStyle.GOOGLE).render(block)).contains("Yields:\n    Iterator[int]: Numbers.");
        assertThat(StyleTemplates.forStyle(DocstringStyle.NUMPY).render(block)).contains("Yields\n------");
        assertThat(StyleTemplates.forStyle(DocstringStyle.RST).render(block)).contains(":yields: Numbers.");
    }

    @Test
    void render_tripleQuotesInProse_areEscaped() {
        DocBlock block = new DocBlock("Quote \"\"\" inside.", List.of(), null, false, List.of());

        String text = StyleTemplates.forStyle(DocstringStyle.GOOGLE).render(block);

        assertThat(DocstringFormat.isDelimited(text)).isTrue();
    }

    @Test
    void requiredHeaders_followElementShape() {
        CodeElement element = element(new ReturnInfo(null, InferredType.of("int"), false, false),
            List.of(ExceptionInfo.of("KeyError")));

        assertThat(StyleTemplates.forStyle(DocstringStyle.GOOGLE).requiredHeaders(element))
            .containsExactly("Args:", "Returns:", "Raises:");
        assertThat(StyleTemplates.forStyle(DocstringStyle.NUMPY).requiredHeaders(element))
            .containsExactly("Parameters", "Returns", "Raises");
        assertThat(StyleTemplates.forStyle(DocstringStyle.RST).requiredHeaders(element))
            .containsExactly(":param", ":returns:", ":raises");
    }

    @Test
    void requiredHeaders_generator_asksForYields() {
        CodeElement element = element(new ReturnInfo(null, null, true, false), List.of());

        assertThat(StyleTemplates.forStyle(DocstringStyle.GOOGLE).requiredHeaders(element))
            .containsExactly("Args:", "Yields:");
    }

    @Test
    void hasHeader_numpyRequiresUnderline() {
        StyleTemplate numpy = StyleTemplates.forStyle(DocstringStyle.NUMPY);

        assertThat(numpy.hasHeader("\"\"\"Text.\n\nReturns\n-------\nint\n    Value.\n\"\"\"", "Returns")).isTrue();
        assertThat(numpy.hasHeader("\"\"\"Text.\n\nReturns the value.\n\"\"\"", "Returns")).isFalse();
    }

    @Test
    void hasReturnsSection_rstAcceptsShortForm() {
        StyleTemplate rst = StyleTemplates.forStyle(DocstringStyle.RST);

        assertThat(rst.hasReturnsSection("\"\"\"Text.\n\n:return: Value.\n\"\"\"")).isTrue();
        assertThat(rst.hasReturnsSection("\"\"\"Text.\"\"\"")).isFalse();
    }

    @Test
    void hasHeader_googleMatchesIndentedHeaderLine() {
        StyleTemplate google = StyleTemplates.forStyle(DocstringStyle.GOOGLE);

        assertThat(google.hasHeader("\"\"\"Text.\n\n    Args:\n        x: Value.\n    \"\"\"", "Args:")).isTrue();
        assertThat(google.hasHeader("\"\"\"Text mentions Args: inline.\"\"\"", "Args:")).isFalse();
    }

    private static CodeElement element(ReturnInfo returns, List<ExceptionInfo> raises) {
        return new CodeElement(ElementKind.FUNCTION, "f", "f", List.of(Parameter.named("x")), returns, raises,
            null, new SourceSpan(0, 10, 1, 2), new InsertionPoint(9, "    ", false), 1, null, null, null);
    }
}
