package com.docforge.core.extract;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.ElementKind;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.Modifier;
import com.docforge.core.model.Parameter;
import com.docforge.core.model.ParameterKind;
import com.docforge.core.parser.SourceParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PythonElementExtractor}.
 */
class PythonElementExtractorTest {

    private final PythonElementExtractor extractor = new PythonElementExtractor();

    @Test
    void extract_classWithMethods_qualifiesMembersByOwner() {
        List<CodeElement> elements = extractor.extract("""
            class Calculator:
                def __init__(self, start=0):
                    self.total = start

                def add(self, value):
                    self.total += value
                    return self.total


            def helper():
                pass
            """).codeElements();

        assertThat(elements).extracting(CodeElement::qualifiedName)
            .containsExactly("Calculator", "Calculator.__init__", "Calculator.add", "helper");
        assertThat(elements).extracting(CodeElement::kind)
            .containsExactly(ElementKind.CLASS, ElementKind.CONSTRUCTOR, ElementKind.METHOD, ElementKind.FUNCTION);

        CodeElement constructor = elements.get(1);
        assertThat(constructor.returns()).isNull();
        assertThat(constructor.parameters()).extracting(Parameter::kind)
            .containsExactly(ParameterKind.RECEIVER, ParameterKind.POSITIONAL_OR_KEYWORD);
        assertThat(constructor.documentedParameters()).extracting(Parameter::name).containsExactly("start");
        assertThat(constructor.parameters().get(1).defaultValue()).isEqualTo("0");

        assertThat(elements.get(2).returns()).isNotNull();
        assertThat(elements.get(3).returns()).isNull();
    }

    @Test
    void extract_moduleWithoutDefinitions_returnsNoElements() {
        ExtractionResult result = extractor.extract("""
            import os

            VALUE = os.getenv("X")
            """);

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void extract_emptySource_returnsNoElements() {
        assertThat(extractor.extract("").isEmpty()).isTrue();
    }

    @Test
    void extract_existingDocstring_capturesContentAndSpan() {
        String source = """
            def area(r):
                \"\"\"Compute the area.

                    Uses pi.
                \"\"\"
                return 3.14 * r * r
            """;

        CodeElement element = extractor.extract(source).codeElements().get(0);

        assertThat(element.hasExistingDoc()).isTrue();
        assertThat(element.existingDoc().content()).isEqualTo("Compute the area.\n\nUses pi.");
        assertThat(element.existingDoc().span().text(source)).startsWith("\"\"\"Compute").endsWith("\"\"\"");
        assertThat(element.existingDoc().rawText()).isEqualTo(element.existingDoc().span().text(source));
    }

    @Test
    void extract_blockBody_insertsBeforeFirstStatement() {
        String source = """
            class Shape:
                def scale(self, factor):
                    return factor
            """;

        CodeElement method = extractor.extract(source).codeElements().get(1);

        assertThat(method.insertionPoint().inlineBody()).isFalse();
        assertThat(method.insertionPoint().offset()).isEqualTo(source.indexOf("        return"));
        assertThat(method.insertionPoint().indent()).isEqualTo("        ");
    }

    @Test
    void extract_inlineBody_insertsAfterColonWithDeeperIndent() {
        String source = "class A:\n    def ping(self): pass\n";

        CodeElement method = extractor.extract(source).codeElements().get(1);

        assertThat(method.insertionPoint().inlineBody()).isTrue();
        assertThat(method.insertionPoint().offset()).isEqualTo(source.indexOf("): pass") + 2);
        assertThat(method.insertionPoint().indent()).isEqualTo("        ");
    }

    @Test
    void extract_raiseSites_collectsKindsOnceWithMessages() {
        CodeElement element = extractor.extract("""
            def parse(text):
                if not text:
                    raise ValueError("text must not be empty")
                try:
                    return int(text)
                except KeyError as error:
                    raise error
                except OSError:
                    raise
                if text == "x":
                    raise ValueError("other message")
                raise errors.ParseError
            """).codeElements().get(0);

        assertThat(element.raises()).extracting(ExceptionInfo::kind)
            .containsExactly("ValueError", "errors.ParseError");
        assertThat(element.raises().get(0).description()).isEqualTo("text must not be empty");
        assertThat(element.raises().get(1).description()).isNull();
    }

    @Test
    void extract_nestedFunction_raisesStayInOwnScope() {
        List<CodeElement> elements = extractor.extract("""
            def outer():
                def inner():
                    raise KeyError("missing")
                return inner
            """).codeElements();

        assertThat(elements).extracting(CodeElement::qualifiedName).containsExactly("outer", "outer.inner");
        assertThat(elements.get(0).raises()).isEmpty();
        assertThat(elements.get(1).raises()).extracting(ExceptionInfo::kind).containsExactly("KeyError");
        assertThat(elements.get(1).hasModifier(Modifier.NESTED)).isTrue();
    }

    @Test
    void extract_generator_marksYields() {
        CodeElement element = extractor.extract("""
            def count(limit):
                for i in range(limit):
                    yield i
            """).codeElements().get(0);

        assertThat(element.returns()).isNotNull();
        assertThat(element.returns().isGenerator()).isTrue();
        assertThat(element.hasModifier(Modifier.GENERATOR)).isTrue();
    }

    @Test
    void extract_returnShapes_decideReturnInfo() {
        List<CodeElement> elements = extractor.extract("""
            def nothing():
                return None

            def declared_none() -> None:
                print("x")

            def declared_int() -> int:
                raise NotImplementedError

            def pair(a, b):
                return a, b
            """).codeElements();

        assertThat(elements.get(0).returns()).isNull();
        assertThat(elements.get(1).returns()).isNull();
        assertThat(elements.get(2).returns().declaredType()).isEqualTo("int");
        assertThat(elements.get(3).returns().isMultiValue()).isTrue();
    }

    @Test
    void extract_decorators_setModifiersAndReceiver() {
        List<CodeElement> elements = extractor.extract("""
            class Config:
                @staticmethod
                def parse(text):
                    return text

                @classmethod
                def create(cls, name):
                    return cls()

                @property
                def name(self):
                    return self._name
            """).codeElements();

        CodeElement parse = elements.get(1);
        assertThat(parse.hasModifier(Modifier.STATIC_METHOD)).isTrue();
        assertThat(parse.documentedParameters()).extracting(Parameter::name).containsExactly("text");
        assertThat(parse.decorators()).containsExactly("staticmethod");

        CodeElement create = elements.get(2);
        assertThat(create.hasModifier(Modifier.CLASS_METHOD)).isTrue();
        assertThat(create.documentedParameters()).extracting(Parameter::name).containsExactly("name");

        assertThat(elements.get(3).hasModifier(Modifier.PROPERTY)).isTrue();
        assertThat(elements.get(3).hasModifier(Modifier.DECORATED)).isTrue();
    }

    @Test
    void extract_abstractBase_marksClassAbstract() {
        CodeElement type = extractor.extract("""
            from abc import ABC, abstractmethod

            class Repository(ABC):
                @abstractmethod
                def find(self, key):
                    ...
            """).codeElements().get(0);

        assertThat(type.kind()).isEqualTo(ElementKind.CLASS);
        assertThat(type.hasModifier(Modifier.ABSTRACT)).isTrue();
        assertThat(type.returns()).isNull();
    }

    @Test
    void extract_definitionsInsideConditionals_areFound() {
        List<CodeElement> elements = extractor.extract("""
            try:
                import fast
            except ImportError:
                def fallback(x):
                    return x
            """).codeElements();

        assertThat(elements).extracting(CodeElement::name).containsExactly("fallback");
    }

    @Test
    void extract_bodyDigest_listsStatementsAndCalls() {
        CodeElement element = extractor.extract("""
            def save(path, data):
                \"\"\"Existing.\"\"\"
                with open(path, "w") as handle:
                    handle.write(data)
            """).codeElements().get(0);

        assertThat(element.bodyDigest())
            .startsWith("with open(path, \"w\") as handle:")
            .doesNotContain("Existing")
            .contains("calls: open, handle.write");
    }

    @Test
    void extract_invalidSource_throwsParseError() {
        assertThatThrownBy(() -> extractor.extract("def broken(:\n    pass\n"))
            .isInstanceOf(SourceParseException.class);
    }
}
