package com.docforge.core.scoring;

import com.docforge.core.critic.DocstringCritic;
import com.docforge.core.extract.PythonElementExtractor;
import com.docforge.core.generator.impl.RuleBasedGenerator;
import com.docforge.core.inference.TypeInferencer;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.style.StyleTemplates;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link ConfidenceScorer}.
 */
class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();
    private final DocstringCritic critic = new DocstringCritic();

    private final CodeElement add = element("""
        def add(a, b):
            return a + b
        """);

    @Test
    void score_completeRuleBlock_isOne() {
        String text = new RuleBasedGenerator().generate(add, DocstringStyle.GOOGLE, null);
        CriticReview review = critic.review(add, text, DocstringStyle.GOOGLE);

        assertThat(scorer.score(add, text, review, DocstringStyle.GOOGLE)).isEqualTo(1.0);
    }

    @Test
    void score_summaryOnly_combinesWeightedComponents() {
        String text = "\"\"\"Add function.\"\"\"";
        CriticReview review = critic.review(add, text, DocstringStyle.GOOGLE);

        assertThat(review.score()).isCloseTo(0.6, within(1e-9));
        assertThat(scorer.score(add, text, review, DocstringStyle.GOOGLE)).isCloseTo(0.44, within(1e-9));
    }

    @Test
    void score_isBoundedAndDeterministic() {
        String text = "not a docstring";
        CriticReview review = new CriticReview(0.0, List.of(), List.of());

        double first = scorer.score(add, text, review, DocstringStyle.NUMPY);
        double second = scorer.score(add, text, review, DocstringStyle.NUMPY);

        assertThat(first).isBetween(0.0, 1.0).isEqualTo(second);
    }

    @Test
    void parameterCoverage_countsMentionedParameters() {
        assertThat(ConfidenceScorer.parameterCoverage(add, "\"\"\"Uses a only.\"\"\"")).isEqualTo(0.5);
        assertThat(ConfidenceScorer.parameterCoverage(element("def f():\n    pass\n"), "")).isEqualTo(1.0);
    }

    @Test
    void returnCoverage_requiresSectionExactlyWhenReturning() {
        var template = StyleTemplates.forStyle(DocstringStyle.GOOGLE);
        CodeElement procedure = element("def f():\n    pass\n");
        String withReturns = "\"\"\"F.\n\nReturns:\n    int: Value.\n\"\"\"";

        assertThat(ConfidenceScorer.returnCoverage(add, withReturns, template)).isEqualTo(1.0);
        assertThat(ConfidenceScorer.returnCoverage(add, "\"\"\"F.\"\"\"", template)).isEqualTo(0.0);
        assertThat(ConfidenceScorer.returnCoverage(procedure, "\"\"\"F.\"\"\"", template)).isEqualTo(1.0);
        assertThat(ConfidenceScorer.returnCoverage(procedure, withReturns, template)).isEqualTo(0.0);
    }

    @Test
    void exceptionCoverage_countsMentionedKinds() {
        CodeElement raising = element("""
            def f(x):
                if x:
                    raise ValueError
                raise TypeError
            """);

        assertThat(ConfidenceScorer.exceptionCoverage(raising, "ValueError")).isEqualTo(0.5);
        assertThat(ConfidenceScorer.exceptionCoverage(add, "")).isEqualTo(1.0);
    }

    @Test
    void clarity_singleWordBodyLosesWordCheck() {
        var template = StyleTemplates.forStyle(DocstringStyle.GOOGLE);
        CodeElement procedure = element("def f():\n    pass\n");

        assertThat(ConfidenceScorer.clarity(procedure, "\"\"\"Reset.\"\"\"", template)).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(ConfidenceScorer.clarity(procedure, "\"\"\"Reset state.\"\"\"", template)).isEqualTo(1.0);
    }

    private static CodeElement element(String source) {
        return new TypeInferencer().augment(new PythonElementExtractor().extract(source)).codeElements().get(0);
    }
}
