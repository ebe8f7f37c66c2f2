package com.docforge.core.refine;

import com.docforge.core.config.PipelineSettings;
import com.docforge.core.critic.DocstringCritic;
import com.docforge.core.extract.PythonElementExtractor;
import com.docforge.core.generator.DocstringGenerator;
import com.docforge.core.generator.impl.RuleBasedGenerator;
import com.docforge.core.inference.TypeInferencer;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringResult;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.RefinementOutcome;
import com.docforge.core.scoring.ConfidenceScorer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RefinementOrchestrator}.
 */
class RefinementOrchestratorTest {

    private static final String SUMMARY_ONLY = "\"\"\"Add two numbers.\"\"\"";
    private static final String PARTIAL = """
        \"\"\"Add two numbers.

        Args:
            a (int): First.
            b (int): Second.
        \"\"\"""";

    private final List<CodeElement> elements = new TypeInferencer().augment(new PythonElementExtractor().extract("""
        def add(a, b):
            return a + b

        def ping():
            pass

        def scale(x, factor):
            return x * factor
        """)).codeElements();

    private final CodeElement add = elements.get(0);

    @Test
    void refine_goodFirstCandidate_acceptsAfterOneIteration() {
        RefinementOrchestrator orchestrator = orchestrator(new RuleBasedGenerator());

        DocstringResult result = orchestrator.refine(add, PipelineSettings.defaults());

        assertThat(result.outcome()).isEqualTo(RefinementOutcome.ACCEPTED);
        assertThat(result.iterationsUsed()).isEqualTo(1);
        assertThat(result.confidenceScore()).isEqualTo(1.0);
        assertThat(result.warnings()).isEmpty();
        assertThat(result.span()).isEqualTo(add.sourceSpan());
        assertThat(result.qualifiedName()).isEqualTo("add");
    }

    @Test
    void refine_unreachableThreshold_exhaustsEveryIteration() {
        CountingGenerator generator = new CountingGenerator(new RuleBasedGenerator());
        RefinementOrchestrator orchestrator = orchestrator(generator);
        PipelineSettings settings = PipelineSettings.defaults().withThreshold(1.01);

        DocstringResult result = orchestrator.refine(add, settings);

        assertThat(result.outcome()).isEqualTo(RefinementOutcome.EXHAUSTED);
        assertThat(result.iterationsUsed()).isEqualTo(settings.maxIterations());
        assertThat(generator.calls.get()).isEqualTo(settings.maxIterations());
        assertThat(result.warnings()).containsExactly("confidence 1.00 below threshold 1.01 after 3 iterations");
    }

    @Test
    void refine_zeroThreshold_acceptsFirstCandidate() {
        CountingGenerator generator = new CountingGenerator(new ScriptedGenerator(SUMMARY_ONLY));

        DocstringResult result = orchestrator(generator).refine(add, PipelineSettings.defaults().withThreshold(0.0));

        assertThat(result.outcome()).isEqualTo(RefinementOutcome.ACCEPTED);
        assertThat(generator.calls.get()).isEqualTo(1);
    }

    @Test
    void refine_improvingCandidates_passesReviewToNextIteration() {
        ScriptedGenerator generator = new ScriptedGenerator(SUMMARY_ONLY,
            new RuleBasedGenerator().generate(add, DocstringStyle.GOOGLE, null));

        DocstringResult result = orchestrator(generator).refine(add, PipelineSettings.defaults());

        assertThat(result.outcome()).isEqualTo(RefinementOutcome.ACCEPTED);
        assertThat(result.iterationsUsed()).isEqualTo(2);
        assertThat(generator.reviews).hasSize(2);
        assertThat(generator.reviews.get(0)).isNull();
        assertThat(generator.reviews.get(1).issues()).contains("Missing parameters: a, b");
    }

    @Test
    void refine_exhausted_returnsBestCandidateNotLatest() {
        ScriptedGenerator generator = new ScriptedGenerator(PARTIAL, SUMMARY_ONLY, SUMMARY_ONLY);

        DocstringResult result = orchestrator(generator).refine(add, PipelineSettings.defaults());

        assertThat(result.outcome()).isEqualTo(RefinementOutcome.EXHAUSTED);
        assertThat(result.text()).isEqualTo(PARTIAL);
        assertThat(result.iterationsUsed()).isEqualTo(3);
        assertThat(result.confidenceScore()).isLessThan(PipelineSettings.DEFAULT_THRESHOLD);
    }

    @Test
    void refine_unknownTypes_carryInferenceWarnings() {
        CodeElement untyped = new TypeInferencer().augment(new PythonElementExtractor().extract("""
            def forward(value):
                return value
            """)).codeElements().get(0);

        DocstringResult result = orchestrator(new RuleBasedGenerator()).refine(untyped, PipelineSettings.defaults());

        assertThat(result.warnings()).contains("Could not infer type of parameter 'value'", "Could not infer return type");
    }

    @Test
    void refineAll_parallelWorkers_keepsElementOrder() {
        PipelineSettings settings = new PipelineSettings(DocstringStyle.GOOGLE, 0.8, 3, false, 4);

        List<DocstringResult> results = orchestrator(new RuleBasedGenerator()).refineAll(elements, settings);

        assertThat(results).extracting(DocstringResult::qualifiedName).containsExactly("add", "ping", "scale");
        assertThat(results).allMatch(DocstringResult::accepted);
    }

    @Test
    void refineAll_generatorFailure_propagates() {
        DocstringGenerator broken = (element, style, priorReview) -> {
            throw new IllegalStateException("generator broke");
        };
        PipelineSettings settings = new PipelineSettings(DocstringStyle.GOOGLE, 0.8, 3, false, 2);

        assertThatThrownBy(() -> orchestrator(broken).refineAll(elements, settings))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("generator broke");
    }

    @Test
    void refineAll_noElements_returnsEmpty() {
        assertThat(orchestrator(new RuleBasedGenerator()).refineAll(List.of(), PipelineSettings.defaults())).isEmpty();
    }

    private static RefinementOrchestrator orchestrator(DocstringGenerator generator) {
        return new RefinementOrchestrator(generator, new DocstringCritic(), new ConfidenceScorer());
    }

    /** Returns scripted candidates in order, repeating the last one. */
    private static final class ScriptedGenerator implements DocstringGenerator {
        private final List<String> candidates;
        private final List<CriticReview> reviews = Collections.synchronizedList(new ArrayList<>());

        ScriptedGenerator(String... candidates) {
            this.candidates = List.of(candidates);
        }

        @Override
        public String generate(CodeElement element, DocstringStyle style, CriticReview priorReview) {
            reviews.add(priorReview);
            return candidates.get(Math.min(reviews.size(), candidates.size()) - 1);
        }
    }

    private static final class CountingGenerator implements DocstringGenerator {
        private final DocstringGenerator delegate;
        private final AtomicInteger calls = new AtomicInteger();

        CountingGenerator(DocstringGenerator delegate) {
            this.delegate = delegate;
        }

        @Override
        public String generate(CodeElement element, DocstringStyle style, CriticReview priorReview) {
            calls.incrementAndGet();
            return delegate.generate(element, style, priorReview);
        }
    }
}
