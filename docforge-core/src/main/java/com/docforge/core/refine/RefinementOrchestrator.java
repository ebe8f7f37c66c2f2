package com.docforge.core.refine;

import com.docforge.core.config.PipelineSettings;
import com.docforge.core.critic.DocstringCritic;
import com.docforge.core.generator.DocstringGenerator;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.docforge.core.model.DocstringResult;
import com.docforge.core.model.RefinementOutcome;
import com.docforge.core.scoring.ConfidenceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives the bounded generate, review and score loop for each element.
 *
 * <p>Each element starts in {@link RefinementPhase#INIT}. Every iteration generates a
 * candidate (seeded with the previous review after the first), reviews it and scores it.
 * A candidate whose confidence reaches the threshold is accepted. Otherwise the loop repeats
 * until {@code maxIterations} generator calls were made and then terminates
 * {@link RefinementPhase#EXHAUSTED} with the highest-scoring candidate seen, carrying a
 * warning. The iteration bound is the only other exit.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * RefinementOrchestrator orchestrator = new RefinementOrchestrator(
 *     new RuleBasedGenerator(), new DocstringCritic(), new ConfidenceScorer());
 * DocstringResult result = orchestrator.refine(element, PipelineSettings.defaults());
 * }</pre>
 */
public class RefinementOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefinementOrchestrator.class);

    private final DocstringGenerator generator;
    private final DocstringCritic critic;
    private final ConfidenceScorer scorer;

    public RefinementOrchestrator(DocstringGenerator generator, DocstringCritic critic, ConfidenceScorer scorer) {
        this.generator = generator;
        this.critic = critic;
        this.scorer = scorer;
    }

    /**
     * Refines one element to a terminal state.
     *
     * @param element element to document
     * @param settings run configuration
     * @return exactly one result
     */
    public DocstringResult refine(CodeElement element, PipelineSettings settings) {
        RefinementState state = new RefinementState();
        CriticReview priorReview = null;
        while (!state.phase().isTerminal()) {
            String candidate = generator.generate(element, settings.style(), priorReview);
            state.generated(candidate);

            CriticReview review = critic.review(element, candidate, settings.style());
            double confidence = scorer.score(element, candidate, review, settings.style());
            state.reviewed(review, confidence);
            log.debug("{} iteration {}: confidence {}", element.qualifiedName(), state.iteration(),
                String.format(Locale.ROOT, "%.3f", confidence));

            if (confidence >= settings.threshold()) {
                state.finish(RefinementPhase.ACCEPTED);
            } else if (state.iteration() >= settings.maxIterations()) {
                state.finish(RefinementPhase.EXHAUSTED);
            } else {
                priorReview = review;
            }
        }
        return result(element, settings, state);
    }

    /**
     * Refines elements, in parallel when {@code settings.elementWorkers() > 1}.
     *
     * @param elements elements of one file
     * @param settings run configuration
     * @return results in element order
     */
    public List<DocstringResult> refineAll(List<CodeElement> elements, PipelineSettings settings) {
        if (settings.elementWorkers() <= 1 || elements.size() <= 1) {
            List<DocstringResult> results = new ArrayList<>(elements.size());
            for (CodeElement element : elements) {
                results.add(refine(element, settings));
            }
            return results;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.elementWorkers(), elements.size()));
        try {
            List<Future<DocstringResult>> futures = new ArrayList<>(elements.size());
            for (CodeElement element : elements) {
                futures.add(executor.submit(() -> refine(element, settings)));
            }
            List<DocstringResult> results = new ArrayList<>(elements.size());
            for (Future<DocstringResult> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static DocstringResult await(Future<DocstringResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while refining elements");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static DocstringResult result(CodeElement element, PipelineSettings settings, RefinementState state) {
        List<String> warnings = new ArrayList<>(element.inferenceWarnings());
        Attempt chosen;
        RefinementOutcome outcome;
        if (state.phase() == RefinementPhase.ACCEPTED) {
            chosen = state.latest();
            outcome = RefinementOutcome.ACCEPTED;
        } else {
            chosen = state.best();
            outcome = RefinementOutcome.EXHAUSTED;
            warnings.add(String.format(Locale.ROOT, "confidence %.2f below threshold %.2f after %d iterations",
                chosen.confidence(), settings.threshold(), state.iteration()));
            log.debug("{} exhausted after {} iterations, best from iteration {}",
                element.qualifiedName(), state.iteration(), chosen.iteration());
        }
        return new DocstringResult(element.name(), element.qualifiedName(), element.kind(), element.sourceSpan(),
            chosen.candidate(), chosen.confidence(), settings.style(), state.iteration(), warnings, outcome);
    }
}
