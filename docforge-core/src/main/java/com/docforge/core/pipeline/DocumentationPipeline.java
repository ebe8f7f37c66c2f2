package com.docforge.core.pipeline;

import com.docforge.core.config.PipelineSettings;
import com.docforge.core.critic.DocstringCritic;
import com.docforge.core.extract.ElementExtractor;
import com.docforge.core.extract.ExtractionResult;
import com.docforge.core.extract.PythonElementExtractor;
import com.docforge.core.generator.DocstringGenerator;
import com.docforge.core.inference.TypeInferencer;
import com.docforge.core.inject.DocstringInjector;
import com.docforge.core.model.CodeElement;
import com.docforge.core.model.DocstringResult;
import com.docforge.core.model.SourceSpan;
import com.docforge.core.refine.RefinementOrchestrator;
import com.docforge.core.scoring.ConfidenceScorer;
import com.docforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs extract, infer, refine and inject over one source text.
 *
 * <p>Synchronous; the only blocking calls are the ones the generator and critic make to an
 * external model. Holds no per-file state, so one instance may serve several threads.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocumentationPipeline pipeline = DocumentationPipeline.create(new RuleBasedGenerator(), new DocstringCritic());
 * FileOutcome outcome = pipeline.process(source, PipelineSettings.defaults());
 * }</pre>
 */
public class DocumentationPipeline {

    private static final Logger log = LoggerFactory.getLogger(DocumentationPipeline.class);

    private final ElementExtractor extractor;
    private final TypeInferencer inferencer;
    private final RefinementOrchestrator orchestrator;
    private final DocstringInjector injector;

    public DocumentationPipeline(ElementExtractor extractor, TypeInferencer inferencer,
                                 RefinementOrchestrator orchestrator, DocstringInjector injector) {
        this.extractor = extractor;
        this.inferencer = inferencer;
        this.orchestrator = orchestrator;
        this.injector = injector;
    }

    /**
     * Wires the standard stages around the given generator and critic.
     *
     * @param generator candidate producer
     * @param critic candidate reviewer
     * @return pipeline
     */
    public static DocumentationPipeline create(DocstringGenerator generator, DocstringCritic critic) {
        return new DocumentationPipeline(new PythonElementExtractor(), new TypeInferencer(),
            new RefinementOrchestrator(generator, critic, new ConfidenceScorer()), new DocstringInjector());
    }

    /**
     * Documents every element of {@code source}.
     *
     * @param source Python source text
     * @param settings run configuration
     * @return rewritten text and per-element results
     * @throws com.docforge.core.parser.SourceParseException if the source is not valid Python
     */
    public FileOutcome process(String source, PipelineSettings settings) {
        ExtractionResult extraction = inferencer.augment(extractor.extract(source));
        List<CodeElement> elements = extraction.codeElements();

        List<CodeElement> pending = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (CodeElement element : elements) {
            if (!settings.overwrite() && element.hasExistingDoc() && !element.existingDoc().isBlank()) {
                skipped.add(element.qualifiedName());
            } else {
                pending.add(element);
            }
        }
        log.debug("{} elements found, {} to document, {} skipped", elements.size(), pending.size(), skipped.size());

        List<DocstringResult> results = orchestrator.refineAll(pending, settings);
        Map<SourceSpan, DocstringResult> bySpan = new LinkedHashMap<>();
        for (DocstringResult result : results) {
            bySpan.put(result.span(), result);
        }
        String rewritten = injector.inject(source, elements, bySpan, settings.overwrite());
        return new FileOutcome(rewritten, results, skipped, FileUtils.fingerprint(source), !rewritten.equals(source));
    }
}
