package com.docforge.cli;

import com.docforge.DocForgeCLI;
import com.docforge.core.config.CapabilityFactory;
import com.docforge.core.config.PipelineSettings;
import com.docforge.core.config.ProjectConfig;
import com.docforge.core.model.DocstringResult;
import com.docforge.core.parser.SourceParseException;
import com.docforge.core.pipeline.DocumentationPipeline;
import com.docforge.core.pipeline.FileOutcome;
import com.docforge.core.util.FileUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to document a single Python file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Rewrite in place
 * docforge generate module.py
 *
 * # NumPy style into a new file, replacing existing docstrings
 * docforge generate module.py --style numpy --overwrite -o documented.py
 *
 * # Show what would change
 * docforge generate module.py --diff --dry-run
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate docstrings for a Python file",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @ParentCommand
    private DocForgeCLI parent;

    @Parameters(index = "0", description = "Python source file")
    private Path file;

    @Option(names = {"-o", "--output"}, description = "Write the result here instead of in place")
    private Path output;

    @Option(names = "--diff", description = "Print a unified diff of the changes")
    private boolean diff;

    @Option(names = "--dry-run", description = "Do not write any file")
    private boolean dryRun;

    @Mixin
    private PipelineOptions pipelineOptions;

    @Mixin
    private LlmOptions llmOptions;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        if (!Files.isRegularFile(file)) {
            System.err.println("✗ Not a file: " + file);
            return 2;
        }
        if (!"py".equals(FileUtils.getExtension(file))) {
            log.warn("{} does not have a .py extension, parsing it as Python anyway", file);
        }

        DocumentationPipeline pipeline;
        PipelineSettings settings;
        try {
            ProjectConfig config = pipelineOptions.loadConfig(System.getenv());
            settings = pipelineOptions.settings(config);
            CapabilityFactory.Capabilities capabilities =
                CapabilityFactory.create(llmOptions.apply(config.llm()), System.getenv());
            pipeline = DocumentationPipeline.create(capabilities.generator(), capabilities.critic());
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return 2;
        }

        try {
            log.info("Generating {} docstrings for {}", settings.style().id(), file);
            String source = FileUtils.readString(file);
            FileOutcome outcome = pipeline.process(source, settings);
            printResults(outcome);

            if (diff) {
                String patch = UnifiedDiff.diff(file.getFileName().toString(), source, outcome.rewrittenText());
                System.out.print(patch.isEmpty() ? "No changes\n" : patch);
            }
            if (dryRun) {
                System.out.println("Dry-run mode: no files written");
                return 0;
            }
            Path target = output != null ? output : file;
            if (output != null || outcome.changed()) {
                FileUtils.writeAtomically(target, outcome.rewrittenText());
                System.out.println("✓ Wrote " + target);
            } else {
                System.out.println("✓ No changes to " + file);
            }
            return 0;
        } catch (SourceParseException e) {
            log.error("Cannot parse {}: {}", file, e.getMessage());
            System.err.println("✗ Parse error in " + file + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O failure on {}", file, e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }

    private static void printResults(FileOutcome outcome) {
        for (DocstringResult result : outcome.results()) {
            String mark = result.accepted() ? "✓" : "⚠";
            System.out.printf(Locale.ROOT, "%s %s (%s, confidence %.2f, %d iteration%s)%n",
                mark, result.qualifiedName(), result.kind().label(), result.confidenceScore(),
                result.iterationsUsed(), result.iterationsUsed() == 1 ? "" : "s");
            for (String warning : result.warnings()) {
                System.out.println("    " + warning);
            }
        }
        for (String skipped : outcome.skipped()) {
            System.out.println("- " + skipped + " (already documented, skipped)");
        }
    }
}
