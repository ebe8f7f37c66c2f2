package com.docforge.cli;

import com.docforge.DocForgeCLI;
import com.docforge.core.config.CapabilityFactory;
import com.docforge.core.config.PipelineSettings;
import com.docforge.core.config.ProjectConfig;
import com.docforge.core.pipeline.BatchProcessor;
import com.docforge.core.pipeline.BatchReport;
import com.docforge.core.pipeline.DocumentationPipeline;
import com.docforge.core.pipeline.FileReport;
import com.docforge.core.report.ReportStatistics;
import com.docforge.core.report.ReportWriter;
import com.docforge.core.report.ReportWriters;
import com.docforge.core.util.FileUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to document every Python file under a directory.
 *
 * <p>Files are processed on a worker pool; a file that fails to parse, fails to read or
 * exceeds its timeout is reported and left untouched while the others continue. The exit
 * code is 1 if any file failed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docforge batch src --workers 4 --timeout-sec 120
 * docforge batch src --no-recursive --dry-run --report json --report-file report.json
 * }</pre>
 */
@Command(
    name = "batch",
    description = "Generate docstrings for all Python files in a directory",
    mixinStandardHelpOptions = true
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @ParentCommand
    private DocForgeCLI parent;

    @Parameters(index = "0", description = "Directory to process (default: current directory)", defaultValue = ".")
    private Path directory;

    @Option(names = "--recursive", negatable = true, defaultValue = "true", fallbackValue = "true",
        description = "Include subdirectories (default: true)")
    private boolean recursive;

    @Option(names = {"-w", "--workers"}, description = "Files processed in parallel (default: from config, else 1)")
    private Integer workers;

    @Option(names = "--timeout-sec", description = "Per-file timeout in seconds (default: from config, else 300)")
    private Integer timeoutSeconds;

    @Option(names = "--report", description = "Report format: md or json")
    private String reportFormat;

    @Option(names = "--report-file", description = "Write the report here instead of standard output")
    private Path reportFile;

    @Option(names = "--dry-run", description = "Process files without writing them back")
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
        if (!Files.isDirectory(directory)) {
            System.err.println("✗ Not a directory: " + directory);
            return 2;
        }

        BatchProcessor processor;
        ReportWriter writer = null;
        try {
            ProjectConfig config = pipelineOptions.loadConfig(System.getenv());
            PipelineSettings settings = pipelineOptions.settings(config);
            CapabilityFactory.Capabilities capabilities =
                CapabilityFactory.create(llmOptions.apply(config.llm()), System.getenv());
            int poolSize = workers != null ? workers : config.effectiveWorkers();
            int timeout = timeoutSeconds != null ? timeoutSeconds : config.effectiveFileTimeoutSeconds();
            processor = new BatchProcessor(
                DocumentationPipeline.create(capabilities.generator(), capabilities.critic()),
                settings, poolSize, Duration.ofSeconds(timeout), !dryRun);
            if (reportFormat != null || reportFile != null) {
                writer = ReportWriters.forFormat(reportFormat != null ? reportFormat : "md");
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return 2;
        }

        try {
            List<Path> files = FileUtils.findFiles(directory, FileUtils.PYTHON_GLOB, recursive);
            log.info("Found {} Python files under {}", files.size(), directory.toAbsolutePath());
            System.out.println("Processing " + files.size() + " files in " + directory.toAbsolutePath());
            if (dryRun) {
                System.out.println("Running in dry-run mode (no files will be written)");
            }

            BatchReport report = processor.run(files);
            printSummary(report);

            if (writer != null) {
                String rendered = writer.render(report);
                if (reportFile != null) {
                    Files.writeString(reportFile, rendered, StandardCharsets.UTF_8);
                    System.out.println("✓ Report written to " + reportFile);
                } else {
                    System.out.println(rendered);
                }
            }
            return report.hasFailures() ? 1 : 0;
        } catch (IOException e) {
            log.error("Batch run failed", e);
            System.err.println("✗ Batch failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printSummary(BatchReport report) {
        for (FileReport file : report.failures()) {
            System.err.println("✗ " + file.path() + ": " + file.error());
        }
        ReportStatistics stats = ReportStatistics.of(report);
        System.out.printf(Locale.ROOT,
            "✓ %d files, %d failed, %d elements documented (%d accepted, %d exhausted, %d skipped), "
                + "average confidence %.2f%n",
            stats.files(), stats.failedFiles(), stats.elements(), stats.accepted(), stats.exhausted(),
            stats.skipped(), stats.averageConfidence());
    }
}
