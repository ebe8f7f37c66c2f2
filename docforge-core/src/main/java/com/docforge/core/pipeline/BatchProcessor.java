package com.docforge.core.pipeline;

import com.docforge.core.config.PipelineSettings;
import com.docforge.core.parser.SourceParseException;
import com.docforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the pipeline over many files on a fixed worker pool.
 *
 * <p>Files are independent: each task reads its own text and produces its own outcome. A
 * file's timeout starts when a worker picks it up; on expiry the task is cancelled and the
 * file reported as timed out. Files are written back from the calling thread and only after
 * their pipeline completed, so a failed or cancelled file is never partially rewritten.
 * Reports follow input order whatever the pool size.
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final DocumentationPipeline pipeline;
    private final PipelineSettings settings;
    private final int workers;
    private final Duration fileTimeout;
    private final boolean writeBack;

    /**
     * @param pipeline per-file pipeline
     * @param settings run configuration
     * @param workers files processed in parallel, at least 1
     * @param fileTimeout time allowed per file once started
     * @param writeBack rewrite changed files in place
     */
    public BatchProcessor(DocumentationPipeline pipeline, PipelineSettings settings, int workers,
                          Duration fileTimeout, boolean writeBack) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        if (fileTimeout.isNegative() || fileTimeout.isZero()) {
            throw new IllegalArgumentException("fileTimeout must be positive: " + fileTimeout);
        }
        this.pipeline = pipeline;
        this.settings = settings;
        this.workers = workers;
        this.fileTimeout = fileTimeout;
        this.writeBack = writeBack;
    }

    public BatchReport run(List<Path> files) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(workers, files.size())));
        try {
            List<Task> tasks = new ArrayList<>(files.size());
            for (Path file : files) {
                AtomicLong startedAt = new AtomicLong();
                CountDownLatch started = new CountDownLatch(1);
                Future<FileOutcome> future = pool.submit(() -> {
                    startedAt.set(System.nanoTime());
                    started.countDown();
                    return process(file);
                });
                tasks.add(new Task(file, future, startedAt, started));
            }
            List<FileReport> reports = new ArrayList<>(tasks.size());
            for (Task task : tasks) {
                reports.add(complete(task));
            }
            BatchReport report = new BatchReport(reports);
            log.info("Processed {} files, {} failed", reports.size(), report.failures().size());
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    private FileOutcome process(Path file) {
        try {
            log.debug("Processing {}", file);
            return pipeline.process(FileUtils.readString(file), settings);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private FileReport complete(Task task) {
        FileOutcome outcome;
        try {
            outcome = await(task);
        } catch (TimeoutException e) {
            task.future().cancel(true);
            log.error("Timed out after {}s: {}", fileTimeout.toSeconds(), task.file());
            return FileReport.timedOut(task.file(), "timed out after " + fileTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.future().cancel(true);
            return FileReport.failed(task.file(), "interrupted");
        } catch (CancellationException e) {
            return FileReport.failed(task.file(), "cancelled");
        } catch (ExecutionException e) {
            String error = describe(e.getCause());
            log.error("Failed to process {}: {}", task.file(), error);
            return FileReport.failed(task.file(), error);
        }

        boolean written = false;
        if (writeBack && outcome.changed()) {
            try {
                FileUtils.writeAtomically(task.file(), outcome.rewrittenText());
                written = true;
            } catch (IOException e) {
                log.error("Failed to write {}: {}", task.file(), e.getMessage());
                return FileReport.failed(task.file(), "write failed: " + e.getMessage());
            }
        }
        log.info("{}: {} documented, {} skipped{}", task.file(), outcome.results().size(),
            outcome.skipped().size(), written ? ", written" : "");
        return FileReport.processed(task.file(), outcome, written);
    }

    private FileOutcome await(Task task) throws TimeoutException, InterruptedException, ExecutionException {
        task.started().await();
        long remaining = task.startedAt().get() + fileTimeout.toNanos() - System.nanoTime();
        return task.future().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
    }

    private static String describe(Throwable cause) {
        if (cause instanceof SourceParseException parse) {
            return "parse error: " + parse.getMessage();
        }
        if (cause instanceof UncheckedIOException io) {
            return "I/O error: " + io.getCause().getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private record Task(Path file, Future<FileOutcome> future, AtomicLong startedAt, CountDownLatch started) {
    }
}
