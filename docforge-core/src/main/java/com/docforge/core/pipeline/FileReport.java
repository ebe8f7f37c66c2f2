package com.docforge.core.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Batch entry for one file.
 *
 * @param path input file
 * @param status how processing ended
 * @param outcome pipeline outcome, null unless {@link FileStatus#PROCESSED}
 * @param error failure description, null on success
 * @param written true if the file was rewritten on disk
 */
public record FileReport(Path path, FileStatus status, FileOutcome outcome, String error, boolean written) {

    public FileReport {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (status == FileStatus.PROCESSED && outcome == null) {
            throw new IllegalArgumentException("processed files carry an outcome");
        }
    }

    public static FileReport processed(Path path, FileOutcome outcome, boolean written) {
        return new FileReport(path, FileStatus.PROCESSED, outcome, null, written);
    }

    public static FileReport failed(Path path, String error) {
        return new FileReport(path, FileStatus.FAILED, null, error, false);
    }

    public static FileReport timedOut(Path path, String error) {
        return new FileReport(path, FileStatus.TIMED_OUT, null, error, false);
    }
}
