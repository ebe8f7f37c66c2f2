package com.docforge.core.pipeline;

import com.docforge.core.model.DocstringResult;

import java.util.List;

/**
 * Reports for every file of a batch run, in input order.
 *
 * @param files per-file reports
 */
public record BatchReport(List<FileReport> files) {

    public BatchReport {
        files = files != null ? List.copyOf(files) : List.of();
    }

    /**
     * Returns true if any file failed or timed out. Exhausted elements do not count.
     *
     * @return true on any file-level failure
     */
    public boolean hasFailures() {
        return files.stream().anyMatch(file -> file.status().isFailure());
    }

    public List<FileReport> failures() {
        return files.stream().filter(file -> file.status().isFailure()).toList();
    }

    public List<DocstringResult> results() {
        return files.stream()
            .filter(file -> file.outcome() != null)
            .flatMap(file -> file.outcome().results().stream())
            .toList();
    }
}
