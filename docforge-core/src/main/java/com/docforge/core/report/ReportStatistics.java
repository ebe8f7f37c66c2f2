package com.docforge.core.report;

import com.docforge.core.model.DocstringResult;
import com.docforge.core.pipeline.BatchReport;

import java.util.List;

/**
 * Summary figures shared by all report formats.
 *
 * @param files files in the run
 * @param failedFiles files that failed or timed out
 * @param elements documented elements
 * @param accepted elements accepted at or above the threshold
 * @param exhausted elements that used every iteration
 * @param skipped elements left alone because they were already documented
 * @param averageConfidence mean confidence over documented elements, 0 if none
 */
public record ReportStatistics(
    int files,
    int failedFiles,
    int elements,
    int accepted,
    int exhausted,
    int skipped,
    double averageConfidence
) {
    public static ReportStatistics of(BatchReport report) {
        List<DocstringResult> results = report.results();
        int accepted = (int) results.stream().filter(DocstringResult::accepted).count();
        int skipped = report.files().stream()
            .filter(file -> file.outcome() != null)
            .mapToInt(file -> file.outcome().skipped().size())
            .sum();
        double average = results.stream().mapToDouble(DocstringResult::confidenceScore).average().orElse(0.0);
        return new ReportStatistics(report.files().size(), report.failures().size(), results.size(),
            accepted, results.size() - accepted, skipped, average);
    }
}
