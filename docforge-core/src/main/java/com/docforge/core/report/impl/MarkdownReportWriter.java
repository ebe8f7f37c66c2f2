package com.docforge.core.report.impl;

import com.docforge.core.model.DocstringResult;
import com.docforge.core.pipeline.BatchReport;
import com.docforge.core.pipeline.FileReport;
import com.docforge.core.report.ReportStatistics;
import com.docforge.core.report.ReportWriter;

import java.util.Locale;

/**
 * Markdown run report: summary statistics, one table per file and a failure list.
 */
public class MarkdownReportWriter implements ReportWriter {

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String DASH_VALUE = "-";

    private static final String TITLE = "Docstring Report";
    private static final String SUMMARY = "Summary";
    private static final String FAILURES = "Failures";
    private static final String ELEMENT_TABLE_HEADER =
        "| Element | Kind | Line | Confidence | Iterations | Outcome | Warnings |";
    private static final String ELEMENT_TABLE_SEPARATOR =
        "|---------|------|------|------------|------------|---------|----------|";

    @Override
    public String format() {
        return "md";
    }

    @Override
    public String render(BatchReport report) {
        ReportStatistics stats = ReportStatistics.of(report);
        StringBuilder md = new StringBuilder();
        md.append(H1).append(TITLE).append(DOUBLE_NEWLINE);

        md.append(H2).append(SUMMARY).append(DOUBLE_NEWLINE);
        md.append("| Metric | Value |").append(NEWLINE);
        md.append("|--------|-------|").append(NEWLINE);
        row(md, "Files", String.valueOf(stats.files()));
        row(md, "Failed files", String.valueOf(stats.failedFiles()));
        row(md, "Documented elements", String.valueOf(stats.elements()));
        row(md, "Accepted", String.valueOf(stats.accepted()));
        row(md, "Exhausted", String.valueOf(stats.exhausted()));
        row(md, "Skipped (already documented)", String.valueOf(stats.skipped()));
        row(md, "Average confidence", String.format(Locale.ROOT, "%.2f", stats.averageConfidence()));
        md.append(NEWLINE);

        for (FileReport file : report.files()) {
            if (file.outcome() == null) {
                continue;
            }
            md.append(H2).append('`').append(file.path()).append('`').append(DOUBLE_NEWLINE);
            if (file.outcome().results().isEmpty()) {
                md.append("No elements documented.").append(DOUBLE_NEWLINE);
                continue;
            }
            md.append(ELEMENT_TABLE_HEADER).append(NEWLINE);
            md.append(ELEMENT_TABLE_SEPARATOR).append(NEWLINE);
            for (DocstringResult result : file.outcome().results()) {
                md.append("| ").append(escapeMarkdown(result.qualifiedName()))
                    .append(" | ").append(result.kind().label())
                    .append(" | ").append(result.span().startLine())
                    .append(" | ").append(String.format(Locale.ROOT, "%.2f", result.confidenceScore()))
                    .append(" | ").append(result.iterationsUsed())
                    .append(" | ").append(result.outcome().name().toLowerCase(Locale.ROOT))
                    .append(" | ").append(result.warnings().isEmpty()
                        ? DASH_VALUE : escapeMarkdown(String.join("; ", result.warnings())))
                    .append(" |").append(NEWLINE);
            }
            md.append(NEWLINE);
        }

        if (report.hasFailures()) {
            md.append(H2).append(FAILURES).append(DOUBLE_NEWLINE);
            for (FileReport failure : report.failures()) {
                md.append("- `").append(failure.path()).append("`: ")
                    .append(escapeMarkdown(failure.error() != null ? failure.error() : failure.status().name()))
                    .append(NEWLINE);
            }
        }
        return md.toString();
    }

    private static void row(StringBuilder md, String metric, String value) {
        md.append("| ").append(metric).append(" | ").append(value).append(" |").append(NEWLINE);
    }

    private static String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
