package com.docforge.core.report;

import com.docforge.core.report.impl.JsonReportWriter;
import com.docforge.core.report.impl.MarkdownReportWriter;

import java.util.List;
import java.util.Locale;

/**
 * Lookup of report writers by format id.
 */
public final class ReportWriters {

    private static final List<ReportWriter> WRITERS = List.of(new MarkdownReportWriter(), new JsonReportWriter());

    private ReportWriters() {
        // Utility class - no instantiation
    }

    /**
     * Returns the writer for {@code md} or {@code json}.
     *
     * @param format format id, case-insensitive
     * @return writer
     * @throws IllegalArgumentException for unknown formats
     */
    public static ReportWriter forFormat(String format) {
        String normalized = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        return WRITERS.stream()
            .filter(writer -> writer.format().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown report format: " + format));
    }
}
