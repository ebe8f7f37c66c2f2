package com.docforge.core.report;

import com.docforge.core.pipeline.BatchReport;

/**
 * Renders the outcome of a run for people or machines.
 *
 * <p>Consumes the finished {@link BatchReport}; it takes no part in the pipeline itself.
 */
public interface ReportWriter {

    /**
     * Identifier used on the command line, e.g. {@code md}.
     *
     * @return format id
     */
    String format();

    String render(BatchReport report);
}
