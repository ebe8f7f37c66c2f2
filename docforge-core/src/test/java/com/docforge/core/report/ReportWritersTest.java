package com.docforge.core.report;

import com.docforge.core.model.DocstringResult;
import com.docforge.core.model.DocstringStyle;
import com.docforge.core.model.ElementKind;
import com.docforge.core.model.RefinementOutcome;
import com.docforge.core.model.SourceSpan;
import com.docforge.core.pipeline.BatchReport;
import com.docforge.core.pipeline.FileOutcome;
import com.docforge.core.pipeline.FileReport;
import com.docforge.core.report.impl.JsonReportWriter;
import com.docforge.core.report.impl.MarkdownReportWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReportWriters} and the bundled writers.
 */
class ReportWritersTest {

    private static final Path GOOD = Path.of("src/ops.py");
    private static final Path BAD = Path.of("src/broken.py");
    private static final Path EMPTY = Path.of("src/empty.py");

    private final BatchReport report = new BatchReport(List.of(
        FileReport.processed(GOOD, new FileOutcome("rewritten", List.of(
            result("add", 1, 1.0, 1, List.of(), RefinementOutcome.ACCEPTED),
            result("sub", 4, 0.5, 3, List.of("type of 'b' unknown|guessed"), RefinementOutcome.EXHAUSTED)),
            List.of("kept"), "f".repeat(64), true), true),
        FileReport.failed(BAD, "parse error: invalid syntax"),
        FileReport.processed(EMPTY, new FileOutcome("x = 1\n", List.of(), List.of(), "0".repeat(64), false), false)));

    @Test
    void forFormat_knownIds_resolveCaseInsensitively() {
        assertThat(ReportWriters.forFormat("MD")).isInstanceOf(MarkdownReportWriter.class);
        assertThat(ReportWriters.forFormat(" json ")).isInstanceOf(JsonReportWriter.class);
    }

    @Test
    void forFormat_unknownId_throws() {
        assertThatThrownBy(() -> ReportWriters.forFormat("x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown report format: x");
    }

    @Test
    void statistics_summarizeRun() {
        ReportStatistics stats = ReportStatistics.of(report);

        assertThat(stats).isEqualTo(new ReportStatistics(3, 1, 2, 1, 1, 1, 0.75));
    }

    @Test
    void statistics_emptyRun_averageIsZero() {
        assertThat(ReportStatistics.of(new BatchReport(List.of())).averageConfidence()).isZero();
    }

    @Test
    void markdown_rendersSummaryTablesAndFailures() {
        String md = ReportWriters.forFormat("md").render(report);

        assertThat(md)
            .startsWith("# Docstring Report\n\n## Summary\n\n")
            .contains("| Files | 3 |\n")
            .contains("| Failed files | 1 |\n")
            .contains("| Documented elements | 2 |\n")
            .contains("| Accepted | 1 |\n")
            .contains("| Exhausted | 1 |\n")
            .contains("| Skipped (already documented) | 1 |\n")
            .contains("| Average confidence | 0.75 |\n")
            .contains("## `src/ops.py`\n\n")
            .contains("| add | function | 1 | 1.00 | 1 | accepted | - |\n")
            .contains("| sub | function | 4 | 0.50 | 3 | exhausted | type of 'b' unknown\\|guessed |\n")
            .contains("## `src/empty.py`\n\nNo elements documented.\n\n")
            .endsWith("## Failures\n\n- `src/broken.py`: parse error: invalid syntax\n");
        assertThat(md).doesNotContain("## `src/broken.py`");
    }

    @Test
    void json_rendersSameContentWithDocstrings() throws Exception {
        JsonNode root = new ObjectMapper().readTree(ReportWriters.forFormat("json").render(report));

        assertThat(root.path("summary").path("files").asInt()).isEqualTo(3);
        assertThat(root.path("summary").path("averageConfidence").asDouble()).isEqualTo(0.75);

        JsonNode good = root.path("files").get(0);
        assertThat(good.path("path").asText()).isEqualTo("src/ops.py");
        assertThat(good.path("status").asText()).isEqualTo("processed");
        assertThat(good.path("written").asBoolean()).isTrue();
        assertThat(good.path("skipped").get(0).asText()).isEqualTo("kept");
        JsonNode sub = good.path("elements").get(1);
        assertThat(sub.path("name").asText()).isEqualTo("sub");
        assertThat(sub.path("outcome").asText()).isEqualTo("exhausted");
        assertThat(sub.path("style").asText()).isEqualTo("google");
        assertThat(sub.path("warnings").get(0).asText()).isEqualTo("type of 'b' unknown|guessed");
        assertThat(sub.path("docstring").asText()).isEqualTo("\"\"\"Sub.\"\"\"");

        JsonNode bad = root.path("files").get(1);
        assertThat(bad.path("status").asText()).isEqualTo("failed");
        assertThat(bad.path("error").asText()).isEqualTo("parse error: invalid syntax");
        assertThat(bad.has("elements")).isFalse();
    }

    private static DocstringResult result(String name, int line, double confidence, int iterations,
                                          List<String> warnings, RefinementOutcome outcome) {
        String text = "\"\"\"" + Character.toUpperCase(name.charAt(0)) + name.substring(1) + ".\"\"\"";
        return new DocstringResult(name, name, ElementKind.FUNCTION, new SourceSpan(0, 10, line, line + 1),
            text, confidence, DocstringStyle.GOOGLE, iterations, warnings, outcome);
    }
}
