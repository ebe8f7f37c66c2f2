package com.docforge.core.report.impl;

import com.docforge.core.model.DocstringResult;
import com.docforge.core.pipeline.BatchReport;
import com.docforge.core.pipeline.FileReport;
import com.docforge.core.report.ReportStatistics;
import com.docforge.core.report.ReportWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

/**
 * JSON run report with the same content as the Markdown one, plus the generated text.
 */
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String render(BatchReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        ReportStatistics stats = ReportStatistics.of(report);
        ObjectNode summary = root.putObject("summary");
        summary.put("files", stats.files());
        summary.put("failedFiles", stats.failedFiles());
        summary.put("elements", stats.elements());
        summary.put("accepted", stats.accepted());
        summary.put("exhausted", stats.exhausted());
        summary.put("skipped", stats.skipped());
        summary.put("averageConfidence", stats.averageConfidence());

        ArrayNode files = root.putArray("files");
        for (FileReport file : report.files()) {
            ObjectNode fileNode = files.addObject();
            fileNode.put("path", file.path().toString());
            fileNode.put("status", file.status().name().toLowerCase(Locale.ROOT));
            fileNode.put("written", file.written());
            if (file.error() != null) {
                fileNode.put("error", file.error());
            }
            if (file.outcome() == null) {
                continue;
            }
            fileNode.put("fingerprint", file.outcome().fingerprint());
            ArrayNode skipped = fileNode.putArray("skipped");
            file.outcome().skipped().forEach(skipped::add);
            ArrayNode elements = fileNode.putArray("elements");
            for (DocstringResult result : file.outcome().results()) {
                ObjectNode element = elements.addObject();
                element.put("name", result.qualifiedName());
                element.put("kind", result.kind().label());
                element.put("line", result.span().startLine());
                element.put("confidence", result.confidenceScore());
                element.put("iterations", result.iterationsUsed());
                element.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
                element.put("style", result.style().id());
                ArrayNode warnings = element.putArray("warnings");
                result.warnings().forEach(warnings::add);
                element.put("docstring", result.text());
            }
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
