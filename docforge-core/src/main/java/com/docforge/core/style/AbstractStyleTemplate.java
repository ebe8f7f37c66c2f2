package com.docforge.core.style;

import com.docforge.core.model.CodeElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for templates built from a summary followed by blank-line separated sections.
 *
 * <p>Subclasses render sections and name their headers; delimiting, the one-line form and
 * line-based header lookup live here.
 */
public abstract class AbstractStyleTemplate implements StyleTemplate {

    @Override
    public String render(DocBlock block) {
        String summary = DocstringFormat.escape(block.summary());
        if (block.isSummaryOnly()) {
            return DocstringFormat.DELIMITER + summary + DocstringFormat.DELIMITER;
        }
        List<String> sections = new ArrayList<>();
        if (!block.parameters().isEmpty()) {
            sections.add(renderParameters(block.parameters()));
        }
        if (block.returns() != null) {
            sections.add(renderReturns(block.returns(), block.generator()));
        }
        if (!block.raises().isEmpty()) {
            sections.add(renderRaises(block.raises()));
        }
        return DocstringFormat.DELIMITER + summary + "\n\n"
            + DocstringFormat.escape(String.join("\n\n", sections)) + "\n" + DocstringFormat.DELIMITER;
    }

    @Override
    public List<String> requiredHeaders(CodeElement element) {
        List<String> headers = new ArrayList<>();
        if (!element.documentedParameters().isEmpty()) {
            headers.add(parametersHeader());
        }
        if (element.returns() != null) {
            headers.add(element.returns().isGenerator() ? yieldsHeader() : returnsHeader());
        }
        if (!element.raises().isEmpty()) {
            headers.add(raisesHeader());
        }
        return headers;
    }

    @Override
    public boolean hasReturnsSection(String text) {
        return hasHeader(text, returnsHeader()) || hasHeader(text, yieldsHeader());
    }

    @Override
    public boolean hasHeader(String text, String header) {
        List<String> lines = lines(text);
        for (int i = 0; i < lines.size(); i++) {
            if (isHeaderAt(lines, i, header)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the header starts at line {@code index}.
     *
     * @param lines stripped lines of the block body
     * @param index line index
     * @param header header text
     * @return true if matched
     */
    protected abstract boolean isHeaderAt(List<String> lines, int index, String header);

    protected abstract String parametersHeader();

    protected abstract String returnsHeader();

    protected abstract String yieldsHeader();

    protected abstract String raisesHeader();

    protected abstract String renderParameters(List<DocBlock.Field> parameters);

    protected abstract String renderReturns(DocBlock.Field returns, boolean generator);

    protected abstract String renderRaises(List<DocBlock.Field> raises);

    protected static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : DocstringFormat.body(text).split("\r\n|\r|\n", -1)) {
            lines.add(line.strip());
        }
        return lines;
    }
}
