package com.docforge.core.style.impl;

import com.docforge.core.model.DocstringStyle;
import com.docforge.core.style.AbstractStyleTemplate;
import com.docforge.core.style.DocBlock;

import java.util.List;

/**
 * reStructuredText style: Sphinx field directives.
 *
 * <pre>
 * """Add two numbers.
 *
 * :param a: First operand.
 * :type a: int
 * :returns: The sum.
 * :rtype: int
 * """
 * </pre>
 */
public class RstStyleTemplate extends AbstractStyleTemplate {

    @Override
    public DocstringStyle style() {
        return DocstringStyle.RST;
    }

    @Override
    protected String parametersHeader() {
        return ":param";
    }

    @Override
    protected String returnsHeader() {
        return ":returns:";
    }

    @Override
    protected String yieldsHeader() {
        return ":yields:";
    }

    @Override
    protected String raisesHeader() {
        return ":raises";
    }

    @Override
    protected boolean isHeaderAt(List<String> lines, int index, String header) {
        String line = lines.get(index);
        if (header.equals(returnsHeader())) {
            return line.startsWith(":returns:") || line.startsWith(":return:");
        }
        return line.startsWith(header);
    }

    @Override
    protected String renderParameters(List<DocBlock.Field> parameters) {
        StringBuilder section = new StringBuilder();
        for (DocBlock.Field parameter : parameters) {
            if (section.length() > 0) {
                section.append('\n');
            }
            section.append(":param ").append(parameter.name()).append(": ").append(parameter.description());
            if (parameter.type() != null) {
                section.append("\n:type ").append(parameter.name()).append(": ").append(parameter.type());
            }
        }
        return section.toString();
    }

    @Override
    protected String renderReturns(DocBlock.Field returns, boolean generator) {
        StringBuilder section = new StringBuilder(generator ? yieldsHeader() : returnsHeader())
            .append(' ').append(returns.description());
        if (returns.type() != null) {
            section.append("\n:rtype: ").append(returns.type());
        }
        return section.toString();
    }

    @Override
    protected String renderRaises(List<DocBlock.Field> raises) {
        StringBuilder section = new StringBuilder();
        for (DocBlock.Field raised : raises) {
            if (section.length() > 0) {
                section.append('\n');
            }
            section.append(":raises ").append(raised.name()).append(": ").append(raised.description());
        }
        return section.toString();
    }
}
