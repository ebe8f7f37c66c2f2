package com.docforge.core.style.impl;

import com.docforge.core.model.DocstringStyle;
import com.docforge.core.style.AbstractStyleTemplate;
import com.docforge.core.style.DocBlock;

import java.util.List;

/**
 * Google style: labeled sections with indented entries.
 *
 * <pre>
 * """Add two numbers.
 *
 * Args:
 *     a (int): First operand.
 *     b (int): Second operand.
 *
 * Returns:
 *     int: The sum.
 * """
 * </pre>
 */
public class GoogleStyleTemplate extends AbstractStyleTemplate {

    private static final String INDENT = "    ";

    @Override
    public DocstringStyle style() {
        return DocstringStyle.GOOGLE;
    }

    @Override
    protected String parametersHeader() {
        return "Args:";
    }

    @Override
    protected String returnsHeader() {
        return "Returns:";
    }

    @Override
    protected String yieldsHeader() {
        return "Yields:";
    }

    @Override
    protected String raisesHeader() {
        return "Raises:";
    }

    @Override
    protected boolean isHeaderAt(List<String> lines, int index, String header) {
        return lines.get(index).equals(header);
    }

    @Override
    protected String renderParameters(List<DocBlock.Field> parameters) {
        StringBuilder section = new StringBuilder(parametersHeader());
        for (DocBlock.Field parameter : parameters) {
            section.append('\n').append(INDENT).append(parameter.name());
            if (parameter.type() != null) {
                section.append(" (").append(parameter.type()).append(')');
            }
            section.append(": ").append(parameter.description());
        }
        return section.toString();
    }

    @Override
    protected String renderReturns(DocBlock.Field returns, boolean generator) {
        StringBuilder section = new StringBuilder(generator ? yieldsHeader() : returnsHeader());
        section.append('\n').append(INDENT);
        if (returns.type() != null) {
            section.append(returns.type()).append(": ");
        }
        return section.append(returns.description()).toString();
    }

    @Override
    protected String renderRaises(List<DocBlock.Field> raises) {
        StringBuilder section = new StringBuilder(raisesHeader());
        for (DocBlock.Field raised : raises) {
            section.append('\n').append(INDENT).append(raised.name()).append(": ").append(raised.description());
        }
        return section.toString();
    }
}
