package com.docforge.core.style.impl;

import com.docforge.core.model.DocstringStyle;
import com.docforge.core.style.AbstractStyleTemplate;
import com.docforge.core.style.DocBlock;

import java.util.List;

/**
 * NumPy style: headers underlined with dashes, entries as {@code name : type} followed by an
 * indented description.
 *
 * <pre>
 * """Add two numbers.
 *
 * Parameters
 * ----------
 * a : int
 *     First operand.
 *
 * Returns
 * -------
 * int
 *     The sum.
 * """
 * </pre>
 */
public class NumpyStyleTemplate extends AbstractStyleTemplate {

    private static final String INDENT = "    ";

    @Override
    public DocstringStyle style() {
        return DocstringStyle.NUMPY;
    }

    @Override
    protected String parametersHeader() {
        return "Parameters";
    }

    @Override
    protected String returnsHeader() {
        return "Returns";
    }

    @Override
    protected String yieldsHeader() {
        return "Yields";
    }

    @Override
    protected String raisesHeader() {
        return "Raises";
    }

    @Override
    protected boolean isHeaderAt(List<String> lines, int index, String header) {
        return lines.get(index).equals(header)
            && index + 1 < lines.size()
            && lines.get(index + 1).matches("-{3,}");
    }

    @Override
    protected String renderParameters(List<DocBlock.Field> parameters) {
        StringBuilder section = header(parametersHeader());
        for (DocBlock.Field parameter : parameters) {
            section.append('\n').append(parameter.name());
            if (parameter.type() != null) {
                section.append(" : ").append(parameter.type());
            }
            section.append('\n').append(INDENT).append(parameter.description());
        }
        return section.toString();
    }

    @Override
    protected String renderReturns(DocBlock.Field returns, boolean generator) {
        StringBuilder section = header(generator ? yieldsHeader() : returnsHeader());
        section.append('\n').append(returns.type() != null ? returns.type() : "object");
        return section.append('\n').append(INDENT).append(returns.description()).toString();
    }

    @Override
    protected String renderRaises(List<DocBlock.Field> raises) {
        StringBuilder section = header(raisesHeader());
        for (DocBlock.Field raised : raises) {
            section.append('\n').append(raised.name())
                .append('\n').append(INDENT).append(raised.description());
        }
        return section.toString();
    }

    private static StringBuilder header(String title) {
        return new StringBuilder(title).append('\n').append("-".repeat(title.length()));
    }
}
