package com.docforge.core.style;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.DocstringStyle;

import java.util.List;

/**
 * Renders and recognizes documentation blocks in one fixed style.
 *
 * <p>Each template is a stable layout: a summary line, then a parameters section, a returns
 * (or yields) section when applicable and a raises section when applicable. Rendered text is
 * a complete, unindented block including its {@code """} delimiters; indentation is applied
 * when the block is written into the source.
 *
 * @see StyleTemplates
 */
public interface StyleTemplate {

    DocstringStyle style();

    /**
     * Renders a block.
     *
     * @param block content
     * @return delimited block text with {@code \n} line breaks
     */
    String render(DocBlock block);

    /**
     * Section headers a complete block for {@code element} must contain.
     *
     * @param element documented element
     * @return headers in section order, empty for summary-only blocks
     */
    List<String> requiredHeaders(CodeElement element);

    /**
     * Returns true if {@code text} contains the given section header in this style's layout.
     *
     * @param text candidate block
     * @param header header as returned by {@link #requiredHeaders(CodeElement)}
     * @return true if present
     */
    boolean hasHeader(String text, String header);

    /**
     * Returns true if {@code text} has a returns or yields section.
     *
     * @param text candidate block
     * @return true if a return section is present
     */
    boolean hasReturnsSection(String text);
}
