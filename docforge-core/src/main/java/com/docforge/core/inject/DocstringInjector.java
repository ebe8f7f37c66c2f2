package com.docforge.core.inject;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.DocstringResult;
import com.docforge.core.model.InsertionPoint;
import com.docforge.core.model.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Writes documentation blocks back into source text.
 *
 * <p>An element with an existing block has that block's exact span replaced; any other
 * element gets a new block right after its header line, indented like its body. Edits are
 * applied in descending order of element start offset so that no edit shifts a span that is
 * still to be processed, and text outside the edited regions is kept byte for byte.
 *
 * <p>With {@code overwrite} off, elements whose existing block has content are left alone
 * whether or not a result was supplied for them.
 */
public class DocstringInjector {

    private static final Logger log = LoggerFactory.getLogger(DocstringInjector.class);

    /**
     * Produces the rewritten source.
     *
     * @param source original text
     * @param elements elements extracted from {@code source}
     * @param results blocks to write, keyed by element span
     * @param overwrite replace non-empty existing blocks
     * @return rewritten text; {@code source} itself when nothing applies
     */
    public String inject(String source, List<CodeElement> elements, Map<SourceSpan, DocstringResult> results,
                         boolean overwrite) {
        if (results.isEmpty()) {
            return source;
        }
        List<CodeElement> ordered = new ArrayList<>(elements);
        ordered.sort(Comparator.comparingInt((CodeElement e) -> e.sourceSpan().startOffset()).reversed());

        StringBuilder text = new StringBuilder(source);
        for (CodeElement element : ordered) {
            DocstringResult result = results.get(element.sourceSpan());
            if (result == null) {
                continue;
            }
            if (element.hasExistingDoc() && !element.existingDoc().isBlank() && !overwrite) {
                log.debug("Keeping existing docstring of {}", element.qualifiedName());
                continue;
            }
            if (element.hasExistingDoc()) {
                replace(text, element, result.text());
            } else {
                insert(text, element.insertionPoint(), result.text());
            }
        }
        return text.toString();
    }

    private static void replace(StringBuilder text, CodeElement element, String block) {
        SourceSpan span = element.existingDoc().span();
        String eol = lineEnding(text, span.startOffset());
        String replacement = indentContinuation(block, element.insertionPoint().indent(), eol);
        text.replace(span.startOffset(), span.endOffset(), replacement);
    }

    private static void insert(StringBuilder text, InsertionPoint point, String block) {
        String eol = lineEnding(text, point.offset());
        String indented = point.indent() + indentContinuation(block, point.indent(), eol);
        if (point.inlineBody()) {
            int bodyStart = point.offset();
            while (bodyStart < text.length() && (text.charAt(bodyStart) == ' ' || text.charAt(bodyStart) == '\t')) {
                bodyStart++;
            }
            text.replace(point.offset(), bodyStart, eol + indented + eol + point.indent());
        } else {
            text.insert(point.offset(), indented + eol);
        }
    }

    /**
     * Prefixes every line but the first with {@code indent}; blank lines stay empty.
     */
    static String indentContinuation(String block, String indent, String eol) {
        String[] lines = block.split("\r\n|\r|\n", -1);
        StringBuilder out = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            out.append(eol);
            if (!lines[i].isEmpty()) {
                out.append(indent).append(lines[i]);
            }
        }
        return out.toString();
    }

    /**
     * Line break used around {@code offset}: the next one after it, else the last one before
     * it, else {@code \n}.
     */
    static String lineEnding(CharSequence text, int offset) {
        for (int i = offset; i < text.length(); i++) {
            String found = lineEndingAt(text, i);
            if (found != null) {
                return found;
            }
        }
        for (int i = Math.min(offset, text.length()) - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '\n') {
                return i > 0 && text.charAt(i - 1) == '\r' ? "\r\n" : "\n";
            }
            if (c == '\r') {
                return "\r";
            }
        }
        return "\n";
    }

    private static String lineEndingAt(CharSequence text, int i) {
        char c = text.charAt(i);
        if (c == '\r') {
            return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : "\r";
        }
        return c == '\n' ? "\n" : null;
    }
}
