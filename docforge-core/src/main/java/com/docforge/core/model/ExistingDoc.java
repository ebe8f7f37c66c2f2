package com.docforge.core.model;

import java.util.Objects;

/**
 * A documentation block already present in the source.
 *
 * @param rawText exact literal text including prefix and quotes
 * @param content cleaned docstring value (quotes stripped, common indentation removed)
 * @param span exact span of the literal, used for in-place replacement
 */
public record ExistingDoc(String rawText, String content, SourceSpan span) {

    public ExistingDoc {
        Objects.requireNonNull(rawText, "rawText must not be null");
        Objects.requireNonNull(span, "span must not be null");
        content = content != null ? content : "";
    }

    public boolean isBlank() {
        return content.isBlank();
    }
}
