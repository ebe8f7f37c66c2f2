package com.docforge.core.pipeline;

import com.docforge.core.model.DocstringResult;

import java.util.List;
import java.util.Objects;

/**
 * Result of running the pipeline over one text.
 *
 * @param rewrittenText text with documentation blocks written in
 * @param results one result per refined element, in source order
 * @param skipped qualified names of elements left alone because they already had a block
 * @param fingerprint SHA-256 hex of the input text
 * @param changed true if {@code rewrittenText} differs from the input
 */
public record FileOutcome(
    String rewrittenText,
    List<DocstringResult> results,
    List<String> skipped,
    String fingerprint,
    boolean changed
) {
    public FileOutcome {
        Objects.requireNonNull(rewrittenText, "rewrittenText must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        results = results != null ? List.copyOf(results) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }
}
