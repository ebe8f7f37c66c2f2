package com.docforge.core.style;

import java.util.List;
import java.util.Objects;

/**
 * Style-independent content of a documentation block.
 *
 * @param summary one-line summary, ending with a period
 * @param parameters documented parameters in declaration order
 * @param returns return entry (name unused), or null when nothing is returned
 * @param generator true if {@code returns} describes yielded values
 * @param raises raised exception kinds, one entry each
 */
public record DocBlock(
    String summary,
    List<Field> parameters,
    Field returns,
    boolean generator,
    List<Field> raises
) {
    public DocBlock {
        Objects.requireNonNull(summary, "summary must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        raises = raises != null ? List.copyOf(raises) : List.of();
    }

    /**
     * One entry of a section.
     *
     * @param name parameter name or exception kind; null for return entries
     * @param type type text, or null
     * @param description prose
     */
    public record Field(String name, String type, String description) {
        public Field {
            Objects.requireNonNull(description, "description must not be null");
        }
    }

    /**
     * Returns true if the block has no sections and renders as a single line.
     *
     * @return true for summary-only blocks
     */
    public boolean isSummaryOnly() {
        return parameters.isEmpty() && returns == null && raises.isEmpty();
    }
}
