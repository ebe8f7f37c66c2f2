package com.docforge.core.model;

import java.util.Locale;

/**
 * The three supported documentation block styles.
 */
public enum DocstringStyle {
    /** Labeled sections ({@code Args:}, {@code Returns:}). */
    GOOGLE("google"),
    /** Underlined sections ({@code Parameters} / {@code ----------}). */
    NUMPY("numpy"),
    /** Directive-prefixed fields ({@code :param x:}). */
    RST("rst");

    private final String id;

    DocstringStyle(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a style from its identifier, case-insensitively.
     *
     * @param id style id ("google", "numpy", "rst")
     * @return matching style
     * @throws IllegalArgumentException if the id is unknown
     */
    public static DocstringStyle fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (DocstringStyle style : values()) {
                if (style.id.equals(normalized)) {
                    return style;
                }
            }
        }
        throw new IllegalArgumentException("Unknown docstring style: " + id);
    }
}
