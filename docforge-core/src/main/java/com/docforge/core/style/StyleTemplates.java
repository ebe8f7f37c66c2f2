package com.docforge.core.style;

import com.docforge.core.model.DocstringStyle;
import com.docforge.core.style.impl.GoogleStyleTemplate;
import com.docforge.core.style.impl.NumpyStyleTemplate;
import com.docforge.core.style.impl.RstStyleTemplate;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of the built-in templates, one per {@link DocstringStyle}.
 */
public final class StyleTemplates {

    private static final Map<DocstringStyle, StyleTemplate> TEMPLATES = new EnumMap<>(DocstringStyle.class);

    static {
        register(new GoogleStyleTemplate());
        register(new NumpyStyleTemplate());
        register(new RstStyleTemplate());
    }

    private StyleTemplates() {
        // Utility class - no instantiation
    }

    private static void register(StyleTemplate template) {
        TEMPLATES.put(template.style(), template);
    }

    public static StyleTemplate forStyle(DocstringStyle style) {
        StyleTemplate template = TEMPLATES.get(style);
        if (template == null) {
            throw new IllegalArgumentException("No template for style: " + style);
        }
        return template;
    }
}
