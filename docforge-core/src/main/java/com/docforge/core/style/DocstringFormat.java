package com.docforge.core.style;

import java.util.regex.Pattern;

/**
 * Structural checks shared by all styles.
 */
public final class DocstringFormat {

    public static final String DELIMITER = "\"\"\"";

    private DocstringFormat() {
        // Utility class - no instantiation
    }

    /**
     * Returns true if {@code text} is one {@code """}-delimited block with no stray
     * delimiter inside, so that it can be embedded as a single string literal.
     *
     * @param text candidate block
     * @return true if embeddable
     */
    public static boolean isDelimited(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.strip();
        if (trimmed.length() < 2 * DELIMITER.length()
            || !trimmed.startsWith(DELIMITER) || !trimmed.endsWith(DELIMITER)) {
            return false;
        }
        String inner = body(trimmed);
        return !inner.contains(DELIMITER) && !inner.endsWith("\"") && !endsWithOddBackslashes(inner);
    }

    /**
     * Text between the delimiters, or the whole text if it is not delimited.
     *
     * @param text block
     * @return inner text
     */
    public static String body(String text) {
        String trimmed = text.strip();
        if (trimmed.length() >= 2 * DELIMITER.length()
            && trimmed.startsWith(DELIMITER) && trimmed.endsWith(DELIMITER)) {
            return trimmed.substring(DELIMITER.length(), trimmed.length() - DELIMITER.length());
        }
        return trimmed;
    }

    /**
     * Returns true if {@code word} occurs in {@code text} as a whole identifier.
     *
     * @param text text to search
     * @param word identifier, possibly dotted
     * @return true if mentioned
     */
    public static boolean mentions(String text, String word) {
        if (text == null || word == null || word.isEmpty()) {
            return false;
        }
        Pattern pattern = Pattern.compile("(?<![\\w.])" + Pattern.quote(word) + "(?![\\w])");
        return pattern.matcher(text).find();
    }

    /**
     * Makes prose safe to place inside a {@code """} block.
     *
     * @param prose free text
     * @return text without triple quotes
     */
    public static String escape(String prose) {
        return prose.replace(DELIMITER, "\\\"\\\"\\\"");
    }

    public static int lineCount(String text) {
        return text.isEmpty() ? 0 : text.split("\r\n|\r|\n", -1).length;
    }

    private static boolean endsWithOddBackslashes(String inner) {
        int count = 0;
        for (int i = inner.length() - 1; i >= 0 && inner.charAt(i) == '\\'; i--) {
            count++;
        }
        return count % 2 == 1;
    }
}
