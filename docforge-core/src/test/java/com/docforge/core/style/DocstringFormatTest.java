package com.docforge.core.style;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocstringFormat}.
 */
class DocstringFormatTest {

    @Test
    void isDelimited_singleBlock_returnsTrue() {
        assertThat(DocstringFormat.isDelimited("\"\"\"Summary.\"\"\"")).isTrue();
        assertThat(DocstringFormat.isDelimited("  \"\"\"Summary.\n\nMore.\n\"\"\"\n")).isTrue();
    }

    @Test
    void isDelimited_malformedBlocks_returnFalse() {
        assertThat(DocstringFormat.isDelimited(null)).isFalse();
        assertThat(DocstringFormat.isDelimited("Summary.")).isFalse();
        assertThat(DocstringFormat.isDelimited("\"\"\"")).isFalse();
        assertThat(DocstringFormat.isDelimited("\"\"\"One.\"\"\" \"\"\"Two.\"\"\"")).isFalse();
        assertThat(DocstringFormat.isDelimited("\"\"\"Ends with quote\"\"\"\"")).isFalse();
        assertThat(DocstringFormat.isDelimited("\"\"\"Path C:\\\"\"\"")).isFalse();
    }

    @Test
    void body_stripsDelimiters() {
        assertThat(DocstringFormat.body("\"\"\"Text.\"\"\"")).isEqualTo("Text.");
        assertThat(DocstringFormat.body("plain")).isEqualTo("plain");
    }

    @Test
    void mentions_matchesWholeIdentifiersOnly() {
        assertThat(DocstringFormat.mentions("a (int): First.", "a")).isTrue();
        assertThat(DocstringFormat.mentions("*args (tuple): Rest.", "args")).isTrue();
        assertThat(DocstringFormat.mentions("data: values.", "a")).isFalse();
        assertThat(DocstringFormat.mentions("count_all: x", "count")).isFalse();
        assertThat(DocstringFormat.mentions("errors.ParseError: bad", "ParseError")).isFalse();
        assertThat(DocstringFormat.mentions("errors.ParseError: bad", "errors.ParseError")).isTrue();
        assertThat(DocstringFormat.mentions(null, "x")).isFalse();
    }

    @Test
    void lineCount_countsAllLineBreakStyles() {
        assertThat(DocstringFormat.lineCount("")).isZero();
        assertThat(DocstringFormat.lineCount("one")).isEqualTo(1);
        assertThat(DocstringFormat.lineCount("one\r\ntwo\rthree\n")).isEqualTo(4);
    }
}
