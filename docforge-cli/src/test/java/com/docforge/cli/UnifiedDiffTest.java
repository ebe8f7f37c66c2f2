package com.docforge.cli;

import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link UnifiedDiff}.
 */
class UnifiedDiffTest {

    @Test
    void diff_sameText_isEmpty() {
        assertThat(UnifiedDiff.diff("m.py", "a\nb\n", "a\nb\n")).isEmpty();
    }

    @Test
    void diff_onlyLineEndingsDiffer_isEmpty() {
        assertThat(UnifiedDiff.diff("m.py", "a\r\nb\r\n", "a\nb\n")).isEmpty();
    }

    @Test
    void diff_insertedDocstring_rendersSingleHunk() {
        String before = "def add(a, b):\n    return a + b\n";
        String after = "def add(a, b):\n    \"\"\"Add.\"\"\"\n    return a + b\n";

        assertThat(UnifiedDiff.diff("m.py", before, after)).isEqualTo("""
            --- a/m.py
            +++ b/m.py
            @@ -1,2 +1,3 @@
             def add(a, b):
            +    \"\"\"Add.\"\"\"
                 return a + b
            """);
    }

    @Test
    void diff_replacedLine_listsDeletionBeforeInsertion() {
        assertThat(UnifiedDiff.diff("m.py", "a\nb\nc\n", "a\nB\nc\n"))
            .endsWith("@@ -1,3 +1,3 @@\n a\n-b\n+B\n c\n");
    }

    @Test
    void diff_distantChanges_renderSeparateHunks() {
        String before = lines(1, 20);
        String after = before.replace("l2\n", "l2\nX\n").replace("l18\n", "l18\nY\n");

        String diff = UnifiedDiff.diff("m.py", before, after);

        assertThat(diff).isEqualTo("--- a/m.py\n+++ b/m.py\n"
            + "@@ -1,5 +1,6 @@\n l1\n l2\n+X\n l3\n l4\n l5\n"
            + "@@ -16,5 +17,6 @@\n l16\n l17\n l18\n+Y\n l19\n l20\n");
    }

    private static String lines(int from, int to) {
        return IntStream.rangeClosed(from, to).mapToObj(i -> "l" + i + "\n").collect(Collectors.joining());
    }
}
