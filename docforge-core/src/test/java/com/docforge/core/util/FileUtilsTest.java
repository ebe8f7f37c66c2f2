package com.docforge.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_recursive_returnsSortedMatchesFromSubdirectories() throws IOException {
        Path top = tempDir.resolve("b.py");
        Path nested = tempDir.resolve("pkg/a.py");
        Files.createDirectories(nested.getParent());
        Files.writeString(top, "x = 1");
        Files.writeString(nested, "y = 2");
        Files.writeString(tempDir.resolve("readme.txt"), "text");

        List<Path> files = FileUtils.findFiles(tempDir, FileUtils.PYTHON_GLOB, true);

        assertThat(files).containsExactly(top, nested);
    }

    @Test
    void findFiles_nonRecursive_ignoresSubdirectories() throws IOException {
        Path top = tempDir.resolve("main.py");
        Files.writeString(top, "x = 1");
        Files.createDirectories(tempDir.resolve("pkg"));
        Files.writeString(tempDir.resolve("pkg/mod.py"), "y = 2");

        List<Path> files = FileUtils.findFiles(tempDir, FileUtils.PYTHON_GLOB, false);

        assertThat(files).containsExactly(top);
    }

    @Test
    void findFiles_withNoMatches_returnsEmptyList() throws IOException {
        assertThat(FileUtils.findFiles(tempDir, FileUtils.PYTHON_GLOB, true)).isEmpty();
    }

    @Test
    void writeAtomically_replacesContentAndLeavesNoTempFiles() throws IOException {
        Path file = tempDir.resolve("module.py");
        Files.writeString(file, "old");

        FileUtils.writeAtomically(file, "new é");

        assertThat(FileUtils.readString(file)).isEqualTo("new é");
        try (var entries = Files.list(tempDir)) {
            assertThat(entries).containsExactly(file);
        }
    }

    @Test
    void fingerprint_returnsSha256Hex() {
        assertThat(FileUtils.fingerprint(""))
            .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(FileUtils.fingerprint("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void getExtension_withExtension_returnsExtension() {
        assertThat(FileUtils.getExtension(Path.of("pkg/module.py"))).isEqualTo("py");
        assertThat(FileUtils.getExtension(Path.of("archive.tar.gz"))).isEqualTo("gz");
    }

    @Test
    void getExtension_withoutExtension_returnsEmptyString() {
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".gitignore"))).isEmpty();
    }
}
