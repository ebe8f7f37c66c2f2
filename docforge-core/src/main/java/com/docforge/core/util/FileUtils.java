package com.docforge.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    public static final String PYTHON_GLOB = "*.py";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files whose name matches a glob pattern, sorted by path.
     *
     * @param rootPath root directory to search from
     * @param fileNameGlob glob applied to the file name, e.g. {@code *.py}
     * @param recursive descend into subdirectories
     * @return matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String fileNameGlob, boolean recursive) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + fileNameGlob);

        try (Stream<Path> paths = Files.walk(rootPath, recursive ? Integer.MAX_VALUE : 1)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .sorted()
                .toList();
        }
    }

    /**
     * Reads a file as UTF-8 text.
     *
     * @param path path to file
     * @return file content
     * @throws IOException if reading fails or the content is not valid UTF-8
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Replaces a file's content so that readers see either the old or the new text.
     *
     * <p>The text goes to a temporary file in the same directory, which is then moved over
     * the target; filesystems without atomic moves get a plain replacing move.
     *
     * @param path target file
     * @param content new content
     * @throws IOException if writing or moving fails
     */
    public static void writeAtomically(Path path, String content) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path temp = Files.createTempFile(absolute.getParent(), "." + absolute.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * SHA-256 of the UTF-8 encoding of {@code text}, as lowercase hex.
     *
     * @param text content
     * @return 64-character fingerprint
     */
    public static String fingerprint(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
