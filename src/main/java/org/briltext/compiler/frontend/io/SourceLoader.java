package org.briltext.compiler.frontend.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes source loading for the text tools: local files and standard input.
 * Line endings are normalized to {@code \n}.
 */
public final class SourceLoader {

    /**
     * Result of loading a source.
     *
     * @param content     The source content.
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    /** Logical name used for content read from a stream. */
    public static final String STDIN_NAME = "<stdin>";

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path to read.
     * @return The loaded content and the path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return new LoadResult(normalizeLineEndings(content), logicalName);
    }

    /**
     * Reads a stream to its end. The stream is not closed.
     *
     * @param in The stream, typically standard input.
     * @return The loaded content named {@link #STDIN_NAME}.
     * @throws IOException If reading fails.
     */
    public static LoadResult loadStream(InputStream in) throws IOException {
        String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        return new LoadResult(normalizeLineEndings(content), STDIN_NAME);
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
