package org.briltext.compiler.diagnostics;

/**
 * A single error found while reading Bril text, located by file, line and column.
 *
 * @param message The error message.
 * @param fileName The logical name of the source, e.g. a path or {@code <stdin>}.
 * @param lineNumber The 1-based line.
 * @param columnNumber The 1-based column.
 */
public record Diagnostic(
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    @Override
    public String toString() {
        return String.format("%s:%d:%d: error: %s", fileName, lineNumber, columnNumber, message);
    }
}
