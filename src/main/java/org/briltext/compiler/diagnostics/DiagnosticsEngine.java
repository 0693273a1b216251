package org.briltext.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors of one translation run. The lexer, parser and tree transformer
 * report into a shared engine and keep going; the caller checks {@link #hasErrors()}
 * between phases and raises a single exception carrying every error.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records an error at the given source position.
     */
    public void reportError(String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(message, fileName, lineNumber, columnNumber));
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return The errors in the order they were reported, unmodifiable.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Formats every error on its own line, as {@code file:line:col: error: message}.
     *
     * @return The formatted errors, empty if there are none.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
