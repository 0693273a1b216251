package org.briltext.compiler.api;

import org.briltext.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when source text does not conform to the Bril text grammar.
 * Carries every diagnostic collected by the lexer and parser, not only the first one.
 */
public class SyntaxException extends BrilException {

    private final List<Diagnostic> diagnostics;

    /**
     * @param message The formatted summary of all diagnostics.
     * @param diagnostics The individual diagnostics.
     */
    public SyntaxException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused this exception.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
