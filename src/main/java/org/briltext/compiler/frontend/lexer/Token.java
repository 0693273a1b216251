package org.briltext.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param value The processed value of the token (the {@code Long} value of a number), otherwise null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
}
