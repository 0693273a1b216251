package org.briltext.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Keywords such as {@code import}, {@code const}, {@code true} and {@code false}
 * are lexed as identifiers; the parser gives them meaning by position.
 */
public enum TokenType {
    // Single-character tokens.
    /** The ':' character, used for type annotations and labels. */
    COLON,
    /** The ';' character, terminating imports and instructions. */
    SEMICOLON,
    /** The '=' character, separating a typed destination from its operation. */
    EQUALS,
    /** The '{' character, opening a function body. */
    LEFT_BRACE,
    /** The '}' character, closing a function body. */
    RIGHT_BRACE,
    /** The '(' character, opening a typed argument. */
    LEFT_PAREN,
    /** The ')' character, closing a typed argument. */
    RIGHT_PAREN,

    // Literals.
    /** An identifier, such as a variable, label, type, opcode or function name. */
    IDENTIFIER,
    /** A signed decimal integer literal. */
    NUMBER,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE
}
