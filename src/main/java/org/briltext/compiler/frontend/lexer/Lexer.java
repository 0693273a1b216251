package org.briltext.compiler.frontend.lexer;

import org.briltext.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts Bril source text
 * into a sequence of tokens. Whitespace and {@code #} line comments are discarded.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source text as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source text as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being read, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source text.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '=': addToken(TokenType.EQUALS); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '-', '+':
                if (isDigit(peek())) {
                    number();
                } else {
                    reportError("Unexpected character: " + c);
                }
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                line++;
                lineStart = current;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    reportError("Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        String numberString = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(numberString));
        } catch (NumberFormatException e) {
            reportError("Integer literal out of range: " + numberString);
        }
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn, logicalFileName));
    }

    private void reportError(String message) {
        diagnostics.reportError(message, logicalFileName, tokenLine, tokenColumn);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isIdentifierStart(char c) {
        return isLetter(c) || c == '_' || c == '%';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || c == '.' || isDigit(c);
    }
}
