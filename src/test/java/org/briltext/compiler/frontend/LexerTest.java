package org.briltext.compiler.frontend;

import org.briltext.compiler.diagnostics.Diagnostic;
import org.briltext.compiler.diagnostics.DiagnosticsEngine;
import org.briltext.compiler.frontend.lexer.Lexer;
import org.briltext.compiler.frontend.lexer.Token;
import org.briltext.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts Bril source text into a stream of tokens,
 * discarding whitespace and comments.
 */
public class LexerTest {

    /**
     * Verifies that a typical instruction line is split into the expected tokens
     * and that the trailing comment is dropped.
     */
    @Test
    @Tag("unit")
    void testInstructionTokenization() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("v0: int = const -42; # load", diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER, TokenType.EQUALS,
                TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(tokens.get(5)).extracting(Token::text, Token::value).containsExactly("-42", -42L);
    }

    /**
     * Verifies that identifiers may start with '_' or '%' and contain dots and digits.
     */
    @Test
    @Tag("unit")
    void testIdentifierCharacters() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("%tmp.1 _x9 a.b.c", diagnostics).scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::text).containsExactly("%tmp.1", "_x9", "a.b.c", "");
    }

    /**
     * Verifies that a leading plus sign is accepted and the value is parsed.
     */
    @Test
    @Tag("unit")
    void testPositiveSignedNumber() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("+7", diagnostics).scanTokens();

        assertThat(tokens.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.NUMBER, 7L);
    }

    /**
     * Verifies that line and column numbers are tracked across lines.
     */
    @Test
    @Tag("unit")
    void testPositions() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = new Lexer("main {\n  ret;\n}", diagnostics, "prog.bril").scanTokens();

        // Assert
        Token ret = tokens.get(2);
        assertThat(ret.text()).isEqualTo("ret");
        assertThat(ret.line()).isEqualTo(2);
        assertThat(ret.column()).isEqualTo(3);
        assertThat(ret.fileName()).isEqualTo("prog.bril");
    }

    /**
     * Verifies that an integer literal outside the 64-bit range is reported as an error.
     */
    @Test
    @Tag("unit")
    void testIntegerOverflowIsReported() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        new Lexer("x: int = const 9223372036854775808;", diagnostics).scanTokens();

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).message()).contains("9223372036854775808");
    }

    /**
     * Verifies that characters outside the grammar are reported with their position.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacter() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        new Lexer("main {\n  x @ y;\n}", diagnostics, "bad.bril").scanTokens();

        // Assert
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.toString()).isEqualTo("bad.bril:2:5: error: Unexpected character: @");
        assertThat(error.message()).isEqualTo("Unexpected character: @");
        assertThat(error.lineNumber()).isEqualTo(2);
        assertThat(error.columnNumber()).isEqualTo(5);
    }
}
