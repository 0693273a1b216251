package org.briltext.compiler.frontend.parser;

import org.briltext.compiler.diagnostics.DiagnosticsEngine;
import org.briltext.compiler.frontend.lexer.Token;
import org.briltext.compiler.frontend.lexer.TokenType;
import org.briltext.compiler.frontend.parser.ast.ArgNode;
import org.briltext.compiler.frontend.parser.ast.AstNode;
import org.briltext.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.briltext.compiler.frontend.parser.ast.ConstNode;
import org.briltext.compiler.frontend.parser.ast.EffectOpNode;
import org.briltext.compiler.frontend.parser.ast.IdentifierNode;
import org.briltext.compiler.frontend.parser.ast.LiteralNode;
import org.briltext.compiler.frontend.parser.ast.NumberLiteralNode;
import org.briltext.compiler.frontend.parser.ast.TypeNode;
import org.briltext.compiler.frontend.parser.ast.ValueOpNode;
import org.briltext.compiler.frontend.parser.features.function.FunctionNode;
import org.briltext.compiler.frontend.parser.features.importdir.ImportNode;
import org.briltext.compiler.frontend.parser.features.label.LabelNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The parser for the Bril text format. It consumes a list of tokens
 * from the {@link org.briltext.compiler.frontend.lexer.Lexer} and produces the concrete parse tree:
 * all {@link ImportNode}s first, followed by the {@link FunctionNode}s in source order.
 * <p>
 * Instructions inside a function body share leading tokens, so they are classified by an
 * ordered list of alternatives tried from the same position: constant, value operation,
 * effect operation, label. The first alternative that matches completely wins.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine}; the parser then skips to the next
 * instruction or function so that further errors can be reported in the same run.
 */
public class Parser {

    private static final String IMPORT_KEYWORD = "import";
    private static final String CONST_KEYWORD = "const";

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final List<Supplier<AstNode>> instructionAlternatives = List.of(
            this::constInstruction,
            this::valueOperation,
            this::effectOperation,
            this::label
    );
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The top-level nodes: imports followed by functions.
     */
    public List<AstNode> parse() {
        List<AstNode> nodes = new ArrayList<>();
        while (isImportStart()) {
            nodes.add(importDirective());
        }
        while (!isAtEnd()) {
            try {
                nodes.add(function());
            } catch (ParseError e) {
                synchronizeFunction();
            }
        }
        return nodes;
    }

    private boolean isImportStart() {
        return check(TokenType.IDENTIFIER)
                && IMPORT_KEYWORD.equals(peek().text())
                && checkAhead(1, TokenType.IDENTIFIER)
                && checkAhead(2, TokenType.SEMICOLON);
    }

    private ImportNode importDirective() {
        Token keyword = advance();
        Token moduleName = advance();
        advance();
        return new ImportNode(keyword, moduleName);
    }

    private FunctionNode function() {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name.");

        List<ArgNode> parameters = new ArrayList<>();
        while (check(TokenType.IDENTIFIER) || check(TokenType.LEFT_PAREN)) {
            parameters.add(parameter());
        }

        TypeNode returnType = null;
        if (match(TokenType.COLON)) {
            returnType = type();
        }

        if (IMPORT_KEYWORD.equals(name.text()) && check(TokenType.SEMICOLON)) {
            throw error(name, "Imports must precede all function definitions.");
        }
        consume(TokenType.LEFT_BRACE, "Expected '{' to open the body of function '" + name.text() + "'.");

        List<AstNode> body = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            try {
                body.add(instructionOrLabel());
            } catch (ParseError e) {
                synchronizeInstruction();
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close the body of function '" + name.text() + "'.");
        return new FunctionNode(name, parameters, returnType, body);
    }

    private ArgNode parameter() {
        if (match(TokenType.LEFT_PAREN)) {
            Token name = consume(TokenType.IDENTIFIER, "Expected parameter name after '('.");
            consume(TokenType.COLON, "Expected ':' after parameter name '" + name.text() + "'.");
            TypeNode type = type();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after the type of parameter '" + name.text() + "'.");
            return new ArgNode(name, type);
        }
        return new ArgNode(advance(), null);
    }

    private TypeNode type() {
        return new TypeNode(consume(TokenType.IDENTIFIER, "Expected a type name."));
    }

    private AstNode instructionOrLabel() {
        int mark = current;
        for (Supplier<AstNode> alternative : instructionAlternatives) {
            AstNode node = alternative.get();
            if (node != null) {
                return node;
            }
            current = mark;
        }
        Token unexpected = peek();
        throw error(unexpected, "Expected an instruction or label, but got '" + unexpected.text() + "'.");
    }

    /** {@code dest: type = const literal;} */
    private AstNode constInstruction() {
        Token dest = accept(TokenType.IDENTIFIER);
        if (dest == null || accept(TokenType.COLON) == null) return null;
        Token type = accept(TokenType.IDENTIFIER);
        if (type == null || accept(TokenType.EQUALS) == null) return null;
        Token keyword = accept(TokenType.IDENTIFIER);
        if (keyword == null || !CONST_KEYWORD.equals(keyword.text())) return null;
        LiteralNode value = literal();
        if (value == null || accept(TokenType.SEMICOLON) == null) return null;
        return new ConstNode(dest, new TypeNode(type), value);
    }

    /** {@code dest: type = op arg*;} */
    private AstNode valueOperation() {
        Token dest = accept(TokenType.IDENTIFIER);
        if (dest == null || accept(TokenType.COLON) == null) return null;
        Token type = accept(TokenType.IDENTIFIER);
        if (type == null || accept(TokenType.EQUALS) == null) return null;
        Token opcode = accept(TokenType.IDENTIFIER);
        if (opcode == null) return null;
        List<IdentifierNode> arguments = operands();
        if (accept(TokenType.SEMICOLON) == null) return null;
        return new ValueOpNode(dest, new TypeNode(type), opcode, arguments);
    }

    /** {@code op arg*;} */
    private AstNode effectOperation() {
        Token opcode = accept(TokenType.IDENTIFIER);
        if (opcode == null) return null;
        List<IdentifierNode> arguments = operands();
        if (accept(TokenType.SEMICOLON) == null) return null;
        return new EffectOpNode(opcode, arguments);
    }

    /** {@code name:} */
    private AstNode label() {
        Token name = accept(TokenType.IDENTIFIER);
        if (name == null || accept(TokenType.COLON) == null) return null;
        return new LabelNode(name);
    }

    private List<IdentifierNode> operands() {
        List<IdentifierNode> arguments = new ArrayList<>();
        while (check(TokenType.IDENTIFIER)) {
            arguments.add(new IdentifierNode(advance()));
        }
        return arguments;
    }

    private LiteralNode literal() {
        Token number = accept(TokenType.NUMBER);
        if (number != null) {
            return new NumberLiteralNode(number);
        }
        if (check(TokenType.IDENTIFIER) && ("true".equals(peek().text()) || "false".equals(peek().text()))) {
            return new BooleanLiteralNode(advance());
        }
        return null;
    }

    private void synchronizeInstruction() {
        while (!isAtEnd()) {
            if (check(TokenType.RIGHT_BRACE)) return;
            if (advance().type() == TokenType.SEMICOLON) return;
        }
    }

    private void synchronizeFunction() {
        while (!isAtEnd()) {
            if (advance().type() == TokenType.RIGHT_BRACE) return;
        }
    }

    private Token accept(TokenType type) {
        return check(type) ? advance() : null;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkAhead(int distance, TokenType type) {
        int index = current + distance;
        if (index >= tokens.size()) return false;
        return tokens.get(index).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, token.fileName(), token.line(), token.column());
        return new ParseError(message);
    }

    /**
     * Unwinds the parser to the nearest recovery point after an error has been reported.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
