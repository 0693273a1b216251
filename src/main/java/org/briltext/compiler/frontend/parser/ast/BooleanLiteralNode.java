package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

/**
 * An AST node that represents one of the literals {@code true} or {@code false}.
 *
 * @param booleanToken The identifier token spelling the literal.
 */
public record BooleanLiteralNode(
        Token booleanToken
) implements LiteralNode {

    public boolean getValue() {
        return "true".equals(booleanToken.text());
    }

    @Override
    public Token anchor() {
        return booleanToken;
    }
}
