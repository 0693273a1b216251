package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a signed integer literal.
 *
 * @param numberToken The token containing the number.
 */
public record NumberLiteralNode(
        Token numberToken
) implements LiteralNode {

    /**
     * Gets the value of the literal as lexed.
     * @return The 64-bit integer value.
     */
    public long getValue() {
        return (Long) numberToken.value();
    }

    @Override
    public Token anchor() {
        return numberToken;
    }
}
