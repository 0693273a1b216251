package org.briltext.compiler.frontend.parser.ast;

import org.briltext.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a type annotation, e.g. {@code int} in {@code x: int}.
 *
 * @param typeToken The token naming the type.
 */
public record TypeNode(
        Token typeToken
) implements AstNode {

    @Override
    public Token anchor() {
        return typeToken;
    }
}
